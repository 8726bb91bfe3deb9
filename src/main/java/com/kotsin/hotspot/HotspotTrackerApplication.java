package com.kotsin.hotspot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot application that clusters satellite hotspot detections into
 * tracked events and reconciles them across scans.
 */
@SpringBootApplication
public class HotspotTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(HotspotTrackerApplication.class, args);
    }
}
