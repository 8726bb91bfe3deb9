package com.kotsin.hotspot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Tracking configuration (prefix "tracking").
 *
 * Defaults mirror {@link ProcessingConstants}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "tracking")
public class TrackingProperties {

    // ========== CLUSTERING ==========

    /**
     * DBSCAN neighbourhood radius in kilometres
     */
    private double epsKm = ProcessingConstants.DEFAULT_EPS_KM;

    /**
     * Minimum neighbourhood size (self included) for a core point
     */
    private int minPts = ProcessingConstants.DEFAULT_MIN_PTS;

    /**
     * Emit unclustered detections as singleton clusters
     */
    private boolean includeNoiseAsSingleEvents = true;

    // ========== IDENTITY & RETENTION ==========

    private double maxMatchKm = ProcessingConstants.DEFAULT_MAX_MATCH_KM;

    private int keepStaleHours = ProcessingConstants.DEFAULT_KEEP_STALE_HOURS;

    private int historyCap = ProcessingConstants.DEFAULT_HISTORY_CAP;

    /**
     * Rescans of an event within this many seconds of its latest snapshot add no history
     */
    private long duplicateWindowSeconds = ProcessingConstants.DEFAULT_DUPLICATE_WINDOW.getSeconds();

    // ========== GEOCODING ==========

    private int maxGeocodePerScan = ProcessingConstants.DEFAULT_MAX_GEOCODE_PER_SCAN;

    // ========== NESTED ==========

    private Notification notification = new Notification();

    private Store store = new Store();

    private Publish publish = new Publish();

    @Data
    public static class Notification {
        private String title = "Hotspot Alert";
        private String url = "/";
    }

    @Data
    public static class Store {
        /**
         * "redis" or "memory"
         */
        private String type = "redis";
        private String keyPrefix = "hotspot:events";
    }

    @Data
    public static class Publish {
        private boolean enabled = true;
    }
}
