package com.kotsin.hotspot.controller;

import com.kotsin.hotspot.camera.CameraRegistry;
import com.kotsin.hotspot.geocode.CachingPlaceNameResolver;
import com.kotsin.hotspot.monitoring.ScanMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Liveness check and scan counters.
 */
@RestController
@RequestMapping("/api/v1/health")
@Slf4j
@RequiredArgsConstructor
public class HealthController {

    private final ScanMetrics scanMetrics;
    private final CameraRegistry cameraRegistry;
    private final CachingPlaceNameResolver placeNameCache;

    /**
     * Liveness check - Is the application running?
     */
    @GetMapping("/live")
    public ResponseEntity<Map<String, Object>> liveness() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        response.put("timestamp", System.currentTimeMillis());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/metrics")
    public ResponseEntity<Map<String, Object>> metrics() {
        Map<String, Object> response = new HashMap<>();
        response.put("timestamp", System.currentTimeMillis());
        response.put("scans", scanMetrics.getSnapshot());
        response.put("cameras", cameraRegistry.size());

        Map<String, Object> geocode = new HashMap<>();
        geocode.put("cachedNames", placeNameCache.cachedNames());
        geocode.put("hitRate", placeNameCache.hitRate());
        response.put("geocode", geocode);

        return ResponseEntity.ok(response);
    }
}
