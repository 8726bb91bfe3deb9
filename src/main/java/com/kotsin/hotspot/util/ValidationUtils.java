package com.kotsin.hotspot.util;

import com.kotsin.hotspot.model.DetectionPoint;
import com.kotsin.hotspot.model.EventCategory;
import com.kotsin.hotspot.model.ScanRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Utility class for boundary validation of raw input
 *
 * Everything accepted from outside (REST, Kafka, persisted JSON) passes through here
 * before it reaches the merge core.
 */
public final class ValidationUtils {

    private ValidationUtils() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * A detection is usable when it is non-null and has finite coordinates.
     */
    public static boolean isValid(DetectionPoint point) {
        return Objects.nonNull(point) && point.hasFiniteLocation();
    }

    /**
     * Keep only usable detections, preserving input order.
     */
    public static List<DetectionPoint> usableDetections(List<DetectionPoint> points) {
        List<DetectionPoint> out = new ArrayList<>();
        if (points == null) {
            return out;
        }
        for (DetectionPoint point : points) {
            if (isValid(point)) {
                out.add(point);
            }
        }
        return out;
    }

    /**
     * Validate the addressing fields of a scan request.
     *
     * @return the parsed category
     * @throws IllegalArgumentException when category or region is missing or unknown
     */
    public static EventCategory requireScanTarget(ScanRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Scan request is required");
        }
        if (isNullOrEmpty(request.getRegionKey())) {
            throw new IllegalArgumentException("regionKey is required");
        }
        return requireCategory(request.getCategory());
    }

    /**
     * @throws IllegalArgumentException when the value names no known category
     */
    public static EventCategory requireCategory(String value) {
        if (isNullOrEmpty(value)) {
            throw new IllegalArgumentException("category is required");
        }
        EventCategory category = EventCategory.fromWire(value);
        if (category == null) {
            throw new IllegalArgumentException("Unknown category: " + value);
        }
        return category;
    }

    /**
     * Check if string is null or empty
     */
    public static boolean isNullOrEmpty(String str) {
        return Objects.isNull(str) || str.trim().isEmpty();
    }
}
