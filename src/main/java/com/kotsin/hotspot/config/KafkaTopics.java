package com.kotsin.hotspot.config;

/**
 * Kafka topic names used by the tracker.
 */
public final class KafkaTopics {

    private KafkaTopics() {
        throw new UnsupportedOperationException("Constants class");
    }

    // ========== INPUT ==========

    /**
     * ScanRequest JSON, one batch of detections per record
     */
    public static final String SCAN_REQUESTS = "hotspot-scan-requests";

    // ========== OUTPUT ==========

    /**
     * AlertNotification JSON keyed by eventId
     */
    public static final String NOTIFICATIONS = "hotspot-notifications";

    /**
     * Merged event set keyed by "{category}:{regionKey}"
     */
    public static final String EVENTS = "hotspot-events";
}
