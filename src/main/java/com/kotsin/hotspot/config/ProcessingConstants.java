package com.kotsin.hotspot.config;

import java.time.Duration;

/**
 * Central constants for hotspot clustering and event tracking.
 *
 * Defaults here back the tracking.* properties; the rule thresholds are fixed.
 */
public final class ProcessingConstants {

    private ProcessingConstants() {
        throw new UnsupportedOperationException("Constants class");
    }

    // ========== CLUSTERING DEFAULTS ==========

    public static final double DEFAULT_EPS_KM = 10.0;
    public static final int DEFAULT_MIN_PTS = 4;

    // ========== SEVERITY THRESHOLDS (FRP, MW) ==========

    public static final double CRITICAL_FRP_MAX = 50.0;
    public static final double CRITICAL_FRP_SUM = 200.0;
    public static final double HIGH_FRP_MAX = 20.0;
    public static final double HIGH_FRP_SUM = 80.0;
    public static final double MODERATE_FRP_MAX = 5.0;
    public static final double MODERATE_FRP_SUM = 20.0;

    // ========== IDENTITY & RETENTION ==========

    public static final double DEFAULT_MAX_MATCH_KM = 25.0;
    public static final int DEFAULT_KEEP_STALE_HOURS = 72;
    public static final int DEFAULT_HISTORY_CAP = 40;
    public static final Duration DEFAULT_DUPLICATE_WINDOW = Duration.ofSeconds(30);

    // ========== TREND ==========

    public static final double TREND_FRP_MAX_WEIGHT = 0.6;
    public static final double TREND_FOCUS_COUNT_WEIGHT = 0.25;
    public static final double TREND_CHANGE_THRESHOLD = 0.15;

    // ========== LIFECYCLE (hours since last detection) ==========

    public static final double RESOLVED_AFTER_HOURS = 48.0;
    public static final double CONTAINED_AFTER_HOURS = 18.0;
    public static final double STABILIZING_AFTER_HOURS = 6.0;

    // ========== GEOCODING ==========

    public static final int DEFAULT_MAX_GEOCODE_PER_SCAN = 35;
    public static final int GEOCODE_CACHE_MAX_SIZE = 5000;
    public static final Duration GEOCODE_CACHE_TTL = Duration.ofDays(7);

    // ========== RETRY CONSTANTS ==========

    public static final int MAX_RETRY_ATTEMPTS = 3;
    public static final long INITIAL_RETRY_DELAY_MS = 100;
    public static final double RETRY_BACKOFF_MULTIPLIER = 2.0;
    public static final long MAX_RETRY_DELAY_MS = 2000;

    // ========== TIME CONVERSION ==========

    public static final double MILLIS_PER_HOUR = 3_600_000.0;
}
