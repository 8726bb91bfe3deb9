package com.kotsin.hotspot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counters describing one merge.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanStats {

    private int pointsReceived;
    private int pointsDropped;
    private int clusters;
    private int created;
    private int matched;
    private int duplicates;
    private int stale;
    private int evicted;
    private int notifications;
    private long durationMs;
}
