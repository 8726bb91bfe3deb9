package com.kotsin.hotspot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Cluster - One spatial group of detections from a single scan.
 *
 * Ephemeral: produced by the clusterer, consumed by identity resolution.
 * The observation window (firstSeen/lastSeen) is null when no member
 * acquisition time could be parsed.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Cluster {

    /**
     * Synthetic per-scan id ("cluster-0", "single-3")
     */
    private String id;

    private double latitude;
    private double longitude;

    private int focusCount;
    private double frpMax;
    private double frpSum;

    private Severity severity;

    private Instant firstSeen;
    private Instant lastSeen;

    /**
     * Resolved place name, when a lookup produced one
     */
    private String placeName;

    @Builder.Default
    private List<DetectionPoint> members = new ArrayList<>();

    public boolean isSingleton() {
        return focusCount == 1;
    }
}
