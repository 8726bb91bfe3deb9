package com.kotsin.hotspot.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * TrackedEvent - The durable entity that outlives individual scans.
 *
 * Invariants:
 * - id is assigned once at creation and never changes
 * - firstSeen ≤ every history t ≤ lastSeen
 * - history is non-decreasing in time and bounded (oldest evicted)
 *
 * Updates are done by replacement (toBuilder), never by mutating a stored instance.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TrackedEvent {

    // ======================== IDENTITY ========================

    private String id;

    private EventCategory category;

    /**
     * Display label: resolved place name or the region label
     */
    private String location;

    private double latitude;
    private double longitude;

    // ======================== CLASSIFICATION ========================

    private Severity severity;

    private EventStatus status;

    private EvacuationLevel evacuationLevel;

    private EventTrend trend;

    private boolean stale;

    // ======================== METRICS ========================

    private Integer focusCount;
    private Double frpSum;
    private Double frpMax;

    // ======================== TIMING ========================

    /**
     * First scan that saw this event. Immutable once set.
     */
    private Instant firstSeen;

    /**
     * Last scan that matched this event
     */
    private Instant lastSeen;

    /**
     * Earliest member acquisition time of the latest matching cluster
     */
    private Instant detectedFrom;

    /**
     * Latest member acquisition time of the latest matching cluster
     */
    private Instant lastDetectedAt;

    private int scanCount;

    @Builder.Default
    private List<HistoryPoint> history = new ArrayList<>();

    // ======================== PRESENTATION ========================

    private String title;

    private String description;

    @Builder.Default
    private List<String> riskIndicators = new ArrayList<>();

    private String liveFeedUrl;

    private EventInsight insight;

    /**
     * Most recent history snapshot, or null when history is empty.
     */
    public HistoryPoint latestSnapshot() {
        if (history == null || history.isEmpty()) {
            return null;
        }
        return history.get(history.size() - 1);
    }
}
