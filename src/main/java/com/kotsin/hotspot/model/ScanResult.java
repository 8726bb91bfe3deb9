package com.kotsin.hotspot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * ScanResult - Outcome of one scan: the merged event set plus emitted alerts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanResult {

    private EventCategory category;
    private String regionKey;
    private Instant scannedAt;

    @Builder.Default
    private List<TrackedEvent> events = new ArrayList<>();

    @Builder.Default
    private List<AlertNotification> notifications = new ArrayList<>();

    private ScanStats stats;
}
