package com.kotsin.hotspot.monitoring;

import com.kotsin.hotspot.model.EventCategory;
import com.kotsin.hotspot.model.ScanStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ScanMetrics")
class ScanMetricsTest {

    private ScanMetrics metrics;

    @BeforeEach
    void setUp() {
        metrics = new ScanMetrics();
    }

    @Test
    @DisplayName("Scans accumulate into totals and per-category counts")
    void testRecordScan() {
        metrics.recordScan(EventCategory.FIRE, ScanStats.builder()
                .pointsReceived(10).pointsDropped(1).clusters(2).created(2).notifications(1).durationMs(40).build());
        metrics.recordScan(EventCategory.FIRE, ScanStats.builder()
                .pointsReceived(8).clusters(2).matched(2).duplicates(2).durationMs(20).build());
        metrics.recordScan(EventCategory.FLOOD, ScanStats.builder().evicted(3).durationMs(0).build());

        ScanMetrics.Snapshot snapshot = metrics.getSnapshot();
        assertEquals(3, snapshot.getTotalScans());
        assertEquals(18, snapshot.getTotalPoints());
        assertEquals(1, snapshot.getDroppedPoints());
        assertEquals(4, snapshot.getTotalClusters());
        assertEquals(2, snapshot.getEventsCreated());
        assertEquals(2, snapshot.getEventsMatched());
        assertEquals(2, snapshot.getDuplicateRescans());
        assertEquals(3, snapshot.getEventsEvicted());
        assertEquals(1, snapshot.getNotificationsEmitted());
        assertEquals(20.0, snapshot.getAverageDurationMs(), 1e-9);
        assertEquals(2L, (long) snapshot.getScansByCategory().get("fire"));
        assertEquals(1L, (long) snapshot.getScansByCategory().get("flood"));
    }

    @Test
    @DisplayName("Reset clears every counter")
    void testReset() {
        metrics.recordScan(EventCategory.FIRE, ScanStats.builder().durationMs(5).build());
        metrics.recordFailure();

        metrics.reset();

        assertEquals(0, metrics.getTotalScans());
        assertEquals(0, metrics.getFailedScans());
        assertEquals(0.0, metrics.getAverageDurationMs(), 1e-9);
        assertTrue(metrics.getScansByCategory().isEmpty());
    }
}
