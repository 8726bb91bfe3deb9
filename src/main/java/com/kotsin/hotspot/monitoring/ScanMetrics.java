package com.kotsin.hotspot.monitoring;

import com.kotsin.hotspot.model.EventCategory;
import com.kotsin.hotspot.model.ScanStats;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ScanMetrics - In-process counters for scans and merges
 *
 * Provides:
 * - Global counters for points, clusters and event outcomes
 * - Scan counts by category
 * - A snapshot for the health endpoint
 */
@Component
@Slf4j
public class ScanMetrics {

    // ==================== GLOBAL COUNTERS ====================
    private final AtomicLong totalScans = new AtomicLong(0);
    private final AtomicLong failedScans = new AtomicLong(0);
    private final AtomicLong totalPoints = new AtomicLong(0);
    private final AtomicLong droppedPoints = new AtomicLong(0);
    private final AtomicLong totalClusters = new AtomicLong(0);
    private final AtomicLong eventsCreated = new AtomicLong(0);
    private final AtomicLong eventsMatched = new AtomicLong(0);
    private final AtomicLong duplicateRescans = new AtomicLong(0);
    private final AtomicLong eventsEvicted = new AtomicLong(0);
    private final AtomicLong notificationsEmitted = new AtomicLong(0);
    private final AtomicLong totalDurationMs = new AtomicLong(0);

    // ==================== COUNTERS BY CATEGORY ====================
    private final Map<String, AtomicLong> scansByCategory = new ConcurrentHashMap<>();

    // ==================== INCREMENT METHODS ====================

    public void recordScan(EventCategory category, ScanStats stats) {
        totalScans.incrementAndGet();
        totalPoints.addAndGet(stats.getPointsReceived());
        droppedPoints.addAndGet(stats.getPointsDropped());
        totalClusters.addAndGet(stats.getClusters());
        eventsCreated.addAndGet(stats.getCreated());
        eventsMatched.addAndGet(stats.getMatched());
        duplicateRescans.addAndGet(stats.getDuplicates());
        eventsEvicted.addAndGet(stats.getEvicted());
        notificationsEmitted.addAndGet(stats.getNotifications());
        totalDurationMs.addAndGet(stats.getDurationMs());
        scansByCategory.computeIfAbsent(category.getWireValue(), k -> new AtomicLong(0)).incrementAndGet();
    }

    public void recordFailure() {
        failedScans.incrementAndGet();
    }

    // ==================== GETTER METHODS ====================

    public long getTotalScans() {
        return totalScans.get();
    }

    public long getFailedScans() {
        return failedScans.get();
    }

    public long getNotificationsEmitted() {
        return notificationsEmitted.get();
    }

    public double getAverageDurationMs() {
        long scans = totalScans.get();
        return scans > 0 ? (double) totalDurationMs.get() / scans : 0;
    }

    public Map<String, Long> getScansByCategory() {
        Map<String, Long> result = new ConcurrentHashMap<>();
        scansByCategory.forEach((k, v) -> result.put(k, v.get()));
        return result;
    }

    // ==================== SNAPSHOT FOR API ====================

    public Snapshot getSnapshot() {
        return Snapshot.builder()
                .totalScans(totalScans.get())
                .failedScans(failedScans.get())
                .totalPoints(totalPoints.get())
                .droppedPoints(droppedPoints.get())
                .totalClusters(totalClusters.get())
                .eventsCreated(eventsCreated.get())
                .eventsMatched(eventsMatched.get())
                .duplicateRescans(duplicateRescans.get())
                .eventsEvicted(eventsEvicted.get())
                .notificationsEmitted(notificationsEmitted.get())
                .averageDurationMs(getAverageDurationMs())
                .scansByCategory(getScansByCategory())
                .build();
    }

    // ==================== RESET ====================

    public void reset() {
        totalScans.set(0);
        failedScans.set(0);
        totalPoints.set(0);
        droppedPoints.set(0);
        totalClusters.set(0);
        eventsCreated.set(0);
        eventsMatched.set(0);
        duplicateRescans.set(0);
        eventsEvicted.set(0);
        notificationsEmitted.set(0);
        totalDurationMs.set(0);
        scansByCategory.clear();
        log.info("ScanMetrics reset");
    }

    @Data
    @Builder
    public static class Snapshot {
        private long totalScans;
        private long failedScans;
        private long totalPoints;
        private long droppedPoints;
        private long totalClusters;
        private long eventsCreated;
        private long eventsMatched;
        private long duplicateRescans;
        private long eventsEvicted;
        private long notificationsEmitted;
        private double averageDurationMs;
        private Map<String, Long> scansByCategory;
    }
}
