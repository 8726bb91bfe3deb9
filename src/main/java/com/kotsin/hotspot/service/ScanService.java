package com.kotsin.hotspot.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.kotsin.hotspot.audit.ScanAuditService;
import com.kotsin.hotspot.cluster.SpatialClusterer;
import com.kotsin.hotspot.config.TrackingProperties;
import com.kotsin.hotspot.geocode.PlaceNameResolver;
import com.kotsin.hotspot.infrastructure.kafka.ScanOutputPublisher;
import com.kotsin.hotspot.model.Cluster;
import com.kotsin.hotspot.model.DetectionPoint;
import com.kotsin.hotspot.model.EventCategory;
import com.kotsin.hotspot.model.ScanRequest;
import com.kotsin.hotspot.model.ScanResult;
import com.kotsin.hotspot.model.ScanStats;
import com.kotsin.hotspot.model.TrackedEvent;
import com.kotsin.hotspot.monitoring.ScanMetrics;
import com.kotsin.hotspot.retry.RetryHandler;
import com.kotsin.hotspot.store.EventStoreRepository;
import com.kotsin.hotspot.store.StorePersistenceException;
import com.kotsin.hotspot.tracking.ScanMerger;
import com.kotsin.hotspot.util.ValidationUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * ScanService - Runs one scan for a (category, region) pair.
 *
 * SCAN FLOW:
 * ┌──────────────────────────────────────────────────────────────┐
 * │  validate → cluster → name clusters (capped, best effort)    │
 * │  ─── per-key lock ───────────────────────────────────────────│
 * │  load previous store → merge → save (retried)                │
 * │  ─────────────────────────────────────────────────────────── │
 * │  publish notifications + event set → audit → metrics         │
 * └──────────────────────────────────────────────────────────────┘
 *
 * A failed save aborts the scan before anything is published; the
 * previously persisted store is left as it was.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScanService {

    private final SpatialClusterer clusterer;
    private final ScanMerger merger;
    private final EventStoreRepository repository;
    private final PlaceNameResolver placeNameResolver;
    private final ScanOutputPublisher publisher;
    private final ScanAuditService auditService;
    private final ScanMetrics metrics;
    private final RetryHandler retryHandler;
    private final TrackingProperties properties;
    private final Clock clock;

    // Weak values: a key's lock is collected once no scan holds or waits on it.
    private final Cache<String, ReentrantLock> keyLocks = Caffeine.newBuilder().weakValues().build();

    // ======================== SCANS ========================

    /**
     * Runs one scan. category and regionKey override whatever the request carries.
     *
     * @throws IllegalArgumentException  when category or regionKey is missing or unknown
     * @throws StorePersistenceException when the merged store could not be saved
     */
    public ScanResult scan(String categoryValue, String regionKey, ScanRequest request) {
        ScanRequest target = (request == null ? ScanRequest.builder().build() : request).toBuilder()
                .category(categoryValue)
                .regionKey(regionKey)
                .build();
        EventCategory category = ValidationUtils.requireScanTarget(target);

        Instant started = clock.instant();
        List<DetectionPoint> points = target.getPoints() == null ? Collections.emptyList() : target.getPoints();
        int usable = ValidationUtils.usableDetections(points).size();

        List<Cluster> clusters = clusterer.cluster(points,
                epsKmFor(target), minPtsFor(target), properties.isIncludeNoiseAsSingleEvents());
        clusters = withPlaceNames(clusters);

        ScanMerger.MergeOutcome outcome;
        ReentrantLock lock = lockFor(category, regionKey);
        lock.lock();
        try {
            Instant now = clock.instant();
            List<TrackedEvent> previous = repository.load(category, regionKey);
            outcome = merger.merge(new ScanMerger.MergeRequest(
                    category, regionKey, target.getRegionLabel(), previous, clusters, now,
                    Duration.ofHours(properties.getKeepStaleHours())));
            persist(category, regionKey, outcome.events(), started);
        } finally {
            lock.unlock();
        }

        ScanStats stats = ScanStats.builder()
                .pointsReceived(points.size())
                .pointsDropped(points.size() - usable)
                .clusters(clusters.size())
                .created(outcome.created())
                .matched(outcome.matched())
                .duplicates(outcome.duplicates())
                .stale(outcome.stale())
                .evicted(outcome.evicted())
                .notifications(outcome.notifications().size())
                .durationMs(Duration.between(started, clock.instant()).toMillis())
                .build();

        ScanResult result = ScanResult.builder()
                .category(category)
                .regionKey(regionKey)
                .scannedAt(started)
                .events(outcome.events())
                .notifications(outcome.notifications())
                .stats(stats)
                .build();

        publisher.publishNotifications(outcome.notifications());
        publisher.publishResult(result);
        auditService.recordSuccess(result, outcome.events().size());
        metrics.recordScan(category, stats);

        log.info("[SCAN] {}:{} | points={} dropped={} | clusters={} | created={} matched={} dup={} stale={} evicted={} | notify={} | {}ms",
                category.getWireValue(), regionKey, stats.getPointsReceived(), stats.getPointsDropped(),
                stats.getClusters(), stats.getCreated(), stats.getMatched(), stats.getDuplicates(),
                stats.getStale(), stats.getEvicted(), stats.getNotifications(), stats.getDurationMs());
        return result;
    }

    /**
     * Merges an empty batch: ages, marks stale and evicts without new detections.
     */
    public ScanResult refresh(String categoryValue, String regionKey, String regionLabel) {
        return scan(categoryValue, regionKey, ScanRequest.builder()
                .regionLabel(regionLabel)
                .points(new ArrayList<>())
                .build());
    }

    // ======================== QUERIES ========================

    public List<TrackedEvent> currentEvents(String categoryValue, String regionKey) {
        EventCategory category = ValidationUtils.requireCategory(categoryValue);
        if (ValidationUtils.isNullOrEmpty(regionKey)) {
            throw new IllegalArgumentException("regionKey is required");
        }
        return repository.load(category, regionKey);
    }

    public Optional<TrackedEvent> findEvent(String categoryValue, String regionKey, String eventId) {
        return currentEvents(categoryValue, regionKey).stream()
                .filter(e -> e.getId().equals(eventId))
                .findFirst();
    }

    // ======================== HELPERS ========================

    private void persist(EventCategory category, String regionKey, List<TrackedEvent> events, Instant started) {
        try {
            retryHandler.executeWithRetry(
                    () -> repository.save(category, regionKey, events),
                    "save-events:" + category.getWireValue() + ":" + regionKey);
        } catch (RuntimeException e) {
            metrics.recordFailure();
            auditService.recordFailure(category, regionKey, started, e);
            log.error("[EVENT_STORE] Failed to persist {} events for {}:{}: {}",
                    events.size(), category.getWireValue(), regionKey, e.getMessage());
            throw e instanceof StorePersistenceException
                    ? (StorePersistenceException) e
                    : new StorePersistenceException("Failed to persist events for "
                            + category.getWireValue() + ":" + regionKey, e);
        }
    }

    /**
     * Resolves place names for the first max-geocode-per-scan clusters.
     */
    private List<Cluster> withPlaceNames(List<Cluster> clusters) {
        int budget = Math.max(0, properties.getMaxGeocodePerScan());
        List<Cluster> named = new ArrayList<>(clusters.size());
        for (int i = 0; i < clusters.size(); i++) {
            Cluster cluster = clusters.get(i);
            if (i < budget) {
                Optional<String> name = resolvePlaceName(cluster);
                if (name.isPresent()) {
                    cluster = cluster.toBuilder().placeName(name.get()).build();
                }
            }
            named.add(cluster);
        }
        return named;
    }

    private Optional<String> resolvePlaceName(Cluster cluster) {
        try {
            return placeNameResolver.resolve(cluster.getLatitude(), cluster.getLongitude());
        } catch (RuntimeException e) {
            log.warn("[GEOCODE] Lookup failed for {}: {}", cluster.getId(), e.getMessage());
            return Optional.empty();
        }
    }

    private double epsKmFor(ScanRequest request) {
        Double eps = request.getEpsKm();
        return eps != null && eps > 0 && Double.isFinite(eps) ? eps : properties.getEpsKm();
    }

    private int minPtsFor(ScanRequest request) {
        Integer minPts = request.getMinPts();
        return minPts != null && minPts > 0 ? minPts : properties.getMinPts();
    }

    ReentrantLock lockFor(EventCategory category, String regionKey) {
        return keyLocks.get(category.getWireValue() + ":" + regionKey, k -> new ReentrantLock());
    }
}
