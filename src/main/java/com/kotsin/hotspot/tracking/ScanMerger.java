package com.kotsin.hotspot.tracking;

import com.kotsin.hotspot.model.AlertNotification;
import com.kotsin.hotspot.model.Cluster;
import com.kotsin.hotspot.model.EventCategory;
import com.kotsin.hotspot.model.EventStatus;
import com.kotsin.hotspot.model.EventTrend;
import com.kotsin.hotspot.model.HistoryPoint;
import com.kotsin.hotspot.model.Severity;
import com.kotsin.hotspot.model.TrackedEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * ScanMerger - Reconciles one scan's clusters with the previously tracked events
 * of a (category, region) store.
 *
 * MERGE FLOW:
 * ┌─────────────────────────────────────────────────────────────┐
 * │  for each cluster (input order):                            │
 * │     resolve identity against unclaimed previous events      │
 * │     matched → append snapshot (unless duplicate rescan),    │
 * │               lastSeen=now, scanCount+1, trend, status,     │
 * │               notification vs. the pre-update state         │
 * │     new     → firstSeen=lastSeen=now, scanCount=1           │
 * │  for each previous event not matched:                       │
 * │     age(lastSeen) > keepStale → evicted                     │
 * │     otherwise               → stale=true, status recomputed │
 * │  sort: fresh before stale, severity desc, id asc            │
 * └─────────────────────────────────────────────────────────────┘
 *
 * Pure with respect to its inputs: the previous store is never mutated and
 * the caller persists the returned event set.
 */
@Slf4j
public class ScanMerger {

    static final Comparator<TrackedEvent> OUTPUT_ORDER = Comparator
            .comparing(TrackedEvent::isStale)
            .thenComparing((TrackedEvent e) -> Severity.rankOf(e.getSeverity()), Comparator.reverseOrder())
            .thenComparing(TrackedEvent::getId);

    private final IdentityResolver identityResolver;
    private final TrendEngine trendEngine;
    private final LifecycleStateMachine lifecycle;
    private final NotificationPolicy notificationPolicy;
    private final EventPresenter presenter;
    private final EventIdGenerator idGenerator;
    private final int historyCap;
    private final Duration duplicateWindow;

    public ScanMerger(IdentityResolver identityResolver,
                      TrendEngine trendEngine,
                      LifecycleStateMachine lifecycle,
                      NotificationPolicy notificationPolicy,
                      EventPresenter presenter,
                      EventIdGenerator idGenerator,
                      int historyCap,
                      Duration duplicateWindow) {
        this.identityResolver = identityResolver;
        this.trendEngine = trendEngine;
        this.lifecycle = lifecycle;
        this.notificationPolicy = notificationPolicy;
        this.presenter = presenter;
        this.idGenerator = idGenerator;
        this.historyCap = historyCap;
        this.duplicateWindow = duplicateWindow;
    }

    public MergeOutcome merge(MergeRequest request) {
        Instant now = request.now();
        Map<String, TrackedEvent> previous = indexById(request.previous());
        Map<String, TrackedEvent> merged = new LinkedHashMap<>();
        Set<String> claimed = new HashSet<>();
        List<AlertNotification> notifications = new ArrayList<>();

        int created = 0;
        int matched = 0;
        int duplicates = 0;
        int stale = 0;
        int evicted = 0;

        for (Cluster cluster : request.clusters()) {
            List<TrackedEvent> available = new ArrayList<>();
            for (TrackedEvent candidate : previous.values()) {
                if (!claimed.contains(candidate.getId())) {
                    available.add(candidate);
                }
            }

            Optional<IdentityResolver.Match> match = identityResolver.resolve(
                    available, request.category(), cluster.getLatitude(), cluster.getLongitude());

            if (match.isPresent()) {
                TrackedEvent before = match.get().event();
                claimed.add(before.getId());

                boolean duplicate = isDuplicateRescan(before, now);
                TrackedEvent after = presenter.present(update(before, cluster, request, duplicate), now);
                merged.put(after.getId(), after);
                matched++;
                if (duplicate) {
                    duplicates++;
                }

                notificationPolicy.notificationFor(before, after, request.regionKey(), now)
                        .ifPresent(notifications::add);

                log.debug("[MERGE] {} matched {} at {}km | sev {}→{} | scans={} | dup={}",
                        cluster.getId(), after.getId(), String.format("%.2f", match.get().distanceKm()),
                        before.getSeverity(), after.getSeverity(), after.getScanCount(), duplicate);
            } else {
                String id = uniqueId(request.category(), now, previous, merged);
                TrackedEvent fresh = presenter.present(create(id, cluster, request), now);
                merged.put(fresh.getId(), fresh);
                created++;

                log.debug("[MERGE] {} created {} | sev={} | focus={}",
                        cluster.getId(), fresh.getId(), fresh.getSeverity(), fresh.getFocusCount());
            }
        }

        for (TrackedEvent before : previous.values()) {
            if (claimed.contains(before.getId())) {
                continue;
            }
            if (isExpired(before, now, request.keepStale())) {
                evicted++;
                log.debug("[MERGE] evicted {} | lastSeen={}", before.getId(), before.getLastSeen());
                continue;
            }
            TrackedEvent aged = before.toBuilder()
                    .stale(true)
                    .status(lifecycle.statusFor(staleReference(before), before.getSeverity(), now))
                    .build();
            merged.put(aged.getId(), presenter.present(aged, now));
            stale++;
        }

        List<TrackedEvent> events = new ArrayList<>(merged.values());
        events.sort(OUTPUT_ORDER);

        return new MergeOutcome(events, notifications, created, matched, duplicates, stale, evicted);
    }

    private TrackedEvent update(TrackedEvent before, Cluster cluster, MergeRequest request, boolean duplicate) {
        Instant now = request.now();
        List<HistoryPoint> history = before.getHistory() == null
                ? new ArrayList<>()
                : new ArrayList<>(before.getHistory());
        if (!duplicate) {
            history.add(snapshot(cluster, now));
        }
        history = capped(history);

        Instant lastSeen = duplicate ? before.getLastSeen() : now;
        Instant firstSeen = before.getFirstSeen() != null ? before.getFirstSeen() : earliest(history, now);

        return before.toBuilder()
                .location(locationFor(cluster, before.getLocation(), request))
                .latitude(cluster.getLatitude())
                .longitude(cluster.getLongitude())
                .severity(cluster.getSeverity())
                .focusCount(cluster.getFocusCount())
                .frpSum(cluster.getFrpSum())
                .frpMax(cluster.getFrpMax())
                .detectedFrom(cluster.getFirstSeen())
                .lastDetectedAt(cluster.getLastSeen())
                .firstSeen(firstSeen)
                .lastSeen(lastSeen)
                .scanCount(duplicate ? before.getScanCount() : before.getScanCount() + 1)
                .history(history)
                .trend(trendEngine.evaluate(history))
                .status(sightingStatus(cluster, now))
                .stale(false)
                .build();
    }

    private TrackedEvent create(String id, Cluster cluster, MergeRequest request) {
        Instant now = request.now();
        List<HistoryPoint> history = new ArrayList<>();
        history.add(snapshot(cluster, now));

        return TrackedEvent.builder()
                .id(id)
                .category(request.category())
                .location(locationFor(cluster, null, request))
                .latitude(cluster.getLatitude())
                .longitude(cluster.getLongitude())
                .severity(cluster.getSeverity())
                .focusCount(cluster.getFocusCount())
                .frpSum(cluster.getFrpSum())
                .frpMax(cluster.getFrpMax())
                .detectedFrom(cluster.getFirstSeen())
                .lastDetectedAt(cluster.getLastSeen())
                .firstSeen(now)
                .lastSeen(now)
                .scanCount(1)
                .history(history)
                .trend(EventTrend.STABLE)
                .status(sightingStatus(cluster, now))
                .stale(false)
                .build();
    }

    /**
     * Status of an event sighted in this scan. Its lastSeen is now, so age is zero;
     * a cluster without any parseable acquisition time gets the severity-only rule.
     */
    private EventStatus sightingStatus(Cluster cluster, Instant now) {
        Instant reference = cluster.getLastSeen() == null ? null : now;
        return lifecycle.statusFor(reference, cluster.getSeverity(), now);
    }

    private HistoryPoint snapshot(Cluster cluster, Instant now) {
        return HistoryPoint.builder()
                .t(now)
                .focusCount(cluster.getFocusCount())
                .frpSum(cluster.getFrpSum())
                .frpMax(cluster.getFrpMax())
                .severity(cluster.getSeverity())
                .build();
    }

    /**
     * A rescan is a duplicate when the latest snapshot is no more than the
     * duplicate window older than now (or newer than now).
     */
    boolean isDuplicateRescan(TrackedEvent event, Instant now) {
        HistoryPoint latest = event.latestSnapshot();
        if (latest == null || latest.getT() == null) {
            return false;
        }
        return !now.isAfter(latest.getT().plus(duplicateWindow));
    }

    static boolean isExpired(TrackedEvent event, Instant now, Duration keepStale) {
        if (event.getLastSeen() == null) {
            return true;
        }
        return Duration.between(event.getLastSeen(), now).compareTo(keepStale) > 0;
    }

    private static Instant staleReference(TrackedEvent event) {
        return event.getLastDetectedAt() != null ? event.getLastDetectedAt() : event.getLastSeen();
    }

    private static String locationFor(Cluster cluster, String previousLocation, MergeRequest request) {
        if (cluster.getPlaceName() != null && !cluster.getPlaceName().isBlank()) {
            return cluster.getPlaceName();
        }
        if (previousLocation != null && !previousLocation.isBlank()) {
            return previousLocation;
        }
        if (request.regionLabel() != null && !request.regionLabel().isBlank()) {
            return request.regionLabel();
        }
        return request.regionKey();
    }

    private List<HistoryPoint> capped(List<HistoryPoint> history) {
        if (history.size() <= historyCap) {
            return history;
        }
        return new ArrayList<>(history.subList(history.size() - historyCap, history.size()));
    }

    private static Instant earliest(List<HistoryPoint> history, Instant fallback) {
        Instant earliest = fallback;
        for (HistoryPoint point : history) {
            if (point.getT() != null && point.getT().isBefore(earliest)) {
                earliest = point.getT();
            }
        }
        return earliest;
    }

    private String uniqueId(EventCategory category, Instant now,
                            Map<String, TrackedEvent> previous, Map<String, TrackedEvent> merged) {
        String id = idGenerator.next(category, now);
        while (previous.containsKey(id) || merged.containsKey(id)) {
            id = idGenerator.next(category, now);
        }
        return id;
    }

    private static Map<String, TrackedEvent> indexById(List<TrackedEvent> events) {
        Map<String, TrackedEvent> byId = new LinkedHashMap<>();
        if (events == null) {
            return byId;
        }
        for (TrackedEvent event : events) {
            if (event != null && event.getId() != null) {
                byId.putIfAbsent(event.getId(), event);
            }
        }
        return byId;
    }

    /**
     * Everything one merge needs. keepStale bounds how long unmatched events are retained.
     */
    public record MergeRequest(EventCategory category,
                               String regionKey,
                               String regionLabel,
                               List<TrackedEvent> previous,
                               List<Cluster> clusters,
                               Instant now,
                               Duration keepStale) {
    }

    /**
     * Merged event set in output order, plus the alerts it triggered.
     */
    public record MergeOutcome(List<TrackedEvent> events,
                               List<AlertNotification> notifications,
                               int created,
                               int matched,
                               int duplicates,
                               int stale,
                               int evicted) {
    }
}
