package com.kotsin.hotspot.tracking;

import com.kotsin.hotspot.model.EventCategory;
import com.kotsin.hotspot.model.EventStatus;
import com.kotsin.hotspot.model.TrackedEvent;
import com.kotsin.hotspot.util.GeoMath;

import java.util.Optional;

/**
 * IdentityResolver - Matches a new cluster centroid to a previously tracked event.
 *
 * Single nearest-neighbour heuristic: among candidates of the same category that
 * are not resolved, take the closest one and accept it only within maxMatchKm.
 * No assignment optimisation; callers decide which candidates are still available.
 */
public class IdentityResolver {

    private final double maxMatchKm;

    public IdentityResolver(double maxMatchKm) {
        this.maxMatchKm = maxMatchKm;
    }

    public double getMaxMatchKm() {
        return maxMatchKm;
    }

    /**
     * @param candidates events to consider, in store order (ties go to the earlier one)
     * @return the matched event and its distance, or empty for a first sighting
     */
    public Optional<Match> resolve(Iterable<TrackedEvent> candidates, EventCategory category,
                                   double latitude, double longitude) {
        TrackedEvent best = null;
        double bestKm = Double.POSITIVE_INFINITY;

        for (TrackedEvent candidate : candidates) {
            if (!isEligible(candidate, category)) {
                continue;
            }
            double d = GeoMath.haversineKm(latitude, longitude, candidate.getLatitude(), candidate.getLongitude());
            if (d < bestKm) {
                best = candidate;
                bestKm = d;
            }
        }

        if (best != null && bestKm <= maxMatchKm) {
            return Optional.of(new Match(best, bestKm));
        }
        return Optional.empty();
    }

    static boolean isEligible(TrackedEvent candidate, EventCategory category) {
        return candidate != null
                && candidate.getCategory() == category
                && candidate.getStatus() != EventStatus.RESOLVED;
    }

    public record Match(TrackedEvent event, double distanceKm) {
    }
}
