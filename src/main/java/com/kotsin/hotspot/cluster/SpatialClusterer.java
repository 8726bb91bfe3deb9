package com.kotsin.hotspot.cluster;

import com.kotsin.hotspot.model.Cluster;
import com.kotsin.hotspot.model.DetectionPoint;
import com.kotsin.hotspot.time.TemporalWindow;
import com.kotsin.hotspot.util.GeoMath;
import com.kotsin.hotspot.util.ValidationUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * SpatialClusterer - DBSCAN over haversine distance.
 *
 * ALGORITHM:
 * ┌─────────────────────────────────────────────────────────────┐
 * │  for each unvisited point p:                                │
 * │     N = all points within epsKm of p (p included)           │
 * │     |N| < minPts  → provisional noise                       │
 * │     otherwise     → new cluster, expand breadth-first:      │
 * │        each unvisited neighbour q is visited; if q is also  │
 * │        dense its neighbourhood joins the frontier           │
 * │        every reached point is assigned exactly once         │
 * │  leftover noise (never reached) → singleton clusters        │
 * └─────────────────────────────────────────────────────────────┘
 *
 * O(n²) neighbourhood queries, no spatial index. Output is deterministic for a
 * fixed input order. Detections without finite coordinates are dropped first.
 */
public class SpatialClusterer {

    private final SeverityClassifier severityClassifier;

    public SpatialClusterer(SeverityClassifier severityClassifier) {
        this.severityClassifier = severityClassifier;
    }

    /**
     * Cluster one batch of detections.
     *
     * @param points                     raw detections, in arrival order
     * @param epsKm                      neighbour radius (inclusive)
     * @param minPts                     minimum neighbourhood size of a core point
     * @param includeNoiseAsSingleEvents emit each unreached noise point as its own cluster
     * @return dense clusters in discovery order, followed by singletons
     */
    public List<Cluster> cluster(List<DetectionPoint> points, double epsKm, int minPts,
                                 boolean includeNoiseAsSingleEvents) {
        List<DetectionPoint> usable = ValidationUtils.usableDetections(points);
        int n = usable.size();
        List<Cluster> out = new ArrayList<>();
        if (n == 0) {
            return out;
        }

        boolean[] visited = new boolean[n];
        boolean[] assigned = new boolean[n];
        List<Integer> noise = new ArrayList<>();
        List<List<Integer>> groups = new ArrayList<>();

        for (int i = 0; i < n; i++) {
            if (visited[i]) {
                continue;
            }
            visited[i] = true;

            List<Integer> neighbours = regionQuery(usable, i, epsKm);
            if (neighbours.size() < minPts) {
                noise.add(i);
                continue;
            }

            groups.add(expand(usable, i, neighbours, epsKm, minPts, visited, assigned));
        }

        for (int k = 0; k < groups.size(); k++) {
            out.add(buildCluster("cluster-" + k, members(usable, groups.get(k))));
        }

        if (includeNoiseAsSingleEvents) {
            int k = 0;
            for (int idx : noise) {
                // noise reached later as a border point already belongs to a cluster
                if (assigned[idx]) {
                    continue;
                }
                out.add(buildCluster("single-" + k++, List.of(usable.get(idx))));
            }
        }

        return out;
    }

    private List<Integer> expand(List<DetectionPoint> points, int seed, List<Integer> seedNeighbours,
                                 double epsKm, int minPts, boolean[] visited, boolean[] assigned) {
        List<Integer> group = new ArrayList<>();
        group.add(seed);
        assigned[seed] = true;

        boolean[] queued = new boolean[points.size()];
        List<Integer> frontier = new ArrayList<>();
        for (int idx : seedNeighbours) {
            if (!queued[idx]) {
                queued[idx] = true;
                frontier.add(idx);
            }
        }

        for (int f = 0; f < frontier.size(); f++) {
            int idx = frontier.get(f);

            if (!visited[idx]) {
                visited[idx] = true;
                List<Integer> next = regionQuery(points, idx, epsKm);
                if (next.size() >= minPts) {
                    for (int candidate : next) {
                        if (!queued[candidate]) {
                            queued[candidate] = true;
                            frontier.add(candidate);
                        }
                    }
                }
            }

            if (!assigned[idx]) {
                assigned[idx] = true;
                group.add(idx);
            }
        }

        return group;
    }

    private List<Integer> regionQuery(List<DetectionPoint> points, int idx, double epsKm) {
        DetectionPoint p = points.get(idx);
        List<Integer> neighbours = new ArrayList<>();
        for (int j = 0; j < points.size(); j++) {
            DetectionPoint q = points.get(j);
            double d = GeoMath.haversineKm(p.getLatitude(), p.getLongitude(), q.getLatitude(), q.getLongitude());
            if (d <= epsKm) {
                neighbours.add(j);
            }
        }
        return neighbours;
    }

    private List<DetectionPoint> members(List<DetectionPoint> points, List<Integer> indices) {
        List<DetectionPoint> members = new ArrayList<>(indices.size());
        for (int idx : indices) {
            members.add(points.get(idx));
        }
        return members;
    }

    private Cluster buildCluster(String id, List<DetectionPoint> members) {
        double latSum = 0.0;
        double lonSum = 0.0;
        for (DetectionPoint member : members) {
            latSum += member.getLatitude();
            lonSum += member.getLongitude();
        }

        SeverityClassifier.Assessment assessment = severityClassifier.classify(members);
        TemporalWindow.Window window = TemporalWindow.of(members);

        return Cluster.builder()
                .id(id)
                .latitude(latSum / members.size())
                .longitude(lonSum / members.size())
                .focusCount(members.size())
                .frpMax(assessment.frpMax())
                .frpSum(assessment.frpSum())
                .severity(assessment.severity())
                .firstSeen(window.firstSeen())
                .lastSeen(window.lastSeen())
                .members(new ArrayList<>(members))
                .build();
    }
}
