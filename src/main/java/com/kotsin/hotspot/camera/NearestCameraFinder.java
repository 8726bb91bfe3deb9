package com.kotsin.hotspot.camera;

import com.kotsin.hotspot.util.GeoMath;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Finds the best public cameras near a point.
 *
 * Each eligible camera falls in the smallest radius bucket containing it;
 * cameras beyond the largest bucket are dropped. Ordering:
 * bucket asc, distance asc, priority desc, reliability desc, id asc.
 */
@Component
public class NearestCameraFinder {

    public static final List<Double> DEFAULT_RADII_KM = List.of(5.0, 20.0, 50.0, 100.0);
    public static final int DEFAULT_MAX_RESULTS = 3;

    static final Comparator<CameraCandidate> RANKING = Comparator
            .comparingDouble(CameraCandidate::bucketKm)
            .thenComparingDouble(CameraCandidate::distanceKm)
            .thenComparing((CameraCandidate c) -> priorityOf(c.camera()), Comparator.reverseOrder())
            .thenComparing((CameraCandidate c) -> reliabilityOf(c.camera()), Comparator.reverseOrder())
            .thenComparing(c -> c.camera().getId());

    public List<CameraCandidate> find(List<CameraRecord> cameras, double latitude, double longitude, Options options) {
        List<CameraCandidate> candidates = new ArrayList<>();
        for (CameraRecord camera : cameras) {
            if (!isEligible(camera, options)) {
                continue;
            }
            double distanceKm = GeoMath.haversineKm(latitude, longitude,
                    camera.getGeo().getLat(), camera.getGeo().getLon());
            Double bucket = bucketFor(distanceKm, options.radiiKm());
            if (bucket != null) {
                candidates.add(new CameraCandidate(camera, distanceKm, bucket));
            }
        }
        candidates.sort(RANKING);
        return candidates.size() > options.maxResults()
                ? new ArrayList<>(candidates.subList(0, options.maxResults()))
                : candidates;
    }

    static boolean isEligible(CameraRecord camera, Options options) {
        if (camera == null || camera.getGeo() == null) {
            return false;
        }
        if (options.requireVerified() && !camera.isVerified()) {
            return false;
        }
        if (!options.allowCountries().isEmpty() && !options.allowCountries().contains(camera.countryCode())) {
            return false;
        }
        return camera.isPubliclyUsable();
    }

    private static Double bucketFor(double distanceKm, List<Double> radiiKm) {
        for (Double radius : radiiKm) {
            if (distanceKm <= radius) {
                return radius;
            }
        }
        return null;
    }

    private static int priorityOf(CameraRecord camera) {
        return camera.getPriority() == null ? 0 : camera.getPriority();
    }

    private static double reliabilityOf(CameraRecord camera) {
        return camera.getReliabilityScore() == null ? 0.0 : camera.getReliabilityScore();
    }

    public record CameraCandidate(CameraRecord camera, double distanceKm, double bucketKm) {
    }

    /**
     * radiiKm is expected in ascending order.
     */
    public record Options(int maxResults, List<Double> radiiKm, boolean requireVerified, Set<String> allowCountries) {

        public static Options defaults() {
            return new Options(DEFAULT_MAX_RESULTS, DEFAULT_RADII_KM, true, Set.of());
        }
    }
}
