package com.kotsin.hotspot.camera;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NearestCameraFinder - bucketed camera ranking")
class NearestCameraFinderTest {

    private final NearestCameraFinder finder = new NearestCameraFinder();

    @Test
    @DisplayName("Smaller radius bucket wins regardless of priority")
    void testFind_BucketFirst() {
        CameraRecord near = camera("near", 0.0, 0.03, "AR", true, 0, 0.1);
        CameraRecord far = camera("far", 0.0, 0.10, "AR", true, 9, 1.0);

        List<NearestCameraFinder.CameraCandidate> found =
                finder.find(List.of(far, near), 0.0, 0.0, NearestCameraFinder.Options.defaults());

        assertEquals(List.of("near", "far"), ids(found));
        assertEquals(5.0, found.get(0).bucketKm(), 1e-9);
        assertEquals(20.0, found.get(1).bucketKm(), 1e-9);
    }

    @Test
    @DisplayName("Within a bucket, closer cameras rank first")
    void testFind_DistanceWithinBucket() {
        CameraRecord a = camera("a", 0.0, 0.02, "AR", true, 0, 0.5);
        CameraRecord b = camera("b", 0.0, 0.01, "AR", true, 0, 0.5);

        assertEquals(List.of("b", "a"), ids(finder.find(List.of(a, b), 0.0, 0.0,
                NearestCameraFinder.Options.defaults())));
    }

    @Test
    @DisplayName("Equal distance falls back to priority, reliability, then id")
    void testFind_Tiebreaks() {
        CameraRecord lowPriority = camera("a-low", 0.0, 0.01, "AR", true, 1, 0.9);
        CameraRecord highPriority = camera("b-high", 0.0, 0.01, "AR", true, 2, 0.1);
        CameraRecord reliable = camera("c-reliable", 0.0, 0.01, "AR", true, 1, 1.0);
        CameraRecord sameAsLow = camera("0-low", 0.0, 0.01, "AR", true, 1, 0.9);

        List<NearestCameraFinder.CameraCandidate> found = finder.find(
                List.of(lowPriority, highPriority, reliable, sameAsLow), 0.0, 0.0,
                new NearestCameraFinder.Options(10, NearestCameraFinder.DEFAULT_RADII_KM, true, Set.of()));

        assertEquals(List.of("b-high", "c-reliable", "0-low", "a-low"), ids(found));
    }

    @Test
    @DisplayName("Cameras beyond the largest radius are dropped")
    void testFind_OutOfRange() {
        CameraRecord remote = camera("remote", 0.0, 1.0, "AR", true, 0, 0.5);

        assertTrue(finder.find(List.of(remote), 0.0, 0.0, NearestCameraFinder.Options.defaults()).isEmpty());
    }

    @Test
    @DisplayName("Unverified, private and disallowed-country cameras are filtered")
    void testFind_Eligibility() {
        CameraRecord pending = camera("pending", 0.0, 0.01, "AR", true, 0, 0.5);
        pending.getValidation().setStatus("pending");
        CameraRecord restricted = camera("private", 0.0, 0.01, "AR", false, 0, 0.5);
        CameraRecord chile = camera("chile", 0.0, 0.01, "CL", true, 0, 0.5);
        CameraRecord ok = camera("ok", 0.0, 0.01, "AR", true, 0, 0.5);
        List<CameraRecord> all = List.of(pending, restricted, chile, ok);

        assertEquals(List.of("chile", "ok"), ids(finder.find(all, 0.0, 0.0,
                new NearestCameraFinder.Options(10, NearestCameraFinder.DEFAULT_RADII_KM, true, Set.of()))));
        assertEquals(List.of("ok"), ids(finder.find(all, 0.0, 0.0,
                new NearestCameraFinder.Options(10, NearestCameraFinder.DEFAULT_RADII_KM, true, Set.of("AR")))));
        assertEquals(List.of("chile", "ok", "pending"), ids(finder.find(all, 0.0, 0.0,
                new NearestCameraFinder.Options(10, NearestCameraFinder.DEFAULT_RADII_KM, false, Set.of()))));
    }

    @Test
    @DisplayName("Results are capped at maxResults")
    void testFind_MaxResults() {
        List<CameraRecord> many = List.of(
                camera("a", 0.0, 0.01, "AR", true, 0, 0.5),
                camera("b", 0.0, 0.02, "AR", true, 0, 0.5),
                camera("c", 0.0, 0.03, "AR", true, 0, 0.5),
                camera("d", 0.0, 0.04, "AR", true, 0, 0.5));

        assertEquals(List.of("a", "b", "c"), ids(finder.find(many, 0.0, 0.0, NearestCameraFinder.Options.defaults())));
    }

    @Test
    @DisplayName("Records without coordinates are never eligible")
    void testIsEligible_NoGeo() {
        CameraRecord noGeo = camera("x", 0.0, 0.0, "AR", true, 0, 0.5);
        noGeo.setGeo(null);

        assertFalse(NearestCameraFinder.isEligible(noGeo, NearestCameraFinder.Options.defaults()));
        assertFalse(NearestCameraFinder.isEligible(null, NearestCameraFinder.Options.defaults()));
    }

    private static List<String> ids(List<NearestCameraFinder.CameraCandidate> candidates) {
        return candidates.stream().map(c -> c.camera().getId()).toList();
    }

    private static CameraRecord camera(String id, double lat, double lon, String country,
                                       boolean isPublic, int priority, double reliability) {
        CameraRecord.Coverage coverage = new CameraRecord.Coverage();
        coverage.setCountryISO2(country);
        return CameraRecord.builder()
                .id(id)
                .geo(new CameraRecord.Geo(lat, lon, null))
                .coverage(coverage)
                .usage(new CameraRecord.Usage(isPublic, null, null))
                .validation(new CameraRecord.Validation(CameraRecord.VERIFIED, null))
                .priority(priority)
                .reliabilityScore(reliability)
                .build();
    }
}
