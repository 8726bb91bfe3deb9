package com.kotsin.hotspot.camera;

import com.kotsin.hotspot.config.JacksonSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CameraRegistry")
class CameraRegistryTest {

    private CameraRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new CameraRegistry(JacksonSupport.newObjectMapper());
    }

    @Test
    @DisplayName("Bundled registry loads with nested usage and validation")
    void testLoad_BundledRegistry() {
        ReflectionTestUtils.setField(registry, "registryPath", "cameras/camera-registry.json");

        registry.load();

        assertEquals(4, registry.size());
        CameraRecord first = registry.all().stream()
                .filter(c -> c.getId().equals("ar-cba-villa-carlos-paz-01"))
                .findFirst()
                .orElseThrow();
        assertTrue(first.isVerified());
        assertTrue(first.isPubliclyUsable());
        assertEquals("AR", first.countryCode());
        assertEquals(-31.4241, first.getGeo().getLat(), 1e-9);
        assertEquals("image_url", first.getFetch().get("kind").asText());
    }

    @Test
    @DisplayName("Missing registry leaves lookups empty")
    void testLoad_Missing() {
        ReflectionTestUtils.setField(registry, "registryPath", "cameras/does-not-exist.json");

        registry.load();

        assertEquals(0, registry.size());
    }

    @Test
    @DisplayName("Records without id or coordinates are discarded")
    void testReplace_FiltersIncomplete() {
        List<CameraRecord> records = new ArrayList<>();
        records.add(CameraRecord.builder().id("ok").geo(new CameraRecord.Geo(1.0, 2.0, null)).build());
        records.add(CameraRecord.builder().id("no-geo").build());
        records.add(CameraRecord.builder().geo(new CameraRecord.Geo(1.0, 2.0, null)).build());
        records.add(null);

        registry.replace(records);

        assertEquals(1, registry.size());
        assertEquals("ok", registry.all().get(0).getId());
    }

    @Test
    @DisplayName("Bundled cameras near Cordoba rank by bucket")
    void testBundledRegistry_NearestToCordobaHills() {
        ReflectionTestUtils.setField(registry, "registryPath", "cameras/camera-registry.json");
        registry.load();

        List<NearestCameraFinder.CameraCandidate> found = new NearestCameraFinder()
                .find(registry.all(), -31.40, -64.45, NearestCameraFinder.Options.defaults());

        assertEquals(2, found.size());
        assertEquals("ar-cba-villa-carlos-paz-01", found.get(0).camera().getId());
        assertEquals("ar-cba-la-falda-01", found.get(1).camera().getId());
    }
}
