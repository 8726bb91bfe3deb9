package com.kotsin.hotspot.controller;

import com.kotsin.hotspot.camera.CameraRegistry;
import com.kotsin.hotspot.camera.NearestCameraFinder;
import com.kotsin.hotspot.model.TrackedEvent;
import com.kotsin.hotspot.service.ScanService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Read access to the persisted event sets.
 */
@RestController
@RequestMapping("/api/v1/events")
@RequiredArgsConstructor
public class EventController {

    private final ScanService scanService;
    private final CameraRegistry cameraRegistry;
    private final NearestCameraFinder cameraFinder;

    @GetMapping("/{category}/{regionKey}")
    public ResponseEntity<List<TrackedEvent>> events(@PathVariable String category,
                                                     @PathVariable String regionKey) {
        return ResponseEntity.ok(scanService.currentEvents(category, regionKey));
    }

    @GetMapping("/{category}/{regionKey}/{eventId}")
    public ResponseEntity<TrackedEvent> event(@PathVariable String category,
                                              @PathVariable String regionKey,
                                              @PathVariable String eventId) {
        return scanService.findEvent(category, regionKey, eventId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/{category}/{regionKey}/{eventId}/cameras")
    public ResponseEntity<List<NearestCameraFinder.CameraCandidate>> cameras(
            @PathVariable String category,
            @PathVariable String regionKey,
            @PathVariable String eventId,
            @RequestParam(defaultValue = "3") int maxResults,
            @RequestParam(defaultValue = "true") boolean requireVerified,
            @RequestParam(required = false) List<String> countries) {

        if (maxResults < 1) {
            throw new IllegalArgumentException("maxResults must be at least 1");
        }
        Set<String> allowCountries = new HashSet<>();
        if (countries != null) {
            countries.forEach(c -> allowCountries.add(c.trim().toUpperCase(Locale.ROOT)));
        }
        NearestCameraFinder.Options options = new NearestCameraFinder.Options(
                maxResults, NearestCameraFinder.DEFAULT_RADII_KM, requireVerified, allowCountries);

        return scanService.findEvent(category, regionKey, eventId)
                .map(event -> ResponseEntity.ok(cameraFinder.find(
                        cameraRegistry.all(), event.getLatitude(), event.getLongitude(), options)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
