package com.kotsin.hotspot.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates tracking configuration once the application is ready.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigurationValidator {

    private final TrackingProperties properties;

    @Value("${spring.profiles.active:default}")
    private String activeProfile;

    @Value("${spring.kafka.bootstrap-servers:}")
    private String bootstrapServers;

    @Value("${spring.data.mongodb.uri:}")
    private String mongoUri;

    @Value("${geocode.base-url:}")
    private String geocodeBaseUrl;

    @EventListener(ApplicationReadyEvent.class)
    public void validateConfiguration() {
        if ("test".equals(activeProfile)) {
            log.info("Skipping configuration validation in test mode");
            return;
        }

        log.info("Validating application configuration...");

        List<String> errors = validate();
        if (!errors.isEmpty()) {
            log.error("Configuration validation failed with {} errors:", errors.size());
            errors.forEach(error -> log.error("  - {}", error));
            throw new IllegalStateException("Configuration validation failed. Please fix the errors above.");
        }

        if (isNullOrEmpty(bootstrapServers)) {
            log.warn("spring.kafka.bootstrap-servers is not configured - using localhost:9092");
        }
        if (isNullOrEmpty(mongoUri)) {
            log.warn("spring.data.mongodb.uri is not configured - scan audit uses the Mongo defaults");
        }

        log.info("Configuration validation passed");
        logConfigurationSummary();
    }

    List<String> validate() {
        List<String> errors = new ArrayList<>();

        if (!(properties.getEpsKm() > 0) || !Double.isFinite(properties.getEpsKm())) {
            errors.add("tracking.eps-km must be a positive number");
        }
        if (properties.getMinPts() < 1) {
            errors.add("tracking.min-pts must be at least 1");
        }
        if (!(properties.getMaxMatchKm() > 0) || !Double.isFinite(properties.getMaxMatchKm())) {
            errors.add("tracking.max-match-km must be a positive number");
        }
        if (properties.getKeepStaleHours() < 0) {
            errors.add("tracking.keep-stale-hours must not be negative");
        }
        if (properties.getHistoryCap() < 2) {
            errors.add("tracking.history-cap must be at least 2 for trend evaluation");
        }
        if (properties.getDuplicateWindowSeconds() < 0) {
            errors.add("tracking.duplicate-window-seconds must not be negative");
        }
        if (properties.getMaxGeocodePerScan() < 0) {
            errors.add("tracking.max-geocode-per-scan must not be negative");
        }

        String storeType = properties.getStore().getType();
        if (!"redis".equalsIgnoreCase(storeType) && !"memory".equalsIgnoreCase(storeType)) {
            errors.add("tracking.store.type must be 'redis' or 'memory' but was '" + storeType + "'");
        }
        if (isNullOrEmpty(properties.getStore().getKeyPrefix())) {
            errors.add("tracking.store.key-prefix is not configured");
        }

        return errors;
    }

    private void logConfigurationSummary() {
        log.info("Configuration Summary:");
        log.info("  Clustering: epsKm={} minPts={} noiseAsEvents={}",
                properties.getEpsKm(), properties.getMinPts(), properties.isIncludeNoiseAsSingleEvents());
        log.info("  Tracking: maxMatchKm={} keepStaleHours={} historyCap={} duplicateWindow={}s",
                properties.getMaxMatchKm(), properties.getKeepStaleHours(),
                properties.getHistoryCap(), properties.getDuplicateWindowSeconds());
        log.info("  Store: {} ({})", properties.getStore().getType(), properties.getStore().getKeyPrefix());
        log.info("  Kafka Bootstrap Servers: {}", bootstrapServers);
        log.info("  MongoDB URI: {}", maskUri(mongoUri));
        log.info("  Geocoder: {}", isNullOrEmpty(geocodeBaseUrl) ? "disabled" : geocodeBaseUrl);
    }

    private boolean isNullOrEmpty(String str) {
        return str == null || str.trim().isEmpty();
    }

    private String maskUri(String uri) {
        if (isNullOrEmpty(uri)) {
            return "not configured";
        }
        return uri.replaceAll(":[^:@]+@", ":****@");
    }
}
