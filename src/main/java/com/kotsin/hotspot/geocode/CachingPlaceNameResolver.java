package com.kotsin.hotspot.geocode;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.kotsin.hotspot.config.ProcessingConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Caffeine-backed front for the reverse geocoder.
 *
 * Keyed by the coordinate rounded to two decimals (about 1 km), so
 * neighbouring clusters and repeated scans share one lookup. Misses are
 * remembered for a shorter time than hits.
 */
@Slf4j
@Primary
@Component
public class CachingPlaceNameResolver implements PlaceNameResolver {

    static final Duration MISS_TTL = Duration.ofHours(1);

    private final PlaceNameResolver delegate;

    private final Cache<String, String> names = Caffeine.newBuilder()
            .maximumSize(ProcessingConstants.GEOCODE_CACHE_MAX_SIZE)
            .expireAfterWrite(ProcessingConstants.GEOCODE_CACHE_TTL)
            .recordStats()
            .build();

    private final Cache<String, Boolean> misses = Caffeine.newBuilder()
            .maximumSize(ProcessingConstants.GEOCODE_CACHE_MAX_SIZE)
            .expireAfterWrite(MISS_TTL)
            .build();

    public CachingPlaceNameResolver(@Qualifier("reverseGeocodeClient") PlaceNameResolver delegate) {
        this.delegate = delegate;
    }

    @Override
    public Optional<String> resolve(double latitude, double longitude) {
        String key = cacheKey(latitude, longitude);

        String cached = names.getIfPresent(key);
        if (cached != null) {
            return Optional.of(cached);
        }
        if (misses.getIfPresent(key) != null) {
            return Optional.empty();
        }

        Optional<String> resolved = delegate.resolve(latitude, longitude);
        if (resolved.isPresent()) {
            names.put(key, resolved.get());
        } else {
            misses.put(key, Boolean.TRUE);
        }
        log.debug("[GEOCODE] {} → {}", key, resolved.orElse("<none>"));
        return resolved;
    }

    public long cachedNames() {
        return names.estimatedSize();
    }

    public double hitRate() {
        return names.stats().hitRate();
    }

    static String cacheKey(double latitude, double longitude) {
        return String.format(Locale.ROOT, "%.2f,%.2f", latitude, longitude);
    }
}
