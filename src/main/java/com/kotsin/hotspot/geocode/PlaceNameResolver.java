package com.kotsin.hotspot.geocode;

import java.util.Optional;

/**
 * Resolves a coordinate to a human-readable place name.
 *
 * Implementations never throw: an unavailable service is an empty result.
 */
public interface PlaceNameResolver {

    Optional<String> resolve(double latitude, double longitude);
}
