package com.kotsin.hotspot.infrastructure.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.hotspot.geocode.PlaceNameResolver;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * ReverseGeocodeClient - Looks up a place name for a coordinate over HTTP.
 *
 * GET {geocode.base-url}?lat={lat}&lon={lon}
 * The response is JSON; the first non-blank of "name", "display_name",
 * "label" is the place name.
 *
 * A blank base URL disables lookups entirely. Failures are logged and
 * reported as no name; they never fail the calling scan.
 */
@Slf4j
@Service
public class ReverseGeocodeClient implements PlaceNameResolver {

    private static final String[] NAME_FIELDS = {"name", "display_name", "label"};

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Value("${geocode.base-url:}")
    private String baseUrl;

    @Autowired
    public ReverseGeocodeClient(ObjectMapper objectMapper) {
        this(objectMapper, new OkHttpClient.Builder()
                .connectTimeout(5, TimeUnit.SECONDS)
                .readTimeout(10, TimeUnit.SECONDS)
                .build());
    }

    ReverseGeocodeClient(ObjectMapper objectMapper, OkHttpClient httpClient) {
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
    }

    @PostConstruct
    public void init() {
        if (isEnabled()) {
            log.info("[GEOCODE] Reverse geocoding via {}", baseUrl);
        } else {
            log.info("[GEOCODE] geocode.base-url not set, place names fall back to region labels");
        }
    }

    public boolean isEnabled() {
        return baseUrl != null && !baseUrl.isBlank();
    }

    void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    @Override
    public Optional<String> resolve(double latitude, double longitude) {
        if (!isEnabled() || !Double.isFinite(latitude) || !Double.isFinite(longitude)) {
            return Optional.empty();
        }

        HttpUrl base = HttpUrl.parse(baseUrl);
        if (base == null) {
            log.warn("[GEOCODE] Invalid geocode.base-url: {}", baseUrl);
            return Optional.empty();
        }

        HttpUrl url = base.newBuilder()
                .addQueryParameter("lat", String.format(Locale.ROOT, "%.5f", latitude))
                .addQueryParameter("lon", String.format(Locale.ROOT, "%.5f", longitude))
                .build();

        Request request = new Request.Builder()
                .url(url)
                .get()
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                log.debug("[GEOCODE] HTTP {} for {},{}", response.code(), latitude, longitude);
                return Optional.empty();
            }
            return placeName(objectMapper.readTree(response.body().string()));
        } catch (Exception e) {
            log.debug("[GEOCODE] Lookup failed for {},{}: {}", latitude, longitude, e.getMessage());
            return Optional.empty();
        }
    }

    static Optional<String> placeName(JsonNode body) {
        if (body == null || !body.isObject()) {
            return Optional.empty();
        }
        for (String field : NAME_FIELDS) {
            JsonNode value = body.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return Optional.of(value.asText().trim());
            }
        }
        return Optional.empty();
    }
}
