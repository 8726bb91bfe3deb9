package com.kotsin.hotspot.camera;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Read-only camera registry loaded from a classpath JSON array.
 *
 * A missing or unreadable registry leaves the registry empty; camera
 * lookups then return nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CameraRegistry {

    private final ObjectMapper objectMapper;

    @Value("${cameras.registry-path:cameras/camera-registry.json}")
    private String registryPath;

    private volatile List<CameraRecord> cameras = Collections.emptyList();

    @PostConstruct
    public void load() {
        ClassPathResource resource = new ClassPathResource(registryPath);
        if (!resource.exists()) {
            log.warn("[CAMERAS] Registry {} not found, camera lookups disabled", registryPath);
            return;
        }
        try (InputStream in = resource.getInputStream()) {
            replace(objectMapper.readValue(in, new TypeReference<List<CameraRecord>>() {}));
            log.info("[CAMERAS] Loaded {} cameras from {}", cameras.size(), registryPath);
        } catch (IOException e) {
            log.error("[CAMERAS] Failed to read registry {}: {}", registryPath, e.getMessage());
        }
    }

    void replace(List<CameraRecord> records) {
        this.cameras = records == null
                ? Collections.emptyList()
                : records.stream()
                        .filter(Objects::nonNull)
                        .filter(c -> c.getId() != null && c.getGeo() != null)
                        .collect(Collectors.toUnmodifiableList());
    }

    public List<CameraRecord> all() {
        return cameras;
    }

    public int size() {
        return cameras.size();
    }
}
