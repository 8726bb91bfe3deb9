package com.kotsin.hotspot.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * ScanRequest - One batch of already-parsed detections for a (category, region) pair.
 *
 * category and regionKey come from the URL on the REST path and from the
 * payload on the Kafka path.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScanRequest {

    private String category;

    private String regionKey;

    /**
     * Display fallback when no place name is resolved
     */
    private String regionLabel;

    /**
     * west,south,east,north of the scanned region (informational)
     */
    private String bbox;

    /**
     * Optional per-scan overrides; null or non-positive uses configured defaults
     */
    private Double epsKm;
    private Integer minPts;

    @Builder.Default
    private List<DetectionPoint> points = new ArrayList<>();
}
