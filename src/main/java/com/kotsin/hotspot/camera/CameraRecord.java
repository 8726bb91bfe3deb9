package com.kotsin.hotspot.camera;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * CameraRecord - One public camera from the registry (schema "biopulse.camera.v1").
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CameraRecord {

    public static final String VERIFIED = "verified";

    private String schema;
    private String id;
    private String providerId;
    private String title;
    private String description;

    private Geo geo;
    private Coverage coverage;

    /**
     * snapshot | stream | embed
     */
    private String mediaType;

    /**
     * How to obtain media; shape depends on "kind"
     */
    private JsonNode fetch;

    private Usage usage;
    private Validation validation;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    /**
     * 0..1
     */
    private Double reliabilityScore;
    private Integer priority;

    public boolean isVerified() {
        return validation != null && VERIFIED.equalsIgnoreCase(validation.getStatus());
    }

    public boolean isPubliclyUsable() {
        return usage != null && usage.isPublicAccess();
    }

    public String countryCode() {
        return coverage == null ? null : coverage.getCountryISO2();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Geo {
        private double lat;
        private double lon;
        private Double elevationM;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Coverage {
        private String countryISO2;
        private String admin1;
        private String admin2;
        private String locality;
        private String timezone;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Usage {
        @JsonProperty("isPublic")
        private boolean publicAccess;
        private String termsUrl;
        private String attributionText;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Validation {
        /**
         * pending | verified | rejected
         */
        private String status;
        private String verifiedBy;
    }
}
