package com.kotsin.hotspot.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DetectionPoint - One raw thermal-anomaly reading from a satellite sensor.
 *
 * Ephemeral: consumed entirely within one scan. Field names accept both the
 * camel-case form and the sensor feed's snake-case form (acq_date, acq_time).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DetectionPoint {

    private String id;

    private Double latitude;

    private Double longitude;

    /**
     * Fire radiative power (MW). Absent means 0.
     */
    private Double frp;

    /**
     * Free-form confidence tag ("high"/"nominal"/"low" or "h"/"n"/"l")
     */
    private String confidence;

    /**
     * Acquisition date, UTC calendar date (yyyy-MM-dd)
     */
    @JsonAlias("acq_date")
    private String acqDate;

    /**
     * Acquisition time-of-day, UTC, 1-4 digits without separator ("945" = 09:45)
     */
    @JsonAlias("acq_time")
    private String acqTime;

    /**
     * FRP with absent or non-finite values treated as 0.
     */
    public double frpOrZero() {
        return frp == null || !Double.isFinite(frp) ? 0.0 : frp;
    }

    /**
     * True when both coordinates are present and finite.
     */
    public boolean hasFiniteLocation() {
        return latitude != null && longitude != null
                && Double.isFinite(latitude) && Double.isFinite(longitude);
    }
}
