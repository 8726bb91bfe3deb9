package com.kotsin.hotspot.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * EventInsight - Short outlook attached to an event for display.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class EventInsight {

    /**
     * Likelihood (0-100) of continued activity over the next 12 hours
     */
    private Integer probabilityNext12h;

    private String narrative;

    private List<String> recommendations;
}
