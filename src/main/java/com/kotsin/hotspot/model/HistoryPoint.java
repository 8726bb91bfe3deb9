package com.kotsin.hotspot.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * HistoryPoint - One intensity snapshot in a tracked event's bounded history.
 *
 * Wire form: {t, focusCount?, frpSum?, frpMax?, severity?}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class HistoryPoint {

    private Instant t;
    private Integer focusCount;
    private Double frpSum;
    private Double frpMax;
    private Severity severity;
}
