package com.kotsin.hotspot.tracking;

import com.kotsin.hotspot.model.EventStatus;
import com.kotsin.hotspot.model.Severity;

import java.time.Duration;
import java.time.Instant;

import static com.kotsin.hotspot.config.ProcessingConstants.*;

/**
 * LifecycleStateMachine - Derives an event's status from detection age and severity.
 *
 * Not sticky: status is recomputed from scratch every merge, so a quiet event
 * that receives new detections returns to ACTIVE/ESCALATING.
 */
public class LifecycleStateMachine {

    /**
     * @param lastDetection reference instant, null when unknown
     */
    public EventStatus statusFor(Instant lastDetection, Severity severity, Instant now) {
        if (lastDetection == null) {
            return severity == Severity.CRITICAL ? EventStatus.ESCALATING : EventStatus.ACTIVE;
        }
        return statusForAge(ageHours(lastDetection, now), severity);
    }

    public EventStatus statusForAge(double ageHours, Severity severity) {
        if (ageHours > RESOLVED_AFTER_HOURS) {
            return EventStatus.RESOLVED;
        }
        if (ageHours > CONTAINED_AFTER_HOURS) {
            return EventStatus.CONTAINED;
        }
        if (ageHours > STABILIZING_AFTER_HOURS) {
            return EventStatus.STABILIZING;
        }
        if (severity != null && severity.isSevere()) {
            return EventStatus.ESCALATING;
        }
        return EventStatus.ACTIVE;
    }

    public static double ageHours(Instant since, Instant now) {
        return Duration.between(since, now).toMillis() / MILLIS_PER_HOUR;
    }
}
