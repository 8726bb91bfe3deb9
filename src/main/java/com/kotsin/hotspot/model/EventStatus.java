package com.kotsin.hotspot.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * EventStatus - Operational status of a tracked event.
 *
 * Recomputed every scan from detection age and severity, so an event may move
 * "backwards" when new detections reset its age:
 * ┌─────────────────────────────────────────────────────────────┐
 * │  ACTIVE / ESCALATING  (age ≤ 6h)                            │
 * │       ↓                                                     │
 * │  STABILIZING          (6h < age ≤ 18h)                      │
 * │       ↓                                                     │
 * │  CONTAINED            (18h < age ≤ 48h)                     │
 * │       ↓                                                     │
 * │  RESOLVED             (age > 48h)                           │
 * └─────────────────────────────────────────────────────────────┘
 */
public enum EventStatus {

    ACTIVE("active"),
    ESCALATING("escalating"),
    STABILIZING("stabilizing"),
    CONTAINED("contained"),
    RESOLVED("resolved");

    private final String wireValue;

    EventStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    @JsonCreator
    public static EventStatus fromWire(String value) {
        if (value == null) {
            return null;
        }
        for (EventStatus status : values()) {
            if (status.wireValue.equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        return null;
    }
}
