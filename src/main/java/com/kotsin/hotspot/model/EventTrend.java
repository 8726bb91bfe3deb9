package com.kotsin.hotspot.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * EventTrend - Trajectory of an event's intensity between its two latest snapshots.
 */
public enum EventTrend {

    RISING("rising"),
    STABLE("stable"),
    FALLING("falling");

    private final String wireValue;

    EventTrend(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    @JsonCreator
    public static EventTrend fromWire(String value) {
        if (value == null) {
            return null;
        }
        for (EventTrend trend : values()) {
            if (trend.wireValue.equalsIgnoreCase(value.trim())) {
                return trend;
            }
        }
        return null;
    }
}
