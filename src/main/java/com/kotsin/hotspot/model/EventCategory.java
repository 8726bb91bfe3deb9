package com.kotsin.hotspot.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * EventCategory - Kind of environmental event. Stores are partitioned by
 * (category, region), and identity resolution never crosses categories.
 */
public enum EventCategory {

    FLOOD("flood", "Flood"),
    FIRE("fire", "Fire"),
    STORM("storm", "Storm"),
    HEATWAVE("heatwave", "Heatwave"),
    AIR_POLLUTION("air-pollution", "Air Pollution"),
    OCEAN_ANOMALY("ocean-anomaly", "Ocean Anomaly");

    private final String wireValue;
    private final String label;

    EventCategory(String wireValue, String label) {
        this.wireValue = wireValue;
        this.label = label;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    /**
     * Human label, e.g. "Fire" or "Air Pollution"
     */
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static EventCategory fromWire(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim();
        for (EventCategory category : values()) {
            if (category.wireValue.equalsIgnoreCase(normalized)
                    || category.name().equalsIgnoreCase(normalized)) {
                return category;
            }
        }
        return null;
    }
}
