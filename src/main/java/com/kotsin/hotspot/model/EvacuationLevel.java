package com.kotsin.hotspot.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Advisory level attached by downstream systems. Carried through persistence, never computed here.
 */
public enum EvacuationLevel {

    NONE("none"),
    RECOMMENDED("recommended"),
    MANDATORY("mandatory");

    private final String wireValue;

    EvacuationLevel(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    @JsonCreator
    public static EvacuationLevel fromWire(String value) {
        if (value == null) {
            return null;
        }
        for (EvacuationLevel level : values()) {
            if (level.wireValue.equalsIgnoreCase(value.trim())) {
                return level;
            }
        }
        return null;
    }
}
