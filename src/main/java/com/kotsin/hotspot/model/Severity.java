package com.kotsin.hotspot.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity - Coarse intensity tier of a cluster or tracked event.
 *
 * Ordered by rank: LOW < MODERATE < HIGH < CRITICAL
 */
public enum Severity {

    LOW("low", 0),
    MODERATE("moderate", 1),
    HIGH("high", 2),
    CRITICAL("critical", 3);

    private final String wireValue;
    private final int rank;

    Severity(String wireValue, int rank) {
        this.wireValue = wireValue;
        this.rank = rank;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public int getRank() {
        return rank;
    }

    public boolean isSevere() {
        return this == CRITICAL || this == HIGH;
    }

    /**
     * Parse a wire value (case-insensitive).
     *
     * @return matching severity or null when unknown
     */
    @JsonCreator
    public static Severity fromWire(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim();
        for (Severity severity : values()) {
            if (severity.wireValue.equalsIgnoreCase(normalized)) {
                return severity;
            }
        }
        return null;
    }

    /**
     * Rank of a possibly-null severity; null ranks with LOW.
     */
    public static int rankOf(Severity severity) {
        return severity == null ? 0 : severity.getRank();
    }
}
