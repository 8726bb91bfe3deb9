package com.kotsin.hotspot.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why an alert fired. Checked in declaration order; first match wins.
 */
public enum NotificationReason {

    SEVERITY("severity"),
    STATUS("status"),
    TREND("trend");

    private final String wireValue;

    NotificationReason(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }
}
