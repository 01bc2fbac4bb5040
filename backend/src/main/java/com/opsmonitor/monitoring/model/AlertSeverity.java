package com.opsmonitor.monitoring.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertSeverity implements WireValue {
    INFO("info"),
    WARNING("warning"),
    CRITICAL("critical");

    private final String wireValue;

    AlertSeverity(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static AlertSeverity fromWire(String raw) {
        return WireValue.fromWire(AlertSeverity.class, raw);
    }
}
