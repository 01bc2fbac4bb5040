package com.opsmonitor.monitoring.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NotifyOn implements WireValue {
    ALWAYS("always"),
    ISSUES("issues"),
    NEVER("never");

    private final String wireValue;

    NotifyOn(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static NotifyOn fromWire(String raw) {
        return WireValue.fromWire(NotifyOn.class, raw);
    }
}
