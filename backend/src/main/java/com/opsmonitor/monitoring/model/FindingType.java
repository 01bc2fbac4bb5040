package com.opsmonitor.monitoring.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum FindingType implements WireValue {
    INFO("info"),
    WARNING("warning"),
    ERROR("error"),
    SUCCESS("success");

    private final String wireValue;

    FindingType(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public boolean isIssue() {
        return this == ERROR || this == WARNING;
    }

    @JsonCreator
    public static FindingType fromWire(String raw) {
        return WireValue.fromWire(FindingType.class, raw);
    }
}
