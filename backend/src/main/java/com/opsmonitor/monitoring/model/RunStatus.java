package com.opsmonitor.monitoring.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RunStatus implements WireValue {
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String wireValue;

    RunStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }

    @JsonCreator
    public static RunStatus fromWire(String raw) {
        return WireValue.fromWire(RunStatus.class, raw);
    }
}
