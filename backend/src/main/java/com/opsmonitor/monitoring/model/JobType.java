package com.opsmonitor.monitoring.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum JobType implements WireValue {
    DEPLOYMENT_WATCHER("deployment_watcher"),
    HEALTH_CHECK("health_check"),
    ERROR_SCANNER("error_scanner"),
    BASELINE_BUILDER("baseline_builder"),
    CUSTOM("custom");

    private final String wireValue;

    JobType(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static JobType fromWire(String raw) {
        return WireValue.fromWire(JobType.class, raw);
    }
}
