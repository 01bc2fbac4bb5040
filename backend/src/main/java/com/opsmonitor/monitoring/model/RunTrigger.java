package com.opsmonitor.monitoring.model;

/**
 * What started a run. The label prefixes the alert name the agent sees.
 */
public enum RunTrigger {
    SCHEDULED("Scheduled"),
    MANUAL("Manual");

    private final String label;

    RunTrigger(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public String alertName(String jobName) {
        return label + ": " + jobName;
    }
}
