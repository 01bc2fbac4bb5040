package com.opsmonitor.monitoring.model;

/**
 * {@code alertSent} only records that the notify policy matched and a Slack channel was available.
 * Delivery itself happens inside the agent run and is not confirmed back.
 */
public record AlertDecision(boolean shouldAlert, boolean alertSent, AlertSeverity severity) {
    public static AlertDecision none() {
        return new AlertDecision(false, false, null);
    }
}
