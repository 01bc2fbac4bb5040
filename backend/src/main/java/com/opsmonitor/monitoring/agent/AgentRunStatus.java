package com.opsmonitor.monitoring.agent;

import java.util.Locale;

/**
 * Result of one status poll. A {@code null} status means the poll itself failed and should be retried.
 */
public record AgentRunStatus(String status, String errorCode) {
    public static final String SUCCESS = "success";
    public static final String ERROR = "error";
    public static final String TIMEOUT = "timeout";

    public static AgentRunStatus of(String status) {
        String normalized = status == null ? "" : status.trim().toLowerCase(Locale.ROOT);
        return new AgentRunStatus(normalized, null);
    }

    public static AgentRunStatus pollFailed(String errorCode) {
        return new AgentRunStatus(null, errorCode);
    }

    public boolean isPollFailure() {
        return status == null;
    }

    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }

    public boolean isFailed() {
        return ERROR.equals(status) || TIMEOUT.equals(status);
    }
}
