package com.opsmonitor.monitoring.agent;

import java.time.Duration;

public record AgentHttpResponse(
    String url,
    int statusCode,
    String body,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public String describeFailure() {
        if (errorCode != null) {
            return errorCode + (errorMessage == null || errorMessage.isBlank() ? "" : " (" + errorMessage + ")");
        }
        return "HTTP " + statusCode;
    }
}
