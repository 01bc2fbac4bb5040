package com.opsmonitor.monitoring.model;

import java.time.Instant;
import java.util.List;

/**
 * Terminal result of one execution attempt. Exactly one of the factory methods applies.
 */
public record RunOutcome(
    RunStatus status,
    String summary,
    List<Finding> findings,
    boolean alertSent,
    AlertSeverity alertSeverity,
    String errorMessage,
    Instant completedAt
) {
    public RunOutcome {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("outcome status must be terminal");
        }
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public static RunOutcome completed(ParsedAgentResult result, AlertDecision decision, Instant completedAt) {
        return new RunOutcome(
            RunStatus.COMPLETED,
            result.summary(),
            result.findings(),
            decision.alertSent(),
            decision.severity(),
            null,
            completedAt
        );
    }

    public static RunOutcome failed(String errorMessage, Instant completedAt) {
        String message = errorMessage == null || errorMessage.isBlank() ? "Unknown error" : errorMessage;
        return new RunOutcome(RunStatus.FAILED, null, List.of(), false, null, message, completedAt);
    }

    public boolean isSuccess() {
        return status == RunStatus.COMPLETED;
    }
}
