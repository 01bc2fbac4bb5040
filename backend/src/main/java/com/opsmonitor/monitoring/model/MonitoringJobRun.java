package com.opsmonitor.monitoring.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record MonitoringJobRun(
    UUID id,
    UUID jobId,
    UUID orgId,
    RunStatus status,
    String summary,
    List<Finding> findings,
    String errorMessage,
    boolean alertSent,
    AlertSeverity alertSeverity,
    Instant startedAt,
    Instant completedAt,
    Long durationMs
) {
    public MonitoringJobRun {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public MonitoringJobRun withStartedAt(Instant value) {
        return new MonitoringJobRun(
            id, jobId, orgId, status, summary, findings, errorMessage, alertSent, alertSeverity, value, completedAt, durationMs
        );
    }

    public static MonitoringJobRun started(UUID id, UUID jobId, UUID orgId, Instant startedAt) {
        return new MonitoringJobRun(id, jobId, orgId, RunStatus.RUNNING, null, List.of(), null, false, null, startedAt, null, null);
    }
}
