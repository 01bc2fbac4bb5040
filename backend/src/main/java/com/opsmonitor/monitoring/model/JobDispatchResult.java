package com.opsmonitor.monitoring.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobDispatchResult(UUID jobId, String jobName, UUID runId, boolean dispatched, String error) {
    public static JobDispatchResult dispatched(MonitoringJob job, UUID runId) {
        return new JobDispatchResult(job.id(), job.name(), runId, true, null);
    }

    public static JobDispatchResult skipped(MonitoringJob job, String reason) {
        return new JobDispatchResult(job.id(), job.name(), null, false, reason);
    }
}
