package com.opsmonitor.monitoring.service;

import com.opsmonitor.config.MonitoringProperties;
import com.opsmonitor.monitoring.model.MonitoringJob;
import com.opsmonitor.monitoring.model.MonitoringJobRun;
import com.opsmonitor.monitoring.model.RunOutcome;
import com.opsmonitor.monitoring.persistence.MonitoringJobRepository;
import com.opsmonitor.monitoring.persistence.MonitoringRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Owns the run row lifecycle. A run is opened before any external call is made and is closed at most
 * once; the job's counters are updated separately so a failed run write never blocks rescheduling.
 */
@Service
public class RunRecorder {
    private static final Logger log = LoggerFactory.getLogger(RunRecorder.class);

    private final MonitoringRunRepository runRepository;
    private final MonitoringJobRepository jobRepository;
    private final MonitoringProperties properties;

    public RunRecorder(
        MonitoringRunRepository runRepository,
        MonitoringJobRepository jobRepository,
        MonitoringProperties properties
    ) {
        this.runRepository = runRepository;
        this.jobRepository = jobRepository;
        this.properties = properties;
    }

    public MonitoringJobRun startRun(MonitoringJob job) {
        MonitoringJobRun run = MonitoringJobRun.started(UUID.randomUUID(), job.id(), job.orgId(), Instant.now());
        try {
            runRepository.insertRun(run, !properties.getScheduler().isAllowOverlappingRuns());
        } catch (DuplicateKeyException e) {
            throw new JobRunInProgressException("Monitoring job " + job.id() + " already has a run in progress");
        } catch (DataAccessException e) {
            log.error("Failed to create run record for job {} ({})", job.id(), job.name(), e);
            throw new RunCreationException("Failed to create run record for job " + job.id(), e);
        }
        return run;
    }

    /**
     * Called by the worker that picks the run up, so queue time is not counted as run time.
     *
     * @return the restamped run, or {@code null} when the run was finalized while it sat in the queue
     */
    public MonitoringJobRun markPickedUp(MonitoringJobRun run) {
        Instant pickedUpAt = Instant.now();
        try {
            if (runRepository.markRunStarted(run.id(), pickedUpAt) == 0) {
                log.warn("Run {} of job {} was finalized before a worker picked it up", run.id(), run.jobId());
                return null;
            }
            return run.withStartedAt(pickedUpAt);
        } catch (DataAccessException e) {
            log.warn("Failed to restamp run {} on pickup: {}", run.id(), e.getMessage());
            return run;
        }
    }

    /**
     * @return false when the run was already terminal, missing, or the write failed
     */
    public boolean finishRun(MonitoringJobRun run, RunOutcome outcome) {
        String errorMessage = outcome.isSuccess() ? null : truncate(outcome.errorMessage());
        long durationMs = run.startedAt() == null
            ? 0L
            : Duration.between(run.startedAt(), outcome.completedAt()).toMillis();
        try {
            int updated = runRepository.finishRun(run.id(), outcome, errorMessage, durationMs);
            if (updated == 0) {
                log.warn("Run {} was not running anymore; keeping its first outcome", run.id());
                return false;
            }
            return true;
        } catch (DataAccessException e) {
            log.warn("Failed to finalize run {} as {}: {}", run.id(), outcome.status().wireValue(), e.getMessage());
            return false;
        }
    }

    public void updateJobAfterRun(UUID jobId, boolean success) {
        try {
            if (!jobRepository.updateJobAfterRun(jobId, success, Instant.now())) {
                log.warn("Job {} disappeared before its run outcome was recorded", jobId);
            }
        } catch (DataAccessException e) {
            log.warn("Failed to update job {} after run (success={}): {}", jobId, success, e.getMessage());
        }
    }

    String truncate(String message) {
        int max = properties.getRuns().getMaxErrorLength();
        if (message == null || message.length() <= max) {
            return message;
        }
        return message.substring(0, max);
    }
}
