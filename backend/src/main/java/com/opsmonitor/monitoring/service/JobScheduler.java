package com.opsmonitor.monitoring.service;

import com.opsmonitor.config.MonitoringProperties;
import com.opsmonitor.monitoring.model.JobDispatchResult;
import com.opsmonitor.monitoring.model.MonitoringJob;
import com.opsmonitor.monitoring.model.MonitoringJobRun;
import com.opsmonitor.monitoring.model.RunOutcome;
import com.opsmonitor.monitoring.model.RunTrigger;
import com.opsmonitor.monitoring.model.TickSummary;
import com.opsmonitor.monitoring.model.TriggerRunResponse;
import com.opsmonitor.monitoring.persistence.MonitoringJobRepository;
import com.opsmonitor.monitoring.persistence.MonitoringRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Finds due jobs across all tenants and hands each one to the worker pool. Dispatch returns as soon
 * as the run row exists; pipelines finish in the background.
 */
@Service
public class JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);
    static final String SKIP_RUN_IN_PROGRESS = "run_in_progress";
    static final String SKIP_CLAIMED_ELSEWHERE = "claimed_elsewhere";
    static final String SKIP_RUN_CREATION_FAILED = "run_creation_failed";
    static final String SKIP_REJECTED = "worker_pool_rejected";
    static final String SKIP_DATABASE_ERROR = "database_error";
    static final String REJECTED_MESSAGE = "Worker pool rejected the run";

    private final MonitoringJobRepository jobRepository;
    private final MonitoringRunRepository runRepository;
    private final RunRecorder runRecorder;
    private final MonitoringJobExecutor jobExecutor;
    private final StaleRunCleanupRunner staleRunCleanup;
    private final MonitoringProperties properties;
    private final ExecutorService workerPool;

    private volatile TickSummary lastTick;

    public JobScheduler(
        MonitoringJobRepository jobRepository,
        MonitoringRunRepository runRepository,
        RunRecorder runRecorder,
        MonitoringJobExecutor jobExecutor,
        StaleRunCleanupRunner staleRunCleanup,
        MonitoringProperties properties,
        @Qualifier("monitoringWorkerPool") ExecutorService workerPool
    ) {
        this.jobRepository = jobRepository;
        this.runRepository = runRepository;
        this.runRecorder = runRecorder;
        this.jobExecutor = jobExecutor;
        this.staleRunCleanup = staleRunCleanup;
        this.properties = properties;
        this.workerPool = workerPool;
    }

    public TickSummary tick() {
        Instant startedAt = Instant.now();
        sweepStaleRuns();
        List<MonitoringJob> dueJobs = jobRepository.findDueJobs(startedAt, properties.getScheduler().getMaxJobsPerTick());
        List<JobDispatchResult> results = new ArrayList<>();
        int dispatched = 0;
        for (MonitoringJob job : dueJobs) {
            JobDispatchResult result = dispatchDueJob(job, startedAt);
            if (result.dispatched()) {
                dispatched++;
            }
            results.add(result);
        }
        long durationMs = Duration.between(startedAt, Instant.now()).toMillis();
        TickSummary summary = new TickSummary(startedAt, dueJobs.size(), dispatched, List.copyOf(results), durationMs);
        lastTick = summary;
        if (!dueJobs.isEmpty()) {
            log.info("Scheduler tick dispatched {}/{} due monitoring jobs in {}ms", dispatched, dueJobs.size(), durationMs);
        }
        return summary;
    }

    public TriggerRunResponse triggerNow(UUID orgId, UUID jobId) {
        MonitoringJob job = jobRepository.findJob(orgId, jobId);
        if (job == null) {
            throw new MonitoringJobNotFoundException("Monitoring job not found: " + jobId);
        }
        if (!properties.getScheduler().isAllowOverlappingRuns() && runRepository.hasRunningRun(job.id())) {
            throw new JobRunInProgressException("Monitoring job " + jobId + " already has a run in progress");
        }
        MonitoringJobRun run = runRecorder.startRun(job);
        if (!submit(job, run, RunTrigger.MANUAL)) {
            throw new RunCreationException(REJECTED_MESSAGE);
        }
        log.info("Manually triggered monitoring job {} ({}) as run {}", job.id(), job.name(), run.id());
        return new TriggerRunResponse(job.id(), run.id(), "Job run started");
    }

    public TickSummary getLastTick() {
        return lastTick;
    }

    private JobDispatchResult dispatchDueJob(MonitoringJob job, Instant now) {
        try {
            if (!properties.getScheduler().isAllowOverlappingRuns() && runRepository.hasRunningRun(job.id())) {
                log.info("Skipping monitoring job {} ({}): previous run still in progress", job.id(), job.name());
                return JobDispatchResult.skipped(job, SKIP_RUN_IN_PROGRESS);
            }
            if (!jobRepository.claimDueJob(job.id(), job.nextRunAt(), job.nextRunAfter(now))) {
                return JobDispatchResult.skipped(job, SKIP_CLAIMED_ELSEWHERE);
            }
            MonitoringJobRun run = runRecorder.startRun(job);
            if (!submit(job, run, RunTrigger.SCHEDULED)) {
                return JobDispatchResult.skipped(job, SKIP_REJECTED);
            }
            return JobDispatchResult.dispatched(job, run.id());
        } catch (JobRunInProgressException e) {
            log.info("Skipping monitoring job {} ({}): another run started concurrently", job.id(), job.name());
            return JobDispatchResult.skipped(job, SKIP_RUN_IN_PROGRESS);
        } catch (RunCreationException e) {
            return JobDispatchResult.skipped(job, SKIP_RUN_CREATION_FAILED);
        } catch (DataAccessException e) {
            log.warn("Failed to dispatch monitoring job {}: {}", job.id(), e.getMessage());
            return JobDispatchResult.skipped(job, SKIP_DATABASE_ERROR);
        }
    }

    private void sweepStaleRuns() {
        try {
            staleRunCleanup.cleanUpStaleRuns();
        } catch (DataAccessException e) {
            log.warn("Stale monitoring run sweep failed: {}", e.getMessage());
        }
    }

    private boolean submit(MonitoringJob job, MonitoringJobRun run, RunTrigger trigger) {
        try {
            workerPool.execute(() -> {
                try {
                    MonitoringJobRun active = runRecorder.markPickedUp(run);
                    if (active != null) {
                        jobExecutor.execute(job, active, trigger);
                    }
                } catch (RuntimeException e) {
                    log.error("Unexpected failure running monitoring job {} run {}", job.id(), run.id(), e);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("Worker pool rejected monitoring job {} run {}", job.id(), run.id());
            runRecorder.finishRun(run, RunOutcome.failed(REJECTED_MESSAGE, Instant.now()));
            runRecorder.updateJobAfterRun(job.id(), false);
            return false;
        }
    }
}
