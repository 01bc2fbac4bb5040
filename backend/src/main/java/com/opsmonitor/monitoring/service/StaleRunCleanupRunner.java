package com.opsmonitor.monitoring.service;

import com.opsmonitor.config.MonitoringProperties;
import com.opsmonitor.monitoring.model.MonitoringJobRun;
import com.opsmonitor.monitoring.model.RunOutcome;
import com.opsmonitor.monitoring.persistence.MonitoringJobRepository;
import com.opsmonitor.monitoring.persistence.MonitoringRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Fails runs left in {@code running} whose worker is gone, for example after a restart. Runs once at
 * startup and again at the start of every scheduler tick, so an orphan younger than the threshold at
 * startup is still finalized once it ages past it.
 */
@Component
public class StaleRunCleanupRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StaleRunCleanupRunner.class);
    static final String INTERRUPTED_MESSAGE = "Run interrupted before completion";

    private final MonitoringJobRepository jobRepository;
    private final MonitoringRunRepository runRepository;
    private final RunRecorder runRecorder;
    private final MonitoringProperties properties;

    public StaleRunCleanupRunner(
        MonitoringJobRepository jobRepository,
        MonitoringRunRepository runRepository,
        RunRecorder runRecorder,
        MonitoringProperties properties
    ) {
        this.jobRepository = jobRepository;
        this.runRepository = runRepository;
        this.runRecorder = runRecorder;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        cleanUpStaleRuns();
    }

    public int cleanUpStaleRuns() {
        boolean dbConnected;
        try {
            dbConnected = jobRepository.isDbReachable();
        } catch (Exception e) {
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping stale monitoring run cleanup because database is unreachable");
            return 0;
        }

        Instant cutoff = Instant.now().minus(staleRunThreshold());
        List<MonitoringJobRun> stale = runRepository.findStaleRunningRuns(cutoff);
        int finalized = 0;
        for (MonitoringJobRun run : stale) {
            if (runRecorder.finishRun(run, RunOutcome.failed(INTERRUPTED_MESSAGE, Instant.now()))) {
                runRecorder.updateJobAfterRun(run.jobId(), false);
                finalized++;
                log.info("Failed stale monitoring run {} of job {} startedAt={}", run.id(), run.jobId(), run.startedAt());
            }
        }
        if (finalized > 0) {
            log.info("Failed {} stale monitoring runs older than {}", finalized, staleRunThreshold());
        }
        return finalized;
    }

    /**
     * Age after which a running run cannot still have a live worker: one full pipeline for every job
     * that may queue ahead of it plus its own, and never less than the configured stale-run minutes.
     */
    Duration staleRunThreshold() {
        MonitoringProperties.Scheduler scheduler = properties.getScheduler();
        MonitoringProperties.Agent agent = properties.getAgent();
        Duration pipeline = Duration.ofSeconds(properties.getCredentials().getTimeoutSeconds())
            .plusMillis(agent.getMaxPollMs())
            // start, last poll and state fetch may each use a full request timeout
            .plusSeconds(3L * agent.getRequestTimeoutSeconds());
        long queuedAhead = (scheduler.getMaxJobsPerTick() + scheduler.getWorkerCount() - 1L) / scheduler.getWorkerCount();
        Duration worstCase = pipeline.multipliedBy(queuedAhead + 1);
        Duration configured = Duration.ofMinutes(scheduler.getStaleRunMinutes());
        return worstCase.compareTo(configured) > 0 ? worstCase : configured;
    }
}
