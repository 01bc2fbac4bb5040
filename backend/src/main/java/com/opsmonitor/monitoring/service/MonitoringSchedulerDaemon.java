package com.opsmonitor.monitoring.service;

import com.opsmonitor.config.MonitoringProperties;
import com.opsmonitor.monitoring.model.SchedulerStatusResponse;
import com.opsmonitor.monitoring.model.TickSummary;
import com.opsmonitor.monitoring.persistence.MonitoringRunRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process ticker. Deployments that drive ticks from an external cron leave it disabled.
 */
@Service
public class MonitoringSchedulerDaemon {
    private static final Logger log = LoggerFactory.getLogger(MonitoringSchedulerDaemon.class);

    private final JobScheduler jobScheduler;
    private final MonitoringRunRepository runRepository;
    private final MonitoringProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private ExecutorService ticker;
    private volatile Instant lastTickAt;

    public MonitoringSchedulerDaemon(
        JobScheduler jobScheduler,
        MonitoringRunRepository runRepository,
        MonitoringProperties properties
    ) {
        this.jobScheduler = jobScheduler;
        this.runRepository = runRepository;
        this.properties = properties;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getScheduler().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    public SchedulerStatusResponse getStatus() {
        long runningRuns;
        try {
            runningRuns = runRepository.countRunningRuns();
        } catch (Exception e) {
            log.warn("Failed to count running monitoring runs", e);
            runningRuns = 0L;
        }
        TickSummary lastTick = jobScheduler.getLastTick();
        Instant tickAt = lastTickAt != null ? lastTickAt : (lastTick == null ? null : lastTick.startedAt());
        return new SchedulerStatusResponse(
            running.get(),
            properties.getScheduler().getTickIntervalMs(),
            tickAt,
            lastTick,
            runningRuns
        );
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            int tickIntervalMs = properties.getScheduler().getTickIntervalMs();
            ticker = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("monitoring-scheduler");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            ticker.submit(() -> tickLoop(tickIntervalMs));
            log.info("Monitoring scheduler started (tick every {}ms)", tickIntervalMs);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (ticker != null) {
                ticker.shutdownNow();
                try {
                    ticker.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                ticker = null;
            }
            log.info("Monitoring scheduler stopped");
        }
    }

    private void tickLoop(int tickIntervalMs) {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            try {
                lastTickAt = Instant.now();
                jobScheduler.tick();
            } catch (Exception e) {
                log.warn("Monitoring scheduler tick failed", e);
            }
            sleep(tickIntervalMs);
        }
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
