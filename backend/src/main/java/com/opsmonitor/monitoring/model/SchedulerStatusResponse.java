package com.opsmonitor.monitoring.model;

import java.time.Instant;

public record SchedulerStatusResponse(
    boolean running,
    int tickIntervalMs,
    Instant lastTickAt,
    TickSummary lastTick,
    long runningRuns
) {}
