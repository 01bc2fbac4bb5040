package com.opsmonitor.monitoring.model;

import java.time.Instant;
import java.util.List;

public record TickSummary(
    Instant startedAt,
    int totalDue,
    int dispatched,
    List<JobDispatchResult> results,
    long durationMs
) {}
