package com.opsmonitor.monitoring.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

public record MonitoringJob(
    UUID id,
    UUID orgId,
    String name,
    String description,
    JobType jobType,
    int scheduleIntervalMinutes,
    boolean enabled,
    Map<String, Object> config,
    NotifyOn notifyOn,
    String slackChannelId,
    Instant lastRunAt,
    Instant nextRunAt,
    int consecutiveFailures,
    Instant createdAt,
    Instant updatedAt,
    String createdBy
) {
    public static final int MIN_INTERVAL_MINUTES = 5;
    public static final int MAX_INTERVAL_MINUTES = 1440;

    public MonitoringJob {
        config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
        notifyOn = notifyOn == null ? NotifyOn.ISSUES : notifyOn;
    }

    public Duration scheduleInterval() {
        return Duration.ofMinutes(scheduleIntervalMinutes);
    }

    public Instant nextRunAfter(Instant from) {
        return from.plus(scheduleInterval());
    }

    public boolean isDue(Instant now) {
        return enabled && nextRunAt != null && !nextRunAt.isAfter(now);
    }
}
