package com.opsmonitor.monitoring.model;

import java.util.Map;

/**
 * Partial update; a null field is left unchanged. An empty {@code slackChannelId} clears the override.
 */
public record UpdateMonitoringJobRequest(
    String name,
    String description,
    Integer scheduleIntervalMinutes,
    Boolean enabled,
    Map<String, Object> config,
    String notifyOn,
    String slackChannelId
) {}
