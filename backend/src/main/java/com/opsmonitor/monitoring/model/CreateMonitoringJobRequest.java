package com.opsmonitor.monitoring.model;

import java.util.Map;

/**
 * Enum-valued fields stay strings here so an unknown value can be reported by name.
 */
public record CreateMonitoringJobRequest(
    String name,
    String description,
    String jobType,
    Integer scheduleIntervalMinutes,
    Boolean enabled,
    Map<String, Object> config,
    String notifyOn,
    String slackChannelId
) {}
