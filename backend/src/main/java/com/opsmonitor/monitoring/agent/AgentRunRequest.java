package com.opsmonitor.monitoring.agent;

import com.opsmonitor.monitoring.credentials.Credentials;

import java.time.Instant;
import java.util.UUID;

/**
 * Everything needed to start one agent run. {@code slackChannelId} overrides the tenant's default
 * Slack channel when set.
 */
public record AgentRunRequest(
    String investigationId,
    UUID orgId,
    AlertContext alertContext,
    String prompt,
    Credentials credentials,
    String slackChannelId,
    Instant startedAt
) {}
