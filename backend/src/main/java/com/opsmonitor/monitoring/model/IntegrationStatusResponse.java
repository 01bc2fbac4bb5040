package com.opsmonitor.monitoring.model;

import java.util.UUID;

public record IntegrationStatusResponse(
    UUID orgId,
    boolean datadogConnected,
    boolean githubConnected,
    boolean slackConnected
) {}
