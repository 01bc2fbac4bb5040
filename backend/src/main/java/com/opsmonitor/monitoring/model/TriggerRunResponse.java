package com.opsmonitor.monitoring.model;

import java.util.UUID;

public record TriggerRunResponse(UUID jobId, UUID runId, String message) {}
