package com.opsmonitor.monitoring.agent;

public record AgentRunHandle(String runId, String threadId) {}
