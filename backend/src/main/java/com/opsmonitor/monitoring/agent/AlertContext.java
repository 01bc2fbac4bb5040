package com.opsmonitor.monitoring.agent;

public record AlertContext(String alertName, String service, String severity, String message) {}
