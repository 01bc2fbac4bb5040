package com.opsmonitor.monitoring.model;

public record MonitoringJobView(MonitoringJob job, MonitoringJobRun latestRun) {}
