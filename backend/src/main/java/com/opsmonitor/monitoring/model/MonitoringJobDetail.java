package com.opsmonitor.monitoring.model;

import java.util.List;

public record MonitoringJobDetail(MonitoringJob job, List<MonitoringJobRun> runs) {}
