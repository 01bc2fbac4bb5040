package com.opsmonitor.monitoring.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class MonitoringJobNotFoundException extends RuntimeException {
    public MonitoringJobNotFoundException(String message) {
        super(message);
    }
}
