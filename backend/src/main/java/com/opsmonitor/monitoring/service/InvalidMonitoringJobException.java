package com.opsmonitor.monitoring.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidMonitoringJobException extends RuntimeException {
    public InvalidMonitoringJobException(String message) {
        super(message);
    }
}
