package com.opsmonitor.monitoring.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class JobRunInProgressException extends RuntimeException {
    public JobRunInProgressException(String message) {
        super(message);
    }
}
