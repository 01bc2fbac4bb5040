package com.opsmonitor.monitoring.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
public class RunCreationException extends RuntimeException {
    public RunCreationException(String message) {
        super(message);
    }

    public RunCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
