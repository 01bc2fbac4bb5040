package com.opsmonitor.monitoring.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidIntegrationRequestException extends RuntimeException {
    public InvalidIntegrationRequestException(String message) {
        super(message);
    }
}
