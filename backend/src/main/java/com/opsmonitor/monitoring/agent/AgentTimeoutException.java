package com.opsmonitor.monitoring.agent;

public class AgentTimeoutException extends AgentException {
    public AgentTimeoutException(String message) {
        super(message);
    }
}
