package com.opsmonitor.monitoring.agent;

public class AgentExecutionException extends AgentException {
    public AgentExecutionException(String message) {
        super(message);
    }

    public AgentExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
