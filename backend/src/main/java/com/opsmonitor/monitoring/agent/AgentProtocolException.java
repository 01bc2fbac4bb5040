package com.opsmonitor.monitoring.agent;

public class AgentProtocolException extends AgentException {
    public AgentProtocolException(String message) {
        super(message);
    }

    public AgentProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
