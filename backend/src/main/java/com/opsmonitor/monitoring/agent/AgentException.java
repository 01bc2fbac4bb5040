package com.opsmonitor.monitoring.agent;

/**
 * Base type for failures talking to the investigation agent. The message is what ends up in a
 * failed run's error message, so it is kept short and free of credentials.
 */
public class AgentException extends RuntimeException {
    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
