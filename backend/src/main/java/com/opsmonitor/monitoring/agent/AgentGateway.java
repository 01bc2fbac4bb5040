package com.opsmonitor.monitoring.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Duration;
import java.util.Optional;

/**
 * Wire-level access to the agent service: start a run, poll it, fetch the final thread state.
 */
public interface AgentGateway {

    /**
     * @throws AgentProtocolException when the run cannot be started or the response lacks ids
     */
    AgentRunHandle startRun(ObjectNode runBody);

    /**
     * @param timeout upper bound for this poll; implementations may use less but never more
     */
    AgentRunStatus getRunStatus(String runId, Duration timeout);

    Optional<JsonNode> getThreadState(String threadId);
}
