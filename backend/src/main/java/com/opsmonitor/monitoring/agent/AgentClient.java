package com.opsmonitor.monitoring.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.opsmonitor.config.MonitoringProperties;
import com.opsmonitor.monitoring.credentials.Credentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Runs one investigation on the agent service: start, poll until a terminal status, fetch the final
 * thread state. The wait is capped from the moment the run was accepted; hitting the cap only stops
 * waiting, the remote run is left alone.
 */
@Service
public class AgentClient {
    private static final Logger log = LoggerFactory.getLogger(AgentClient.class);
    private static final String PHASE = "monitoring";

    private final AgentGateway gateway;
    private final MonitoringProperties properties;
    private final ObjectMapper objectMapper;

    public AgentClient(AgentGateway gateway, MonitoringProperties properties, ObjectMapper objectMapper) {
        this.gateway = gateway;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * @return the final thread values, or {@code null} when the run succeeded but its state could not be read
     */
    public JsonNode run(AgentRunRequest request) {
        ObjectNode body = buildRunBody(request);
        AgentRunHandle handle = gateway.startRun(body);
        log.info(
            "Started agent run {} (thread {}) for investigation {}",
            handle.runId(),
            handle.threadId(),
            request.investigationId()
        );
        return awaitCompletion(handle);
    }

    JsonNode awaitCompletion(AgentRunHandle handle) {
        long pollIntervalMs = properties.getAgent().getPollIntervalMs();
        long maxPollMs = properties.getAgent().getMaxPollMs();
        Instant deadline = Instant.now().plusMillis(maxPollMs);
        int polls = 0;

        while (true) {
            long remainingMs = Duration.between(Instant.now(), deadline).toMillis();
            if (remainingMs <= 0) {
                throw timeout(handle, maxPollMs, polls);
            }
            sleep(Math.min(pollIntervalMs, remainingMs));
            Duration left = Duration.between(Instant.now(), deadline);
            if (left.isNegative() || left.isZero()) {
                throw timeout(handle, maxPollMs, polls);
            }

            AgentRunStatus status = gateway.getRunStatus(handle.runId(), left);
            polls++;
            if (status.isPollFailure()) {
                continue;
            }
            if (status.isSuccess()) {
                log.info("Agent run {} succeeded after {} polls", handle.runId(), polls);
                return gateway.getThreadState(handle.threadId())
                    .map(AgentClient::stateValues)
                    .orElse(null);
            }
            if (status.isFailed()) {
                throw new AgentExecutionException("Agent run failed: " + status.status());
            }
        }
    }

    ObjectNode buildRunBody(AgentRunRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("assistant_id", properties.getAgent().getAssistantId());

        ObjectNode input = body.putObject("input");
        ArrayNode messages = input.putArray("messages");
        messages.addObject()
            .put("role", "human")
            .put("content", request.prompt());
        input.put("investigation_id", request.investigationId());
        input.put("org_id", request.orgId() == null ? null : request.orgId().toString());

        AlertContext alert = request.alertContext();
        ObjectNode alertContext = input.putObject("alert_context");
        alertContext.put("alert_name", alert.alertName());
        alertContext.put("service", alert.service());
        alertContext.put("severity", alert.severity());
        alertContext.put("message", alert.message());

        Credentials credentials = request.credentials() == null ? Credentials.none() : request.credentials();
        putCredentials(input, credentials, request.slackChannelId());

        input.put("phase", PHASE);
        input.put("iteration", 0);
        input.put("max_iterations", properties.getAgent().getMaxIterations());
        input.putArray("recent_deployments");
        input.putArray("affected_services");
        Instant startedAt = request.startedAt() == null ? Instant.now() : request.startedAt();
        input.put("started_at", startedAt.toString());
        return body;
    }

    private void putCredentials(ObjectNode input, Credentials credentials, String slackChannelOverride) {
        credentials.datadog().ifPresentOrElse(
            datadog -> input.putObject("datadog_creds")
                .put("api_key", datadog.apiKey())
                .put("app_key", datadog.appKey())
                .put("site", datadog.site()),
            () -> input.putNull("datadog_creds")
        );
        credentials.github().ifPresentOrElse(
            github -> input.putObject("github_creds")
                .put("app_id", github.appId())
                .put("private_key", github.privateKey())
                .put("installation_id", github.installationId()),
            () -> input.putNull("github_creds")
        );
        credentials.slack().ifPresentOrElse(
            slack -> input.putObject("slack_creds")
                .put("bot_token", slack.botToken())
                .put(
                    "channel_id",
                    slackChannelOverride == null || slackChannelOverride.isBlank()
                        ? slack.channelId()
                        : slackChannelOverride
                ),
            () -> input.putNull("slack_creds")
        );
    }

    private static JsonNode stateValues(JsonNode state) {
        JsonNode values = state.get("values");
        return values == null || values.isNull() ? state : values;
    }

    private AgentTimeoutException timeout(AgentRunHandle handle, long maxPollMs, int polls) {
        log.warn("Agent run {} did not finish within {} ms ({} polls)", handle.runId(), maxPollMs, polls);
        return new AgentTimeoutException("Agent run timed out after " + formatDuration(maxPollMs));
    }

    private static String formatDuration(long millis) {
        if (millis % 60_000L == 0) {
            return (millis / 60_000L) + " minutes";
        }
        if (millis % 1000L == 0) {
            return (millis / 1000L) + " seconds";
        }
        return millis + " ms";
    }

    private void sleep(long millis) {
        try {
            TimeUnit.MILLISECONDS.sleep(Math.max(1L, millis));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentExecutionException("Interrupted while waiting for agent run", e);
        }
    }
}
