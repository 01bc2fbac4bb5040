package com.opsmonitor.monitoring.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.opsmonitor.config.MonitoringProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

@Service
public class HttpAgentGateway implements AgentGateway {
    private static final Logger log = LoggerFactory.getLogger(HttpAgentGateway.class);
    private static final String JSON = "application/json";

    private final MonitoringProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public HttpAgentGateway(
        MonitoringProperties properties,
        ObjectMapper objectMapper,
        @Qualifier("agentHttpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        // the agent server does not accept an HTTP/2 upgrade
        this.client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.getAgent().getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    @Override
    public AgentRunHandle startRun(ObjectNode runBody) {
        String body;
        try {
            body = objectMapper.writeValueAsString(runBody);
        } catch (JsonProcessingException e) {
            throw new AgentProtocolException("Failed to encode agent run request", e);
        }
        AgentHttpResponse response = send("POST", "/runs", body, requestTimeout());
        if (!response.isSuccessful()) {
            throw new AgentProtocolException("Agent API error: " + response.describeFailure());
        }
        JsonNode json = readJson(response.body());
        String runId = text(json, "run_id");
        String threadId = text(json, "thread_id");
        if (runId == null || threadId == null) {
            throw new AgentProtocolException("No run_id or thread_id returned from agent");
        }
        return new AgentRunHandle(runId, threadId);
    }

    @Override
    public AgentRunStatus getRunStatus(String runId, Duration timeout) {
        Duration pollTimeout = timeout == null || timeout.compareTo(requestTimeout()) > 0 ? requestTimeout() : timeout;
        if (pollTimeout.isNegative() || pollTimeout.isZero()) {
            pollTimeout = Duration.ofMillis(1);
        }
        AgentHttpResponse response = send("GET", "/runs/" + encode(runId), null, pollTimeout);
        if (!response.isSuccessful()) {
            log.debug("Agent status poll for run {} failed: {}", runId, response.describeFailure());
            return AgentRunStatus.pollFailed(response.describeFailure());
        }
        JsonNode json = readJson(response.body());
        if (json == null) {
            return AgentRunStatus.pollFailed("invalid_json");
        }
        return AgentRunStatus.of(text(json, "status"));
    }

    @Override
    public Optional<JsonNode> getThreadState(String threadId) {
        AgentHttpResponse response = send("GET", "/threads/" + encode(threadId) + "/state", null, requestTimeout());
        if (!response.isSuccessful()) {
            log.warn("Failed to fetch agent thread state {}: {}", threadId, response.describeFailure());
            return Optional.empty();
        }
        return Optional.ofNullable(readJson(response.body()));
    }

    private Duration requestTimeout() {
        return Duration.ofSeconds(properties.getAgent().getRequestTimeoutSeconds());
    }

    private AgentHttpResponse send(String method, String path, String body, Duration timeout) {
        Instant startedAt = Instant.now();
        String baseUrl = properties.getAgent().getBaseUrl();
        if (baseUrl == null) {
            throw new AgentProtocolException("Agent base URL is not configured");
        }
        String url = baseUrl + path;
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new AgentProtocolException("Agent base URL is malformed", e);
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(timeout)
            .header("Accept", JSON)
            .header("Content-Type", JSON);
        HttpRequest request = "POST".equalsIgnoreCase(method)
            ? builder.POST(HttpRequest.BodyPublishers.ofString(body == null ? "" : body, StandardCharsets.UTF_8)).build()
            : builder.GET().build();

        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            return new AgentHttpResponse(
                url,
                response.statusCode(),
                response.body(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResponse(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResponse(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResponse(url, startedAt, "interrupted", e.getMessage());
        }
    }

    private AgentHttpResponse errorResponse(String url, Instant startedAt, String code, String message) {
        return new AgentHttpResponse(url, 0, null, Duration.between(startedAt, Instant.now()), code, message);
    }

    private JsonNode readJson(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Agent returned a non-JSON body: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String text(JsonNode json, String field) {
        if (json == null) {
            return null;
        }
        JsonNode node = json.get(field);
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
