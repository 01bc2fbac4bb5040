package com.opsmonitor.monitoring.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.opsmonitor.config.MonitoringProperties;
import com.opsmonitor.monitoring.credentials.Credentials;
import com.opsmonitor.monitoring.credentials.DatadogCredentials;
import com.opsmonitor.monitoring.credentials.SlackCredentials;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentClientTest {
    private static final UUID ORG_ID = UUID.fromString("0e9d8c7b-6a5f-4e3d-2c1b-0a9f8e7d6c5b");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private ExecutorService executor;
    private MonitoringProperties properties;
    private AgentClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(2);
        properties = new MonitoringProperties();
        properties.getAgent().setBaseUrl(server.url("/").toString());
        properties.getAgent().setPollIntervalMs(5);
        properties.getAgent().setMaxPollMs(2_000);
        properties.getAgent().setRequestTimeoutSeconds(5);
        client = new AgentClient(new HttpAgentGateway(properties, objectMapper, executor), properties, objectMapper);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void startsPollsAndReturnsThreadValues() throws Exception {
        server.enqueue(json("{\"run_id\":\"run-1\",\"thread_id\":\"thread-1\"}"));
        server.enqueue(json("{\"status\":\"pending\"}"));
        server.enqueue(json("{\"status\":\"running\"}"));
        server.enqueue(json("{\"status\":\"success\"}"));
        server.enqueue(json("{\"values\":{\"messages\":[{\"type\":\"ai\",\"content\":\"done\"}]}}"));

        JsonNode values = client.run(request(Credentials.none(), null));

        assertThat(values.path("messages").get(0).path("content").asText()).isEqualTo("done");
        RecordedRequest start = server.takeRequest();
        assertThat(start.getMethod()).isEqualTo("POST");
        assertThat(start.getPath()).isEqualTo("/runs");
        JsonNode body = objectMapper.readTree(start.getBody().readUtf8());
        assertThat(body.path("assistant_id").asText()).isEqualTo("investigation");
        assertThat(body.path("input").path("investigation_id").asText()).isEqualTo("monitoring-job-1");
        assertThat(server.takeRequest().getPath()).isEqualTo("/runs/run-1");
        assertThat(server.takeRequest().getPath()).isEqualTo("/runs/run-1");
        assertThat(server.takeRequest().getPath()).isEqualTo("/runs/run-1");
        assertThat(server.takeRequest().getPath()).isEqualTo("/threads/thread-1/state");
    }

    @Test
    void transientPollFailuresAreRetried() {
        server.enqueue(json("{\"run_id\":\"run-2\",\"thread_id\":\"thread-2\"}"));
        server.enqueue(new MockResponse().setResponseCode(502).setBody("bad gateway"));
        server.enqueue(json("not json"));
        server.enqueue(json("{\"status\":\"success\"}"));
        server.enqueue(json("{\"values\":{\"messages\":[]}}"));

        JsonNode values = client.run(request(Credentials.none(), null));

        assertThat(values.has("messages")).isTrue();
        assertThat(server.getRequestCount()).isEqualTo(5);
    }

    @Test
    void unreadableFinalStateYieldsNull() {
        server.enqueue(json("{\"run_id\":\"run-3\",\"thread_id\":\"thread-3\"}"));
        server.enqueue(json("{\"status\":\"success\"}"));
        server.enqueue(new MockResponse().setResponseCode(500));

        assertThat(client.run(request(Credentials.none(), null))).isNull();
    }

    @Test
    void errorStatusFailsTheRun() {
        server.enqueue(json("{\"run_id\":\"run-4\",\"thread_id\":\"thread-4\"}"));
        server.enqueue(json("{\"status\":\"error\"}"));

        assertThatThrownBy(() -> client.run(request(Credentials.none(), null)))
            .isInstanceOf(AgentExecutionException.class)
            .hasMessage("Agent run failed: error");
    }

    @Test
    void nonSuccessStartIsAProtocolError() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("overloaded"));

        assertThatThrownBy(() -> client.run(request(Credentials.none(), null)))
            .isInstanceOf(AgentProtocolException.class)
            .hasMessageStartingWith("Agent API error:");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void missingRunIdentifiersIsAProtocolError() {
        server.enqueue(json("{\"run_id\":\"run-5\"}"));

        assertThatThrownBy(() -> client.run(request(Credentials.none(), null)))
            .isInstanceOf(AgentProtocolException.class)
            .hasMessage("No run_id or thread_id returned from agent");
    }

    @Test
    void pollingStopsAtTheDeadline() {
        properties.getAgent().setMaxPollMs(150);
        properties.getAgent().setPollIntervalMs(20);
        List<Duration> pollTimeouts = new ArrayList<>();
        AgentGateway neverDone = new AgentGateway() {
            @Override
            public AgentRunHandle startRun(ObjectNode runBody) {
                return new AgentRunHandle("run-6", "thread-6");
            }

            @Override
            public AgentRunStatus getRunStatus(String runId, Duration timeout) {
                pollTimeouts.add(timeout);
                return AgentRunStatus.of("running");
            }

            @Override
            public Optional<JsonNode> getThreadState(String threadId) {
                return Optional.empty();
            }
        };
        AgentClient slowClient = new AgentClient(neverDone, properties, objectMapper);

        assertThatThrownBy(() -> slowClient.run(request(Credentials.none(), null)))
            .isInstanceOf(AgentTimeoutException.class)
            .hasMessage("Agent run timed out after 150 ms");
        assertThat(pollTimeouts).isNotEmpty().allSatisfy(timeout -> assertThat(timeout).isLessThanOrEqualTo(Duration.ofMillis(150)));
    }

    @Test
    void hangingStatusPollDoesNotOutlastTheDeadline() {
        properties.getAgent().setMaxPollMs(300);
        properties.getAgent().setPollIntervalMs(10);
        properties.getAgent().setRequestTimeoutSeconds(5);
        server.enqueue(json("{\"run_id\":\"run-7\",\"thread_id\":\"thread-7\"}"));
        server.enqueue(json("{\"status\":\"running\"}").setHeadersDelay(4, TimeUnit.SECONDS));

        long startedAt = System.nanoTime();
        assertThatThrownBy(() -> client.run(request(Credentials.none(), null)))
            .isInstanceOf(AgentTimeoutException.class);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);

        assertThat(elapsedMs).isLessThan(2_000L);
    }

    @Test
    void runBodyCarriesCredentialsAndChannelOverride() {
        Credentials credentials = new Credentials(
            Optional.of(new DatadogCredentials("dd-api", "dd-app", "datadoghq.com")),
            Optional.empty(),
            Optional.of(new SlackCredentials("xoxb-1", "C-DEFAULT"))
        );

        ObjectNode body = client.buildRunBody(request(credentials, "C-OVERRIDE"));

        JsonNode input = body.path("input");
        assertThat(input.path("messages").get(0).path("role").asText()).isEqualTo("human");
        assertThat(input.path("org_id").asText()).isEqualTo(ORG_ID.toString());
        assertThat(input.path("alert_context").path("alert_name").asText()).isEqualTo("Scheduled: API health");
        assertThat(input.path("datadog_creds").path("api_key").asText()).isEqualTo("dd-api");
        assertThat(input.get("github_creds").isNull()).isTrue();
        assertThat(input.path("slack_creds").path("channel_id").asText()).isEqualTo("C-OVERRIDE");
        assertThat(input.path("phase").asText()).isEqualTo("monitoring");
        assertThat(input.path("iteration").asInt()).isZero();
        assertThat(input.path("max_iterations").asInt()).isEqualTo(3);
        assertThat(input.path("recent_deployments").isArray()).isTrue();
        assertThat(input.path("affected_services").isEmpty()).isTrue();
        assertThat(input.path("started_at").asText()).isEqualTo("2026-01-02T03:04:05Z");
    }

    private AgentRunRequest request(Credentials credentials, String slackChannelId) {
        String prompt = "Perform a health check on: api";
        return new AgentRunRequest(
            "monitoring-job-1",
            ORG_ID,
            new AlertContext("Scheduled: API health", "monitoring", "info", prompt),
            prompt,
            credentials,
            slackChannelId,
            Instant.parse("2026-01-02T03:04:05Z")
        );
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }
}
