package com.opsmonitor.monitoring.service;

import com.opsmonitor.monitoring.model.JobType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PromptBuilderTest {
    private final PromptBuilder builder = new PromptBuilder();

    @Test
    void healthCheckNamesConfiguredServicesAndEndsWithOutputContract() {
        String prompt = builder.build(JobType.HEALTH_CHECK, 15, Map.of("services", List.of("api")));

        assertThat(prompt).startsWith("Perform a health check on: api");
        assertThat(prompt).contains("```json");
        assertThat(prompt).endsWith(PromptBuilder.STRUCTURED_OUTPUT_INSTRUCTIONS);
    }

    @Test
    void healthCheckWithoutServicesCoversEverything() {
        String prompt = builder.build(JobType.HEALTH_CHECK, 15, Map.of());

        assertThat(prompt).contains("Perform a health check on: all monitored services");
    }

    @Test
    void deploymentWatcherLooksBackTwiceTheInterval() {
        String prompt = builder.build(JobType.DEPLOYMENT_WATCHER, 30, null);

        assertThat(prompt).contains("deployments in the last 60 minutes");
    }

    @Test
    void errorScannerUsesIntervalAndNamesTheQuietFinding() {
        String prompt = builder.build(JobType.ERROR_SCANNER, 20, Map.of());

        assertThat(prompt).contains("error patterns in the last 20 minutes");
        assertThat(prompt).contains("title \"" + PromptBuilder.NO_NEW_ERROR_PATTERNS + "\"");
    }

    @Test
    void baselineBuilderAsksForInfoFindings() {
        String prompt = builder.build(JobType.BASELINE_BUILDER, 60, Map.of());

        assertThat(prompt).contains("Report each metric as a finding with type \"info\".");
    }

    @Test
    void customUsesConfiguredPromptOrFallsBack() {
        assertThat(builder.build(JobType.CUSTOM, 5, Map.of("prompt", "Check the billing queue depth.")))
            .startsWith("Check the billing queue depth.");
        assertThat(builder.build(JobType.CUSTOM, 5, Map.of("prompt", "  ")))
            .startsWith(PromptBuilder.DEFAULT_CUSTOM_PROMPT);
        assertThat(builder.build(null, 5, Map.of()))
            .isEqualTo(PromptBuilder.DEFAULT_CUSTOM_PROMPT + PromptBuilder.STRUCTURED_OUTPUT_INSTRUCTIONS);
    }
}
