package com.opsmonitor.monitoring.service;

import com.opsmonitor.monitoring.model.JobType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Renders the instruction handed to the agent for a job. Every prompt ends with
 * {@link #STRUCTURED_OUTPUT_INSTRUCTIONS}, which {@link ResponseParser} relies on.
 */
@Component
public class PromptBuilder {
    public static final String DEFAULT_CUSTOM_PROMPT = "Perform a general system health check.";
    public static final String NO_NEW_ERROR_PATTERNS = "No new error patterns";

    public static final String STRUCTURED_OUTPUT_INSTRUCTIONS = """


        IMPORTANT: At the END of your response, you MUST include a JSON block with your findings in this exact format:

        ```json
        {
          "summary": "One sentence summary of what you found",
          "findings": [
            {
              "type": "info|warning|error|success",
              "title": "Short title for this finding",
              "description": "Detailed explanation (optional)",
              "metric": "metric name if applicable (optional)",
              "value": "metric value if applicable (optional)"
            }
          ]
        }
        ```

        Always include this JSON block, even if findings is an empty array.""";

    public String build(JobType jobType, int scheduleIntervalMinutes, Map<String, Object> config) {
        Map<String, Object> safeConfig = config == null ? Map.of() : config;
        String instruction;
        if (jobType == null) {
            instruction = DEFAULT_CUSTOM_PROMPT;
        } else {
            instruction = switch (jobType) {
                case DEPLOYMENT_WATCHER -> deploymentWatcher(scheduleIntervalMinutes);
                case HEALTH_CHECK -> healthCheck(safeConfig);
                case ERROR_SCANNER -> errorScanner(scheduleIntervalMinutes);
                case BASELINE_BUILDER -> baselineBuilder();
                case CUSTOM -> custom(safeConfig);
            };
        }
        return instruction + STRUCTURED_OUTPUT_INSTRUCTIONS;
    }

    private String deploymentWatcher(int scheduleIntervalMinutes) {
        return """
            You are monitoring for new deployments.

            Check GitHub for any deployments in the last %d minutes.

            For each deployment found:
            1. Note the commit SHA, message, author, and time
            2. Check if enough time has passed (at least 10 minutes) for metrics to stabilize
            3. If yes, compare error rates and latency before vs after the deployment
            4. Report any regressions found

            Findings:
            - No deployments: type "info"
            - Deployments with no regressions: type "success"
            - Regressions found: type "warning" or "error" based on severity""".formatted(scheduleIntervalMinutes * 2);
    }

    private String healthCheck(Map<String, Object> config) {
        List<String> services = services(config.get("services"));
        String serviceList = services.isEmpty() ? "all monitored services" : String.join(", ", services);
        return """
            Perform a health check on: %s

            For each service, check:
            1. Current error rate (compare to baseline if known)
            2. Current P95 latency (compare to baseline if known)
            3. Any new error patterns in the last 15 minutes

            Findings:
            - Healthy metrics: type "success"
            - Neutral observations: type "info"
            - Concerning but not critical: type "warning"
            - Critical issues: type "error\"""".formatted(serviceList);
    }

    private String errorScanner(int scheduleIntervalMinutes) {
        return """
            Scan logs for error patterns in the last %d minutes.

            1. Search for errors across all services
            2. Group similar errors together
            3. Identify NEW error patterns (not seen before)
            4. Note the frequency and affected services
            5. Skip routine errors that match known patterns

            Findings:
            - New error patterns: type "error" or "warning"
            - Significant increases: type "warning"
            - No issues: type "success" with title "%s\"""".formatted(scheduleIntervalMinutes, NO_NEW_ERROR_PATTERNS);
    }

    private String baselineBuilder() {
        return """
            Collect current metrics for service baselines.

            For each active service:
            1. Get current error rate
            2. Get current latency (P50, P95, P99)
            3. Get current request rate
            4. Get CPU and memory usage if available

            Report each metric as a finding with type "info".""";
    }

    private String custom(Map<String, Object> config) {
        Object prompt = config.get("prompt");
        if (prompt instanceof String text && !text.isBlank()) {
            return text;
        }
        return DEFAULT_CUSTOM_PROMPT;
    }

    private List<String> services(Object raw) {
        List<String> services = new ArrayList<>();
        if (raw instanceof Collection<?> values) {
            for (Object value : values) {
                if (value != null && !value.toString().isBlank()) {
                    services.add(value.toString().trim());
                }
            }
        } else if (raw instanceof String value && !value.isBlank()) {
            services.add(value.trim());
        }
        return services;
    }
}
