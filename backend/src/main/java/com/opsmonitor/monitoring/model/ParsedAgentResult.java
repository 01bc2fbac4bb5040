package com.opsmonitor.monitoring.model;

import java.util.List;

public record ParsedAgentResult(String summary, List<Finding> findings) {
    public static final String DEFAULT_SUMMARY = "Job completed";

    public ParsedAgentResult {
        summary = summary == null || summary.isBlank() ? DEFAULT_SUMMARY : summary;
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public static ParsedAgentResult empty() {
        return new ParsedAgentResult(DEFAULT_SUMMARY, List.of());
    }
}
