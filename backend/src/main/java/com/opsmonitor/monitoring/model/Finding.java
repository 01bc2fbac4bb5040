package com.opsmonitor.monitoring.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One structured observation reported by the agent. {@code value} is either a {@link String} or a
 * {@link Number}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Finding(
    FindingType type,
    String title,
    String description,
    String metric,
    Object value
) {
    public Finding {
        if (type == null) {
            throw new IllegalArgumentException("finding type is required");
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("finding title is required");
        }
        if (value != null && !(value instanceof String) && !(value instanceof Number)) {
            throw new IllegalArgumentException("finding value must be a string or a number");
        }
    }

    public static Finding of(FindingType type, String title) {
        return new Finding(type, title, null, null, null);
    }

    public boolean isIssue() {
        return type.isIssue();
    }
}
