package com.opsmonitor.monitoring.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsmonitor.monitoring.model.Finding;
import com.opsmonitor.monitoring.model.FindingType;
import com.opsmonitor.monitoring.model.ParsedAgentResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@code {summary, findings}} from the agent's final message. Never throws: malformed or
 * missing output degrades to a text summary or to {@link ParsedAgentResult#DEFAULT_SUMMARY}.
 */
@Component
public class ResponseParser {
    private static final Logger log = LoggerFactory.getLogger(ResponseParser.class);
    private static final Pattern JSON_BLOCK = Pattern.compile("```json\\s*([\\s\\S]*?)\\s*```");
    private static final Pattern JSON_BLOCK_GREEDY = Pattern.compile("```json[\\s\\S]*```");
    private static final Set<String> AGENT_ROLES = Set.of("ai", "aimessage", "assistant");
    static final int MAX_SUMMARY_LENGTH = 500;

    private final ObjectMapper objectMapper;

    public ResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ParsedAgentResult parse(JsonNode rawOutput) {
        try {
            String text = lastAgentMessageText(rawOutput);
            if (text == null) {
                return ParsedAgentResult.empty();
            }
            return parseText(text);
        } catch (RuntimeException e) {
            log.warn("Unexpected agent output shape; using default summary", e);
            return ParsedAgentResult.empty();
        }
    }

    public ParsedAgentResult parseText(String responseText) {
        if (responseText == null || responseText.isEmpty()) {
            return ParsedAgentResult.empty();
        }
        Matcher matcher = JSON_BLOCK.matcher(responseText);
        if (!matcher.find()) {
            return new ParsedAgentResult(truncate(responseText), List.of());
        }

        JsonNode parsed = readJson(matcher.group(1));
        if (parsed == null) {
            String stripped = JSON_BLOCK_GREEDY.matcher(responseText).replaceAll("").trim();
            return new ParsedAgentResult(truncate(stripped), List.of());
        }
        if (!parsed.isObject()) {
            // valid JSON without fields to read, e.g. an array or a bare number
            return ParsedAgentResult.empty();
        }

        JsonNode summary = parsed.get("summary");
        String summaryText = summary != null && summary.isTextual() ? summary.asText() : null;
        return new ParsedAgentResult(summaryText, readFindings(parsed.get("findings")));
    }

    List<Finding> readFindings(JsonNode node) {
        List<Finding> findings = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return findings;
        }
        int dropped = 0;
        for (JsonNode entry : node) {
            Finding finding = toFinding(entry);
            if (finding == null) {
                dropped++;
            } else {
                findings.add(finding);
            }
        }
        if (dropped > 0) {
            log.debug("Dropped {} malformed findings from agent output", dropped);
        }
        return findings;
    }

    private Finding toFinding(JsonNode entry) {
        if (entry == null || !entry.isObject()) {
            return null;
        }
        FindingType type = FindingType.fromWire(optionalText(entry, "type"));
        String title = optionalText(entry, "title");
        if (type == null || title == null || title.isBlank()) {
            return null;
        }
        JsonNode rawValue = entry.get("value");
        Object value = null;
        if (rawValue != null && !rawValue.isNull()) {
            if (rawValue.isNumber()) {
                value = rawValue.numberValue();
            } else if (rawValue.isTextual()) {
                value = rawValue.asText();
            } else {
                return null;
            }
        }
        return new Finding(type, title, optionalText(entry, "description"), optionalText(entry, "metric"), value);
    }

    private String lastAgentMessageText(JsonNode output) {
        if (output == null || output.isNull() || output.isMissingNode()) {
            return null;
        }
        JsonNode messages = output.get("messages");
        if (messages == null || !messages.isArray()) {
            return null;
        }
        String last = null;
        for (JsonNode message : messages) {
            if (!isAgentMessage(message)) {
                continue;
            }
            String content = contentText(message.get("content"));
            if (content.isBlank() && hasToolCalls(message)) {
                continue;
            }
            last = content;
        }
        return last;
    }

    private boolean isAgentMessage(JsonNode message) {
        if (message == null || !message.isObject()) {
            return false;
        }
        String role = optionalText(message, "type");
        if (role == null) {
            role = optionalText(message, "role");
        }
        return role != null && AGENT_ROLES.contains(role.trim().toLowerCase(Locale.ROOT));
    }

    private boolean hasToolCalls(JsonNode message) {
        JsonNode toolCalls = message.get("tool_calls");
        return toolCalls != null && toolCalls.isArray() && !toolCalls.isEmpty();
    }

    private String contentText(JsonNode content) {
        if (content == null || content.isNull()) {
            return "";
        }
        if (content.isTextual()) {
            return content.asText();
        }
        if (content.isArray()) {
            StringBuilder text = new StringBuilder();
            for (JsonNode block : content) {
                if (block.isTextual()) {
                    text.append(block.asText());
                } else if (block.isObject() && "text".equals(optionalText(block, "type"))) {
                    String value = optionalText(block, "text");
                    if (value != null) {
                        text.append(value);
                    }
                }
            }
            return text.toString();
        }
        return "";
    }

    /**
     * @return the parsed block, or {@code null} when it is not JSON or is the JSON {@code null} literal
     */
    private JsonNode readJson(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            return node == null || node.isNull() || node.isMissingNode() ? null : node;
        } catch (JsonProcessingException e) {
            log.debug("Agent JSON block did not parse: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        return value.asText();
    }

    private static String truncate(String value) {
        if (value == null) {
            return null;
        }
        return value.length() <= MAX_SUMMARY_LENGTH ? value : value.substring(0, MAX_SUMMARY_LENGTH);
    }
}
