package com.opsmonitor.monitoring.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.opsmonitor.monitoring.model.Finding;
import com.opsmonitor.monitoring.model.FindingType;
import com.opsmonitor.monitoring.model.ParsedAgentResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.tuple;

class ResponseParserTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ResponseParser parser = new ResponseParser(objectMapper);

    @Test
    void readsSummaryAndFindingsFromFencedBlock() {
        ParsedAgentResult result = parser.parse(stateWithAiMessage(
            "Checked everything.\n```json\n{\"summary\":\"All clear\",\"findings\":[]}\n```"
        ));

        assertThat(result.summary()).isEqualTo("All clear");
        assertThat(result.findings()).isEmpty();
    }

    @Test
    void brokenJsonFallsBackToTextWithoutFindings() {
        String content = "Latency looks elevated on checkout.\n```json\n{bad json```";

        ParsedAgentResult result = parser.parse(stateWithAiMessage(content));

        assertThat(result.summary()).isEqualTo("Latency looks elevated on checkout.");
        assertThat(result.findings()).isEmpty();
    }

    @Test
    void brokenJsonOnlyStillYieldsNonEmptySummary() {
        ParsedAgentResult result = parser.parseText("```json\n{bad json```");

        assertThat(result.summary()).isEqualTo(ParsedAgentResult.DEFAULT_SUMMARY);
        assertThat(result.findings()).isEmpty();
    }

    @Test
    void textWithoutBlockIsTruncated() {
        String longText = "x".repeat(ResponseParser.MAX_SUMMARY_LENGTH + 50);

        ParsedAgentResult result = parser.parseText(longText);

        assertThat(result.summary()).hasSize(ResponseParser.MAX_SUMMARY_LENGTH);
        assertThat(result.findings()).isEmpty();
    }

    @Test
    void keepsValidFindingsAndDropsMalformedOnes() {
        String content = """
            Report
            ```json
            {
              "summary": "One regression",
              "findings": [
                {"type": "error", "title": "p95 up", "metric": "latency.p95", "value": 812.5},
                {"type": "success", "title": "Deploy ok", "value": "v42"},
                {"type": "bogus", "title": "unknown type"},
                {"type": "info"},
                {"type": "warning", "title": "object value", "value": {"nested": true}},
                "not an object"
              ]
            }
            ```""";

        ParsedAgentResult result = parser.parseText(content);

        assertThat(result.summary()).isEqualTo("One regression");
        assertThat(result.findings())
            .extracting(Finding::type, Finding::title)
            .containsExactly(
                tuple(FindingType.ERROR, "p95 up"),
                tuple(FindingType.SUCCESS, "Deploy ok")
            );
        assertThat(result.findings().get(0).metric()).isEqualTo("latency.p95");
        assertThat(((Number) result.findings().get(0).value()).doubleValue()).isEqualTo(812.5);
        assertThat(result.findings().get(1).value()).isEqualTo("v42");
    }

    @Test
    void blockHoldingAnArrayOrScalarUsesDefaultSummary() {
        ParsedAgentResult array = parser.parseText("Raw notes here.\n```json\n[{\"type\":\"error\",\"title\":\"x\"}]\n```");
        ParsedAgentResult scalar = parser.parseText("Raw notes here.\n```json\n42\n```");

        assertThat(array.summary()).isEqualTo(ParsedAgentResult.DEFAULT_SUMMARY);
        assertThat(array.findings()).isEmpty();
        assertThat(scalar.summary()).isEqualTo(ParsedAgentResult.DEFAULT_SUMMARY);
        assertThat(scalar.findings()).isEmpty();
    }

    @Test
    void blockHoldingJsonNullFallsBackToText() {
        ParsedAgentResult result = parser.parseText("Nothing structured.\n```json\nnull\n```");

        assertThat(result.summary()).isEqualTo("Nothing structured.");
    }

    @Test
    void missingSummaryInBlockUsesDefault() {
        ParsedAgentResult result = parser.parseText("```json\n{\"findings\":[{\"type\":\"info\",\"title\":\"ok\"}]}\n```");

        assertThat(result.summary()).isEqualTo(ParsedAgentResult.DEFAULT_SUMMARY);
        assertThat(result.findings()).hasSize(1);
    }

    @Test
    void usesLastAgentMessageAndSkipsToolCallStubs() {
        ObjectNode state = objectMapper.createObjectNode();
        ArrayNode messages = state.putArray("messages");
        messages.addObject().put("type", "human").put("content", "```json\n{\"summary\":\"from human\"}\n```");
        messages.addObject().put("type", "ai").put("content", "```json\n{\"summary\":\"first answer\"}\n```");
        ObjectNode last = messages.addObject().put("role", "assistant");
        last.putArray("content").addObject().put("type", "text").put("text", "```json\n{\"summary\":\"final answer\"}\n```");
        ObjectNode toolStub = messages.addObject().put("type", "AIMessage").put("content", "");
        toolStub.putArray("tool_calls").addObject().put("name", "datadog_query");

        ParsedAgentResult result = parser.parse(state);

        assertThat(result.summary()).isEqualTo("final answer");
    }

    @Test
    void missingOrOddShapesGiveDefaultSummary() {
        assertThat(parser.parse(null).summary()).isEqualTo(ParsedAgentResult.DEFAULT_SUMMARY);
        assertThat(parser.parse(objectMapper.createObjectNode()).summary()).isEqualTo(ParsedAgentResult.DEFAULT_SUMMARY);
        assertThat(parser.parse(objectMapper.createArrayNode()).summary()).isEqualTo(ParsedAgentResult.DEFAULT_SUMMARY);

        ObjectNode humanOnly = objectMapper.createObjectNode();
        humanOnly.putArray("messages").addObject().put("type", "human").put("content", "hello");
        assertThat(parser.parse(humanOnly).summary()).isEqualTo(ParsedAgentResult.DEFAULT_SUMMARY);
    }

    @Test
    void neverThrowsForArbitraryText() {
        String[] inputs = {
            "",
            "plain text",
            "```json",
            "```json\n```",
            "```json\n[1,2,3]\n```",
            "```json\n\"just a string\"\n```",
            "```json\n{\"summary\": 42, \"findings\": \"nope\"}\n```",
            "```json\n{\"findings\":[null, 1, {\"type\":null,\"title\":null}]}\n```",
            "\u0000```json{}```"
        };
        for (String input : inputs) {
            assertThatCode(() -> {
                ParsedAgentResult result = parser.parseText(input);
                assertThat(result.summary()).isNotNull();
                assertThat(result.findings()).isNotNull();
            }).doesNotThrowAnyException();
        }
    }

    private JsonNode stateWithAiMessage(String content) {
        ObjectNode state = objectMapper.createObjectNode();
        state.putArray("messages").addObject().put("type", "ai").put("content", content);
        return state;
    }
}
