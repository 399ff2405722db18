package com.codeguard.core.analyzer.deep;

import com.codeguard.core.analyzer.DeepInspection;
import com.codeguard.core.analyzer.DeepInspectionException;
import com.codeguard.core.analyzer.DeepInspectionRequest;
import com.codeguard.core.model.Finding;
import com.codeguard.core.model.Severity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Interprets the model's answer as a {@link DeepInspection}.
 *
 * <p>Markdown code fences and text around the outermost JSON object are tolerated. Issues
 * without a title are skipped, unknown severities become {@link Severity#MEDIUM} and a
 * missing confidence defaults to {@value #DEFAULT_CONFIDENCE}. Confidence filtering is left
 * to the merge step.
 *
 * @since 1.0.0
 */
public class DeepInspectionParser {

    static final double DEFAULT_CONFIDENCE = 0.8;

    private final ObjectMapper objectMapper;

    public DeepInspectionParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses the answer for a request.
     *
     * @param content raw message content
     * @param request the request the answer belongs to
     * @return parsed inspection
     * @throws DeepInspectionException if no JSON object can be read
     */
    public DeepInspection parse(String content, DeepInspectionRequest request) throws DeepInspectionException {
        String json = extractJson(content);
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new DeepInspectionException("Deep inspection answer is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new DeepInspectionException("Deep inspection answer is not a JSON object");
        }

        List<Finding> findings = new ArrayList<>();
        for (JsonNode issue : root.path("issues")) {
            String title = text(issue, "title");
            if (title == null) {
                continue;
            }
            Severity severity = Severity.fromString(text(issue, "severity"));
            JsonNode line = issue.path("line_number");
            findings.add(Finding.builder()
                .title(title)
                .description(text(issue, "description"))
                .severity(severity == null ? Severity.MEDIUM : severity)
                .category(request.category())
                .filePath(request.file().path())
                .line(line.canConvertToInt() && line.asInt() > 0 ? line.asInt() : null)
                .codeSnippet(text(issue, "code_snippet"))
                .suggestion(text(issue, "suggestion"))
                .confidence(issue.path("confidence").isNumber() ? issue.path("confidence").asDouble() : DEFAULT_CONFIDENCE)
                .ruleId(text(issue, "rule_id"))
                .build());
        }

        return new DeepInspection(
            indexes(root.path("confirmed")),
            indexes(root.path("false_positives")),
            findings,
            text(root, "overall_assessment"));
    }

    static String extractJson(String content) throws DeepInspectionException {
        if (content == null || content.isBlank()) {
            throw new DeepInspectionException("Deep inspection answer is empty");
        }
        String text = content.strip();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            text = firstNewline < 0 ? "" : text.substring(firstNewline + 1);
            int fence = text.lastIndexOf("```");
            if (fence >= 0) {
                text = text.substring(0, fence);
            }
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end < start) {
            throw new DeepInspectionException("Deep inspection answer contains no JSON object");
        }
        return text.substring(start, end + 1);
    }

    private static Set<Integer> indexes(JsonNode array) {
        Set<Integer> result = new LinkedHashSet<>();
        for (JsonNode node : array) {
            if (node.canConvertToInt() && node.asInt() >= 0) {
                result.add(node.asInt());
            }
        }
        return result;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
