package com.codeguard.core.analyzer.deep;

import com.codeguard.core.analyzer.DeepInspectionRequest;
import com.codeguard.core.model.Finding;

import java.util.List;

/**
 * Builds the chat prompts sent to the deep inspection model.
 *
 * <p>The user prompt contains the numbered source (truncated to a character budget), the
 * Tier-1 findings with their zero-based indexes and the JSON answer format understood by
 * {@link DeepInspectionParser}.
 *
 * @since 1.0.0
 */
public class DeepInspectionPromptBuilder {

    static final String SYSTEM_PROMPT = """
        You are a senior code reviewer. You verify findings of static analysis tools and \
        report additional problems. Answer with a single JSON object and nothing else.""";

    private static final String RESPONSE_FORMAT = """
        Respond with JSON in exactly this shape:
        {
          "confirmed": [<indexes of listed findings that are real problems>],
          "false_positives": [<indexes of listed findings that are not real problems>],
          "issues": [
            {
              "title": "short title",
              "description": "what is wrong",
              "severity": "critical|high|medium|low|info",
              "line_number": 1,
              "code_snippet": "offending code",
              "suggestion": "how to fix it",
              "confidence": 0.0,
              "rule_id": "optional identifier"
            }
          ],
          "overall_assessment": "one or two sentences"
        }
        Only list issues that are not already covered by the listed findings.""";

    private final int maxContentChars;

    public DeepInspectionPromptBuilder(int maxContentChars) {
        if (maxContentChars <= 0) {
            throw new IllegalArgumentException("maxContentChars must be positive");
        }
        this.maxContentChars = maxContentChars;
    }

    public String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    /**
     * Builds the user prompt for one request.
     *
     * @param request inspection request
     * @return prompt text
     */
    public String userPrompt(DeepInspectionRequest request) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Review the file ").append(request.file().path())
            .append(" (language: ").append(request.file().language()).append(").\n");
        if (request.focus() != null && !request.focus().isBlank()) {
            prompt.append("Focus on: ").append(request.focus()).append("\n");
        }

        prompt.append("\nSource:\n```\n").append(numbered(request.file().content())).append("```\n");

        List<Finding> findings = request.tier1Findings();
        if (findings.isEmpty()) {
            prompt.append("\nThe static analyzer reported no findings.\n");
        } else {
            prompt.append("\nFindings reported by the static analyzer:\n");
            for (int i = 0; i < findings.size(); i++) {
                Finding finding = findings.get(i);
                prompt.append('[').append(i).append("] ")
                    .append(finding.severity() == null ? "?" : finding.severity().toJson())
                    .append(" line ").append(finding.line() == null ? "-" : finding.line())
                    .append(": ").append(finding.title());
                if (finding.description() != null && !finding.description().isBlank()) {
                    prompt.append(" - ").append(finding.description());
                }
                prompt.append('\n');
            }
        }
        prompt.append('\n').append(RESPONSE_FORMAT);
        return prompt.toString();
    }

    private String numbered(String content) {
        StringBuilder out = new StringBuilder();
        int lineNumber = 1;
        for (String line : content.lines().toList()) {
            String next = lineNumber + ": " + line + "\n";
            if (out.length() + next.length() > maxContentChars) {
                out.append("... (truncated)\n");
                break;
            }
            out.append(next);
            lineNumber++;
        }
        return out.toString();
    }
}
