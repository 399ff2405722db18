package com.codeguard.core.report;

import com.codeguard.core.model.Finding;
import com.codeguard.core.model.Severity;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * A deduplicated finding as it appears in the report, with attribution.
 *
 * @param title short title
 * @param description explanation
 * @param severity severity
 * @param category category tag
 * @param filePath file path
 * @param line 1-based line or null
 * @param column 1-based column or null
 * @param confidence highest confidence among merged duplicates
 * @param suggestion remediation text
 * @param ruleId rule identifier
 * @param references union of references of merged duplicates
 * @param codeSnippet source excerpt
 * @param analyzer analyzer that reported the representative finding
 * @param detectedBy all analyzers that reported a duplicate, sorted
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"title", "description", "severity", "category", "file_path", "line_number", "column",
    "confidence", "suggestion", "rule_id", "references", "code_snippet", "analyzer", "detected_by"})
public record ReportedIssue(
    @JsonProperty("title") String title,
    @JsonProperty("description") String description,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("category") String category,
    @JsonProperty("file_path") String filePath,
    @JsonInclude(JsonInclude.Include.ALWAYS) @JsonProperty("line_number") Integer line,
    @JsonInclude(JsonInclude.Include.ALWAYS) @JsonProperty("column") Integer column,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("suggestion") String suggestion,
    @JsonProperty("rule_id") String ruleId,
    @JsonProperty("references") List<String> references,
    @JsonProperty("code_snippet") String codeSnippet,
    @JsonProperty("analyzer") String analyzer,
    @JsonProperty("detected_by") List<String> detectedBy
) {
    public ReportedIssue {
        references = references == null ? List.of() : List.copyOf(references);
        detectedBy = detectedBy == null ? List.of() : List.copyOf(detectedBy);
    }

    /**
     * Creates a report entry from a merged finding.
     *
     * @param finding merged finding
     * @param analyzer representative analyzer
     * @param detectedBy all detecting analyzers
     * @return report entry
     */
    public static ReportedIssue of(Finding finding, String analyzer, List<String> detectedBy) {
        return new ReportedIssue(
            finding.title(),
            finding.description(),
            finding.severity(),
            finding.category(),
            finding.filePath(),
            finding.line(),
            finding.column(),
            finding.confidence(),
            finding.suggestion(),
            finding.ruleId(),
            finding.references(),
            finding.codeSnippet(),
            analyzer,
            detectedBy);
    }
}
