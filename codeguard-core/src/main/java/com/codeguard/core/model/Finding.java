package com.codeguard.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One problem reported by an analyzer for one file.
 *
 * <p>Findings are immutable. The {@code with*} methods return modified copies, which is how
 * Tier-2 inspection and deduplication enrich a finding without touching the original.</p>
 *
 * <p>Required fields ({@code title}, {@code severity}, {@code category}, {@code filePath})
 * are not enforced here: analyzers built outside this project may hand over incomplete
 * findings, and the aggregator is the single place that validates and drops them.
 * {@link #isWellFormed()} performs that check.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * Finding finding = Finding.builder()
 *     .title("Hardcoded API key")
 *     .severity(Severity.HIGH)
 *     .category("security")
 *     .filePath("src/config.py")
 *     .line(12)
 *     .ruleId("SEC-API-KEY")
 *     .confidence(0.95)
 *     .build();
 * }</pre>
 *
 * @param title short human-readable title
 * @param description longer explanation
 * @param severity severity level
 * @param category free-form category tag such as {@code "security"}
 * @param filePath path of the file the finding belongs to
 * @param line 1-based line number, or null when not line-specific
 * @param column 1-based column number, or null
 * @param confidence confidence in [0, 1]; out-of-range values are clamped
 * @param suggestion remediation text (nullable)
 * @param ruleId identifier of the check that produced the finding
 * @param references external reference URLs
 * @param codeSnippet offending source excerpt (nullable)
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Finding(
    @JsonProperty("title") String title,
    @JsonProperty("description") String description,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("category") String category,
    @JsonProperty("file_path") String filePath,
    @JsonProperty("line_number") Integer line,
    @JsonProperty("column") Integer column,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("suggestion") String suggestion,
    @JsonProperty("rule_id") String ruleId,
    @JsonProperty("references") List<String> references,
    @JsonProperty("code_snippet") String codeSnippet
) {
    /**
     * Compact constructor clamping confidence and copying references without nulls.
     */
    public Finding {
        if (Double.isNaN(confidence)) {
            confidence = 0.0;
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        references = references == null ? List.of() : references.stream().filter(Objects::nonNull).toList();
    }

    /**
     * Checks that every required field is present.
     *
     * @return true if title, severity, category and file path are set
     */
    @JsonIgnore
    public boolean isWellFormed() {
        return missingField() == null;
    }

    /**
     * Returns the name of the first missing required field.
     *
     * @return field name, or null if the finding is well formed
     */
    @JsonIgnore
    public String missingField() {
        if (title == null || title.isBlank()) {
            return "title";
        }
        if (severity == null) {
            return "severity";
        }
        if (category == null || category.isBlank()) {
            return "category";
        }
        if (filePath == null || filePath.isBlank()) {
            return "filePath";
        }
        return null;
    }

    public Finding withConfidence(double newConfidence) {
        return new Finding(title, description, severity, category, filePath, line, column,
            newConfidence, suggestion, ruleId, references, codeSnippet);
    }

    public Finding withSuggestion(String newSuggestion) {
        return new Finding(title, description, severity, category, filePath, line, column,
            confidence, newSuggestion, ruleId, references, codeSnippet);
    }

    public Finding withReferences(List<String> newReferences) {
        return new Finding(title, description, severity, category, filePath, line, column,
            confidence, suggestion, ruleId, newReferences, codeSnippet);
    }

    /**
     * Creates a new builder.
     *
     * @return empty builder with confidence 1.0
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for findings, used by analyzers that fill fields incrementally.
     */
    public static class Builder {
        private String title;
        private String description;
        private Severity severity;
        private String category;
        private String filePath;
        private Integer line;
        private Integer column;
        private double confidence = 1.0;
        private String suggestion;
        private String ruleId;
        private final List<String> references = new ArrayList<>();
        private String codeSnippet;

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder filePath(String filePath) {
            this.filePath = filePath;
            return this;
        }

        public Builder line(Integer line) {
            this.line = line;
            return this;
        }

        public Builder column(Integer column) {
            this.column = column;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder suggestion(String suggestion) {
            this.suggestion = suggestion;
            return this;
        }

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder reference(String reference) {
            if (reference != null) {
                this.references.add(reference);
            }
            return this;
        }

        public Builder references(List<String> references) {
            if (references != null) {
                references.forEach(this::reference);
            }
            return this;
        }

        public Builder codeSnippet(String codeSnippet) {
            this.codeSnippet = codeSnippet;
            return this;
        }

        public Finding build() {
            return new Finding(title, description, severity, category, filePath, line, column,
                confidence, suggestion, ruleId, references, codeSnippet);
        }
    }
}
