package com.codeguard.core.analyzer.base;

import com.codeguard.core.model.Severity;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A single line-oriented Tier-1 check.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * RegexRule rule = RegexRule.of("PERF-SELECT-STAR", "SELECT * query",
 *         "(?i)SELECT\\s+\\*\\s+FROM", Severity.LOW)
 *     .withDescription("Selecting all columns transfers more data than needed")
 *     .withSuggestion("List the required columns explicitly")
 *     .withLanguages(Set.of("python", "java"));
 * }</pre>
 *
 * @param ruleId stable rule identifier
 * @param title finding title
 * @param description finding description
 * @param pattern compiled pattern, matched with {@code find()} per line
 * @param severity finding severity
 * @param suggestion remediation text
 * @param references reference URLs
 * @param confidence confidence of a match
 * @param languages languages the rule applies to; empty means all
 * @param skipComments whether comment lines are ignored
 */
public record RegexRule(
    String ruleId,
    String title,
    String description,
    Pattern pattern,
    Severity severity,
    String suggestion,
    List<String> references,
    double confidence,
    Set<String> languages,
    boolean skipComments
) {
    public RegexRule {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(pattern, "pattern must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        references = references == null ? List.of() : List.copyOf(references);
        languages = languages == null ? Set.of() : Set.copyOf(languages);
    }

    /**
     * Creates a rule with confidence 0.8, no languages restriction and comment skipping.
     *
     * @param ruleId rule id
     * @param title finding title
     * @param regex pattern source
     * @param severity severity
     * @return rule
     */
    public static RegexRule of(String ruleId, String title, String regex, Severity severity) {
        return new RegexRule(ruleId, title, title, Pattern.compile(regex), severity,
            null, List.of(), 0.8, Set.of(), true);
    }

    public RegexRule withDescription(String newDescription) {
        return new RegexRule(ruleId, title, newDescription, pattern, severity, suggestion,
            references, confidence, languages, skipComments);
    }

    public RegexRule withSuggestion(String newSuggestion) {
        return new RegexRule(ruleId, title, description, pattern, severity, newSuggestion,
            references, confidence, languages, skipComments);
    }

    public RegexRule withReferences(List<String> newReferences) {
        return new RegexRule(ruleId, title, description, pattern, severity, suggestion,
            newReferences, confidence, languages, skipComments);
    }

    public RegexRule withConfidence(double newConfidence) {
        return new RegexRule(ruleId, title, description, pattern, severity, suggestion,
            references, newConfidence, languages, skipComments);
    }

    public RegexRule withLanguages(Set<String> newLanguages) {
        return new RegexRule(ruleId, title, description, pattern, severity, suggestion,
            references, confidence, newLanguages, skipComments);
    }

    public RegexRule includingComments() {
        return new RegexRule(ruleId, title, description, pattern, severity, suggestion,
            references, confidence, languages, false);
    }

    /**
     * Checks whether the rule applies to a language.
     *
     * @param language file language
     * @return true if unrestricted or listed
     */
    public boolean appliesTo(String language) {
        return languages.isEmpty() || languages.contains(language);
    }
}
