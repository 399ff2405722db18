package com.codeguard.core.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final, immutable result of an analysis.
 *
 * <p>Serialized with Jackson to the JSON report. Map views keep their iteration order:
 * severities from CRITICAL to INFO, categories, files and analyzers alphabetically.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * Report report = new ResultAggregator().aggregate(result.outcomes());
 * System.out.println(report.summary().grade());
 * }</pre>
 *
 * @param status COMPLETED if at least one task completed
 * @param filesAnalyzed distinct files with at least one completed task
 * @param totalIssues number of deduplicated issues
 * @param issues issues sorted by severity, file and line
 * @param issuesBySeverity issues grouped by severity name
 * @param issuesByCategory issues grouped by category
 * @param issuesByFile issues grouped by file path
 * @param summary score, grade and recommendations
 * @param perAnalyzerStats statistics per analyzer id
 * @param timing run duration
 * @since 1.0.0
 */
@JsonPropertyOrder({"status", "files_analyzed", "total_issues", "issues", "issues_by_severity",
    "issues_by_category", "issues_by_file", "summary", "per_analyzer_stats", "timing"})
public record Report(
    @JsonProperty("status") RunStatus status,
    @JsonProperty("files_analyzed") int filesAnalyzed,
    @JsonProperty("total_issues") int totalIssues,
    @JsonProperty("issues") List<ReportedIssue> issues,
    @JsonProperty("issues_by_severity") Map<String, List<ReportedIssue>> issuesBySeverity,
    @JsonProperty("issues_by_category") Map<String, List<ReportedIssue>> issuesByCategory,
    @JsonProperty("issues_by_file") Map<String, List<ReportedIssue>> issuesByFile,
    @JsonProperty("summary") Summary summary,
    @JsonProperty("per_analyzer_stats") Map<String, AnalyzerStats> perAnalyzerStats,
    @JsonProperty("timing") Timing timing
) {
    public Report {
        issues = issues == null ? List.of() : List.copyOf(issues);
        issuesBySeverity = frozenGroups(issuesBySeverity);
        issuesByCategory = frozenGroups(issuesByCategory);
        issuesByFile = frozenGroups(issuesByFile);
        perAnalyzerStats = frozen(perAnalyzerStats);
    }

    static <V> Map<String, V> frozen(Map<String, V> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    private static Map<String, List<ReportedIssue>> frozenGroups(Map<String, List<ReportedIssue>> groups) {
        if (groups == null) {
            return Map.of();
        }
        Map<String, List<ReportedIssue>> copy = new LinkedHashMap<>();
        groups.forEach((key, value) -> copy.put(key, List.copyOf(value)));
        return Collections.unmodifiableMap(copy);
    }
}
