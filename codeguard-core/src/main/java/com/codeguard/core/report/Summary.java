package com.codeguard.core.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

/**
 * Score, grade, counts and recommendations of a report.
 *
 * @param overallScore score in [0, 100]
 * @param grade letter grade
 * @param bySeverity issue count per severity, most severe first
 * @param byCategory issue count per category
 * @param byAgent issue count per representative analyzer
 * @param recommendations prioritized recommendations
 * @param totalIssues number of issues
 * @param topProblematicFiles files with the most issues
 */
@JsonPropertyOrder({"overall_score", "grade", "by_severity", "by_category", "by_agent", "recommendations",
    "total_issues", "top_problematic_files"})
public record Summary(
    @JsonProperty("overall_score") int overallScore,
    @JsonProperty("grade") String grade,
    @JsonProperty("by_severity") Map<String, Integer> bySeverity,
    @JsonProperty("by_category") Map<String, Integer> byCategory,
    @JsonProperty("by_agent") Map<String, Integer> byAgent,
    @JsonProperty("recommendations") List<String> recommendations,
    @JsonProperty("total_issues") int totalIssues,
    @JsonProperty("top_problematic_files") List<FileRanking> topProblematicFiles
) {
    public Summary {
        bySeverity = Report.frozen(bySeverity);
        byCategory = Report.frozen(byCategory);
        byAgent = Report.frozen(byAgent);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        topProblematicFiles = topProblematicFiles == null ? List.of() : List.copyOf(topProblematicFiles);
    }
}
