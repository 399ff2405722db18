package com.codeguard.core.aggregator;

import com.codeguard.core.model.AnalyzerResult;
import com.codeguard.core.model.Finding;
import com.codeguard.core.model.Outcome;
import com.codeguard.core.model.OutcomeStatus;
import com.codeguard.core.model.Severity;
import com.codeguard.core.report.AnalyzerStats;
import com.codeguard.core.report.FileRanking;
import com.codeguard.core.report.Report;
import com.codeguard.core.report.ReportedIssue;
import com.codeguard.core.report.RunStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ResultAggregator}.
 */
class ResultAggregatorTest {

    private final ResultAggregator aggregator = new ResultAggregator();

    @Test
    void aggregate_withDuplicateAcrossAnalyzers_reportsOneIssue() {
        // Given
        Outcome security = completed("security", "app/db.py",
            finding("SQL injection", Severity.CRITICAL, "security", "app/db.py", 12));
        Outcome quality = completed("code_quality", "app/db.py",
            finding("sql injection", Severity.MEDIUM, "security", "app/db.py", 14));

        // When
        Report report = aggregator.aggregate(List.of(security, quality));

        // Then
        assertThat(report.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(report.filesAnalyzed()).isEqualTo(1);
        assertThat(report.totalIssues()).isEqualTo(1);
        assertThat(report.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.severity()).isEqualTo(Severity.CRITICAL);
            assertThat(issue.analyzer()).isEqualTo("security");
            assertThat(issue.detectedBy()).containsExactly("code_quality", "security");
        });
        assertThat(report.summary().overallScore()).isEqualTo(85);
        assertThat(report.summary().grade()).isEqualTo("B-");
        assertThat(report.summary().bySeverity())
            .containsEntry("critical", 1)
            .containsEntry("high", 0)
            .containsEntry("info", 0);
        assertThat(report.summary().byCategory()).containsExactly(Map.entry("security", 1));
        assertThat(report.summary().byAgent()).containsExactly(Map.entry("security", 1));
        assertThat(report.summary().recommendations()).containsExactly(
            "URGENT: Address 1 critical issue(s) immediately",
            "Review and fix 1 security issue(s) before release");
        assertThat(report.issuesBySeverity().get("critical")).hasSize(1);
        assertThat(report.issuesBySeverity().get("low")).isEmpty();
        assertThat(report.issuesByFile()).containsOnlyKeys("app/db.py");
    }

    @Test
    void aggregate_withNoFindings_scoresPerfect() {
        // When
        Report report = aggregator.aggregate(List.of(completed("security", "a.py")));

        // Then
        assertThat(report.totalIssues()).isZero();
        assertThat(report.summary().overallScore()).isEqualTo(100);
        assertThat(report.summary().grade()).isEqualTo("A+");
        assertThat(report.summary().recommendations()).containsExactly(RecommendationPolicy.NO_ISSUES_MESSAGE);
    }

    @Test
    void aggregate_withReorderedOutcomes_producesSameReport() {
        // Given
        List<Outcome> outcomes = new ArrayList<>(List.of(
            completed("security", "b.py", finding("Weak hash", Severity.MEDIUM, "security", "b.py", 3)),
            completed("performance", "a.py", finding("Nested loop", Severity.HIGH, "performance", "a.py", 7)),
            completed("code_quality", "b.py", finding("Weak hash", Severity.MEDIUM, "security", "b.py", 4)),
            Outcome.failed("dependency", "a.py", "boom", Duration.ofMillis(2))));
        List<Outcome> reversed = new ArrayList<>(outcomes);
        Collections.reverse(reversed);

        // When
        Report first = aggregator.aggregate(outcomes);
        Report again = aggregator.aggregate(outcomes);
        Report fromReversed = aggregator.aggregate(reversed);

        // Then
        assertThat(again).isEqualTo(first);
        assertThat(fromReversed).isEqualTo(first);
        assertThat(first.issues()).extracting(ReportedIssue::title).containsExactly("Nested loop", "Weak hash");
    }

    @Test
    void aggregate_withMoreIssues_neverRaisesScore() {
        // Given
        List<Finding> findings = new ArrayList<>();
        int previous = 100;

        for (int i = 0; i < 12; i++) {
            findings.add(finding("Issue " + i, Severity.CRITICAL, "security", "a.py", i * 10));

            // When
            int score = aggregator.aggregate(List.of(completed("security", "a.py", findings.toArray(Finding[]::new))))
                .summary().overallScore();

            // Then
            assertThat(score).isLessThanOrEqualTo(previous).isGreaterThanOrEqualTo(0);
            previous = score;
        }
        assertThat(previous).isZero();
    }

    @Test
    void aggregate_withMalformedFinding_dropsOnlyThatFinding() {
        // Given
        Finding missingCategory = Finding.builder()
            .title("Orphan").severity(Severity.HIGH).filePath("a.py").build();
        Outcome outcome = completed("security", "a.py",
            missingCategory, finding("Debug enabled", Severity.LOW, "security", "a.py", 2));

        // When
        Report report = aggregator.aggregate(List.of(outcome));

        // Then
        assertThat(report.issues()).extracting(ReportedIssue::title).containsExactly("Debug enabled");
    }

    @Test
    void validate_withMissingField_namesTheField() {
        // Given
        Finding noSeverity = Finding.builder().title("X").category("security").filePath("a.py").build();

        // When / Then
        assertThatThrownBy(() -> ResultAggregator.validate(noSeverity, "security"))
            .hasMessageContaining("'severity'")
            .isInstanceOfSatisfying(MalformedFindingException.class,
                e -> assertThat(e.getAnalyzerId()).isEqualTo("security"));
    }

    @Test
    void aggregate_withFailuresAndTimeouts_countsOnlyCompletedFiles() {
        // Given
        Outcome done = completed("security", "a.py", finding("Secret", Severity.HIGH, "security", "a.py", 1));
        Outcome failed = Outcome.failed("security", "b.py", "boom", Duration.ofMillis(10));
        Outcome timedOut = Outcome.timedOut("performance", "c.py", Duration.ofSeconds(1));

        // When
        Report report = aggregator.aggregate(List.of(done, failed, timedOut),
            Set.of("security", "performance", "dependency"), Duration.ofMillis(1234));

        // Then
        assertThat(report.filesAnalyzed()).isEqualTo(1);
        assertThat(report.timing().totalDuration()).isEqualTo(1.23);
        assertThat(report.perAnalyzerStats()).containsOnlyKeys("dependency", "performance", "security");
        assertThat(report.perAnalyzerStats().get("dependency")).isEqualTo(AnalyzerStats.empty());
        AnalyzerStats security = report.perAnalyzerStats().get("security");
        assertThat(security.tasks()).isEqualTo(2);
        assertThat(security.filesProcessed()).isEqualTo(1);
        assertThat(security.findings()).isEqualTo(1);
        assertThat(security.failures()).isEqualTo(1);
        assertThat(report.perAnalyzerStats().get("performance").timeouts()).isEqualTo(1);
    }

    @Test
    void aggregate_withOnlyFailures_reportsFailedStatus() {
        // When
        Report report = aggregator.aggregate(List.of(
            Outcome.failed("security", "a.py", "boom", Duration.ZERO),
            Outcome.timedOut("security", "b.py", Duration.ofSeconds(1))));

        // Then
        assertThat(report.status()).isEqualTo(RunStatus.FAILED);
        assertThat(report.filesAnalyzed()).isZero();
        assertThat(report.summary().overallScore()).isEqualTo(100);
    }

    @Test
    void aggregate_withDeepTierMetrics_countsDeepInspections() {
        // Given
        Outcome deep = new Outcome("security", "a.py", List.of(), Map.of("tier2_used", 1),
            OutcomeStatus.COMPLETED, null, Duration.ofMillis(500));
        Outcome shallow = completed("security", "b.py");

        // When
        Report report = aggregator.aggregate(List.of(deep, shallow));

        // Then
        assertThat(report.perAnalyzerStats().get("security").deepInspections()).isEqualTo(1);
        assertThat(report.timing().totalDuration()).isEqualTo(0.6);
    }

    @Test
    void aggregate_withManyFiles_ranksMostProblematicFirst() {
        // Given
        List<Outcome> outcomes = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            String path = String.format("src/file%02d.py", i);
            List<Finding> findings = new ArrayList<>();
            for (int j = 0; j <= i % 4; j++) {
                findings.add(finding("Issue " + j, Severity.LOW, "code_quality", path, j * 20));
            }
            outcomes.add(completed("code_quality", path, findings.toArray(Finding[]::new)));
        }
        outcomes.add(completed("security", "src/file00.py",
            finding("Secret", Severity.CRITICAL, "security", "src/file00.py", 1)));

        // When
        List<FileRanking> top = aggregator.aggregate(outcomes).summary().topProblematicFiles();

        // Then
        assertThat(top).hasSize(ResultAggregator.TOP_FILES_LIMIT);
        assertThat(top.get(0).issueCount()).isEqualTo(4);
        assertThat(top).extracting(FileRanking::issueCount).isSortedAccordingTo((a, b) -> b - a);
        assertThat(top).filteredOn(f -> f.filePath().equals("src/file00.py"))
            .singleElement()
            .satisfies(f -> {
                assertThat(f.issueCount()).isEqualTo(2);
                assertThat(f.highestSeverity()).isEqualTo(Severity.CRITICAL);
            });
    }

    private static Outcome completed(String analyzerId, String path, Finding... findings) {
        return Outcome.completed(analyzerId, path, AnalyzerResult.of(List.of(findings)), Duration.ofMillis(100));
    }

    private static Finding finding(String title, Severity severity, String category, String path, int line) {
        return Finding.builder()
            .title(title)
            .severity(severity)
            .category(category)
            .filePath(path)
            .line(line)
            .build();
    }
}
