package com.codeguard.core.aggregator;

import com.codeguard.core.aggregator.FindingDeduplicator.AttributedFinding;
import com.codeguard.core.model.Finding;
import com.codeguard.core.model.Severity;
import com.codeguard.core.report.ReportedIssue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FindingDeduplicator} and {@link DedupKey}.
 */
class FindingDeduplicatorTest {

    private final FindingDeduplicator deduplicator = new FindingDeduplicator();

    @Test
    void deduplicate_withSameIssueFromTwoAnalyzers_mergesIntoOne() {
        // Given
        Finding fromSecurity = finding("Hardcoded password", Severity.HIGH, 12)
            .confidence(0.7).reference("CWE-798").build();
        Finding fromQuality = finding("HARDCODED PASSWORD", Severity.CRITICAL, 17)
            .confidence(0.6).suggestion("Load it from the environment").reference("OWASP-A07").build();

        // When
        List<ReportedIssue> issues = deduplicator.deduplicate(List.of(
            new AttributedFinding(fromSecurity, "security"),
            new AttributedFinding(fromQuality, "code_quality")));

        // Then
        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.severity()).isEqualTo(Severity.CRITICAL);
            assertThat(issue.analyzer()).isEqualTo("code_quality");
            assertThat(issue.line()).isEqualTo(17);
            assertThat(issue.confidence()).isEqualTo(0.7);
            assertThat(issue.suggestion()).isEqualTo("Load it from the environment");
            assertThat(issue.references()).containsExactly("CWE-798", "OWASP-A07");
            assertThat(issue.detectedBy()).containsExactly("code_quality", "security");
        });
    }

    @Test
    void deduplicate_withDifferentLineBuckets_keepsBoth() {
        // Given
        Finding first = finding("Nested loop", Severity.MEDIUM, 9).build();
        Finding second = finding("Nested loop", Severity.MEDIUM, 10).build();

        // When
        List<ReportedIssue> issues = deduplicator.deduplicate(List.of(
            new AttributedFinding(first, "performance"),
            new AttributedFinding(second, "performance")));

        // Then
        assertThat(issues).hasSize(2);
    }

    @Test
    void deduplicate_withoutLines_groupsTogether() {
        // Given
        Finding first = finding("Unpinned dependency", Severity.LOW, null).build();
        Finding second = finding("Unpinned dependency", Severity.LOW, null).confidence(0.9).build();

        // When
        List<ReportedIssue> issues = deduplicator.deduplicate(List.of(
            new AttributedFinding(first, "dependency"),
            new AttributedFinding(second, "dependency")));

        // Then
        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.line()).isNull();
            assertThat(issue.detectedBy()).containsExactly("dependency");
        });
    }

    @Test
    void dedupKey_withLine_bucketsByTens() {
        assertThat(DedupKey.of(finding("A", Severity.LOW, 0).build()).lineBucket()).isZero();
        assertThat(DedupKey.of(finding("A", Severity.LOW, 19).build()).lineBucket()).isEqualTo(1);
        assertThat(DedupKey.of(finding("A", Severity.LOW, null).build()).lineBucket())
            .isEqualTo(DedupKey.NO_LINE_BUCKET);
        assertThat(DedupKey.of(finding("Title", Severity.LOW, 3).build()))
            .isEqualTo(DedupKey.of(finding("tItLe", Severity.HIGH, 8).build()));
    }

    private static Finding.Builder finding(String title, Severity severity, Integer line) {
        return Finding.builder()
            .title(title)
            .severity(severity)
            .category("security")
            .filePath("app/settings.py")
            .line(line);
    }
}
