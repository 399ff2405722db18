package com.codeguard.core.aggregator;

import com.codeguard.core.aggregator.FindingDeduplicator.AttributedFinding;
import com.codeguard.core.model.Finding;
import com.codeguard.core.model.Outcome;
import com.codeguard.core.model.OutcomeStatus;
import com.codeguard.core.model.Severity;
import com.codeguard.core.report.AnalyzerStats;
import com.codeguard.core.report.FileRanking;
import com.codeguard.core.report.Report;
import com.codeguard.core.report.ReportedIssue;
import com.codeguard.core.report.RunStatus;
import com.codeguard.core.report.Summary;
import com.codeguard.core.report.Timing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Folds task outcomes into a {@link Report}.
 *
 * <p>Aggregation is a pure function of its inputs. Outcomes are first put in canonical
 * order by (file path, analyzer id), so the report does not depend on the order in which
 * tasks finished. Aggregating the same outcomes twice yields equal reports.
 *
 * <p><b>Steps:</b>
 * <ol>
 *   <li>validate findings of COMPLETED outcomes, dropping malformed ones</li>
 *   <li>deduplicate via {@link FindingDeduplicator}</li>
 *   <li>build the grouped views and per-analyzer statistics</li>
 *   <li>score, grade and recommend via {@link ScoringPolicy} and {@link RecommendationPolicy}</li>
 * </ol>
 *
 * @since 1.0.0
 */
public class ResultAggregator {

    private static final Logger log = LoggerFactory.getLogger(ResultAggregator.class);

    static final int TOP_FILES_LIMIT = 10;

    private static final Comparator<Outcome> CANONICAL_ORDER = Comparator
        .comparing(Outcome::filePath)
        .thenComparing(Outcome::analyzerId);

    private static final Comparator<ReportedIssue> ISSUE_ORDER = Comparator
        .comparing(ReportedIssue::severity)
        .thenComparing(ReportedIssue::filePath)
        .thenComparing(ReportedIssue::line, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(ReportedIssue::title)
        .thenComparing(ReportedIssue::analyzer);

    private final ScoringPolicy scoringPolicy;
    private final RecommendationPolicy recommendationPolicy;
    private final FindingDeduplicator deduplicator = new FindingDeduplicator();

    public ResultAggregator() {
        this(ScoringPolicy.defaults(), RecommendationPolicy.defaults());
    }

    public ResultAggregator(ScoringPolicy scoringPolicy, RecommendationPolicy recommendationPolicy) {
        this.scoringPolicy = scoringPolicy;
        this.recommendationPolicy = recommendationPolicy;
    }

    /**
     * Aggregates outcomes. The reported duration is the summed execution time of all outcomes.
     *
     * @param outcomes settled outcomes in any order
     * @return report
     */
    public Report aggregate(Collection<Outcome> outcomes) {
        Duration total = outcomes.stream()
            .map(Outcome::executionTime)
            .reduce(Duration.ZERO, Duration::plus);
        return aggregate(outcomes, Set.of(), total);
    }

    /**
     * Aggregates outcomes.
     *
     * @param outcomes settled outcomes in any order
     * @param registeredAnalyzerIds analyzers that get a statistics row even without tasks
     * @param totalDuration wall-clock duration of the run
     * @return report
     */
    public Report aggregate(Collection<Outcome> outcomes, Collection<String> registeredAnalyzerIds,
                            Duration totalDuration) {
        List<Outcome> ordered = new ArrayList<>(outcomes);
        ordered.sort(CANONICAL_ORDER);

        List<AttributedFinding> valid = new ArrayList<>();
        for (Outcome outcome : ordered) {
            if (outcome.status() != OutcomeStatus.COMPLETED) {
                continue;
            }
            for (Finding finding : outcome.findings()) {
                try {
                    validate(finding, outcome.analyzerId());
                    valid.add(new AttributedFinding(finding, outcome.analyzerId()));
                } catch (MalformedFindingException e) {
                    log.warn("Dropping finding for {}: {}", outcome.filePath(), e.getMessage());
                }
            }
        }

        List<ReportedIssue> issues = new ArrayList<>(deduplicator.deduplicate(valid));
        issues.sort(ISSUE_ORDER);
        log.debug("Aggregated {} findings into {} issues", valid.size(), issues.size());

        Map<Severity, Integer> severityCounts = new EnumMap<>(Severity.class);
        Map<String, List<ReportedIssue>> bySeverity = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            severityCounts.put(severity, 0);
            bySeverity.put(severity.toJson(), new ArrayList<>());
        }
        Map<String, List<ReportedIssue>> byCategory = new TreeMap<>();
        Map<String, List<ReportedIssue>> byFile = new TreeMap<>();
        Map<String, Integer> byAgent = new TreeMap<>();
        for (ReportedIssue issue : issues) {
            severityCounts.merge(issue.severity(), 1, Integer::sum);
            bySeverity.get(issue.severity().toJson()).add(issue);
            byCategory.computeIfAbsent(issue.category(), key -> new ArrayList<>()).add(issue);
            byFile.computeIfAbsent(issue.filePath(), key -> new ArrayList<>()).add(issue);
            byAgent.merge(issue.analyzer(), 1, Integer::sum);
        }

        Map<String, Integer> categoryCounts = new TreeMap<>();
        byCategory.forEach((category, list) -> categoryCounts.put(category, list.size()));
        Map<String, Integer> severitySummary = new LinkedHashMap<>();
        severityCounts.forEach((severity, count) -> severitySummary.put(severity.toJson(), count));

        int score = scoringPolicy.score(issues.stream().map(ReportedIssue::severity).toList());
        Summary summary = new Summary(
            score,
            scoringPolicy.grade(score),
            severitySummary,
            categoryCounts,
            byAgent,
            recommendationPolicy.recommend(severityCounts, categoryCounts),
            issues.size(),
            topFiles(byFile));

        return new Report(
            status(ordered),
            filesAnalyzed(ordered),
            issues.size(),
            issues,
            bySeverity,
            byCategory,
            byFile,
            summary,
            analyzerStats(ordered, registeredAnalyzerIds),
            Timing.of(totalDuration == null ? Duration.ZERO : totalDuration));
    }

    static void validate(Finding finding, String analyzerId) throws MalformedFindingException {
        String missing = finding == null ? "finding" : finding.missingField();
        if (missing != null) {
            throw new MalformedFindingException(analyzerId, missing);
        }
    }

    private static RunStatus status(List<Outcome> outcomes) {
        return outcomes.stream().anyMatch(Outcome::isCompleted) ? RunStatus.COMPLETED : RunStatus.FAILED;
    }

    private static int filesAnalyzed(List<Outcome> outcomes) {
        Set<String> files = new HashSet<>();
        for (Outcome outcome : outcomes) {
            if (outcome.isCompleted()) {
                files.add(outcome.filePath());
            }
        }
        return files.size();
    }

    private static List<FileRanking> topFiles(Map<String, List<ReportedIssue>> byFile) {
        List<FileRanking> rankings = new ArrayList<>();
        byFile.forEach((path, fileIssues) -> {
            Severity highest = Severity.INFO;
            for (ReportedIssue issue : fileIssues) {
                highest = Severity.max(highest, issue.severity());
            }
            rankings.add(new FileRanking(path, fileIssues.size(), highest));
        });
        rankings.sort(Comparator.comparingInt(FileRanking::issueCount).reversed()
            .thenComparing(FileRanking::highestSeverity)
            .thenComparing(FileRanking::filePath));
        return rankings.subList(0, Math.min(rankings.size(), TOP_FILES_LIMIT));
    }

    private static Map<String, AnalyzerStats> analyzerStats(List<Outcome> outcomes, Collection<String> registered) {
        Map<String, AnalyzerStats> stats = new TreeMap<>();
        if (registered != null) {
            registered.forEach(id -> stats.put(id, AnalyzerStats.empty()));
        }
        for (Outcome outcome : outcomes) {
            AnalyzerStats current = stats.getOrDefault(outcome.analyzerId(), AnalyzerStats.empty());
            boolean completed = outcome.isCompleted();
            Number deep = outcome.metrics().get("tier2_used");
            stats.put(outcome.analyzerId(), new AnalyzerStats(
                current.tasks() + 1,
                current.filesProcessed() + (completed ? 1 : 0),
                current.findings() + (completed ? outcome.findings().size() : 0),
                current.failures() + (outcome.status() == OutcomeStatus.FAILED ? 1 : 0),
                current.timeouts() + (outcome.status() == OutcomeStatus.TIMED_OUT ? 1 : 0),
                current.deepInspections() + (completed && deep != null && deep.intValue() > 0 ? 1 : 0),
                roundSeconds(current.executionTime() + outcome.executionTime().toNanos() / 1_000_000_000.0)));
        }
        return stats;
    }

    private static double roundSeconds(double seconds) {
        return Math.round(seconds * 1000.0) / 1000.0;
    }
}
