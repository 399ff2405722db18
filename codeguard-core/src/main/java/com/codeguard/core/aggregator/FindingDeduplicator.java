package com.codeguard.core.aggregator;

import com.codeguard.core.model.Finding;
import com.codeguard.core.report.ReportedIssue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Collapses duplicate findings into one report entry per {@link DedupKey}.
 *
 * <p>The representative is the most severe duplicate, then the most confident, then the
 * first in input order. The merged entry carries the highest confidence, the union of all
 * references in first-seen order, the first non-blank suggestion if the representative has
 * none, and the sorted list of every analyzer that reported a duplicate.
 *
 * @since 1.0.0
 */
public class FindingDeduplicator {

    /**
     * A finding with the analyzer that reported it.
     *
     * @param finding validated finding
     * @param analyzerId reporting analyzer
     */
    public record AttributedFinding(Finding finding, String analyzerId) {}

    private static final class Group {
        private AttributedFinding representative;
        private double maxConfidence;
        private String firstSuggestion;
        private final Set<String> references = new LinkedHashSet<>();
        private final Set<String> detectedBy = new TreeSet<>();

        Group(AttributedFinding first) {
            this.representative = first;
            this.maxConfidence = first.finding().confidence();
            add(first);
        }

        void add(AttributedFinding candidate) {
            Finding finding = candidate.finding();
            references.addAll(finding.references());
            detectedBy.add(candidate.analyzerId());
            maxConfidence = Math.max(maxConfidence, finding.confidence());
            if (firstSuggestion == null && finding.suggestion() != null && !finding.suggestion().isBlank()) {
                firstSuggestion = finding.suggestion();
            }
            if (isBetter(finding, representative.finding())) {
                representative = candidate;
            }
        }

        ReportedIssue toIssue() {
            Finding merged = representative.finding()
                .withConfidence(maxConfidence)
                .withReferences(new ArrayList<>(references));
            if (merged.suggestion() == null || merged.suggestion().isBlank()) {
                merged = merged.withSuggestion(firstSuggestion);
            }
            return ReportedIssue.of(merged, representative.analyzerId(), new ArrayList<>(detectedBy));
        }

        private static boolean isBetter(Finding candidate, Finding current) {
            if (candidate.severity() != current.severity()) {
                return candidate.severity().isMoreSevereThan(current.severity());
            }
            return candidate.confidence() > current.confidence();
        }
    }

    /**
     * Deduplicates findings given in canonical order.
     *
     * @param findings validated findings
     * @return one entry per key, in order of first occurrence
     */
    public List<ReportedIssue> deduplicate(List<AttributedFinding> findings) {
        Map<DedupKey, Group> groups = new LinkedHashMap<>();
        for (AttributedFinding attributed : findings) {
            DedupKey key = DedupKey.of(attributed.finding());
            Group group = groups.get(key);
            if (group == null) {
                groups.put(key, new Group(attributed));
            } else {
                group.add(attributed);
            }
        }
        List<ReportedIssue> issues = new ArrayList<>(groups.size());
        for (Group group : groups.values()) {
            issues.add(group.toIssue());
        }
        return issues;
    }
}
