package com.codeguard.core.analyzer.base;

import com.codeguard.core.analyzer.DeepInspection;
import com.codeguard.core.model.Finding;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Merges a deep inspection into the Tier-1 findings of one analyzer run.
 *
 * <p>Rules:
 * <ul>
 *   <li>Tier-1 findings flagged as false positives are removed</li>
 *   <li>deep findings below {@link #MIN_CONFIDENCE} are discarded</li>
 *   <li>a deep finding on the same line as a kept Tier-1 finding with a similar title
 *       (word Jaccard similarity above {@link #TITLE_SIMILARITY}) is folded into it, filling
 *       the suggestion when the Tier-1 finding has none</li>
 *   <li>every other deep finding is appended</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class DeepInspectionMerger {

    public static final double MIN_CONFIDENCE = 0.7;
    public static final double TITLE_SIMILARITY = 0.5;

    private DeepInspectionMerger() {
        // Utility class
    }

    /**
     * Result of a merge.
     *
     * @param findings merged findings, Tier-1 first
     * @param confirmed number of Tier-1 findings confirmed and kept
     * @param falsePositives number of Tier-1 findings removed
     * @param added number of deep findings appended
     * @param folded number of deep findings folded into Tier-1 findings
     */
    public record Merge(List<Finding> findings, int confirmed, int falsePositives, int added, int folded) {}

    /**
     * Merges the inspection into the Tier-1 list.
     *
     * @param tier1 Tier-1 findings in the order sent to the inspector
     * @param inspection deep inspection answer
     * @param filePath path assigned to deep findings without one
     * @param category category assigned to deep findings without one
     * @return merge result
     */
    public static Merge merge(List<Finding> tier1, DeepInspection inspection, String filePath, String category) {
        Set<Integer> falsePositiveIndexes = new HashSet<>();
        for (Integer index : inspection.falsePositives()) {
            if (index != null && index >= 0 && index < tier1.size()) {
                falsePositiveIndexes.add(index);
            }
        }

        List<Finding> merged = new ArrayList<>();
        for (int i = 0; i < tier1.size(); i++) {
            if (!falsePositiveIndexes.contains(i)) {
                merged.add(tier1.get(i));
            }
        }

        int confirmed = (int) inspection.confirmed().stream()
            .filter(Objects::nonNull)
            .filter(i -> i >= 0 && i < tier1.size() && !falsePositiveIndexes.contains(i))
            .count();

        int keptTier1 = merged.size();
        int added = 0;
        int folded = 0;
        for (Finding deep : inspection.findings()) {
            if (deep.confidence() < MIN_CONFIDENCE) {
                continue;
            }
            Finding normalized = normalize(deep, filePath, category);
            int match = findSimilar(merged, keptTier1, normalized);
            if (match >= 0) {
                Finding existing = merged.get(match);
                if (isBlank(existing.suggestion()) && !isBlank(normalized.suggestion())) {
                    merged.set(match, existing.withSuggestion(normalized.suggestion()));
                }
                folded++;
            } else {
                merged.add(normalized);
                added++;
            }
        }

        return new Merge(List.copyOf(merged), confirmed, falsePositiveIndexes.size(), added, folded);
    }

    /**
     * Word-level Jaccard similarity of two titles, case-insensitive.
     *
     * @param a first title
     * @param b second title
     * @return similarity in [0, 1]
     */
    public static double titleSimilarity(String a, String b) {
        Set<String> wordsA = words(a);
        Set<String> wordsB = words(b);
        if (wordsA.isEmpty() || wordsB.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(wordsA);
        intersection.retainAll(wordsB);
        Set<String> union = new HashSet<>(wordsA);
        union.addAll(wordsB);
        return (double) intersection.size() / union.size();
    }

    private static int findSimilar(List<Finding> merged, int tier1Count, Finding candidate) {
        if (candidate.line() == null) {
            return -1;
        }
        for (int i = 0; i < tier1Count; i++) {
            Finding existing = merged.get(i);
            if (candidate.line().equals(existing.line())
                && titleSimilarity(existing.title(), candidate.title()) > TITLE_SIMILARITY) {
                return i;
            }
        }
        return -1;
    }

    private static Finding normalize(Finding finding, String filePath, String category) {
        if (!isBlank(finding.filePath()) && !isBlank(finding.category())) {
            return finding;
        }
        return new Finding(finding.title(), finding.description(), finding.severity(),
            isBlank(finding.category()) ? category : finding.category(),
            isBlank(finding.filePath()) ? filePath : finding.filePath(),
            finding.line(), finding.column(), finding.confidence(), finding.suggestion(),
            finding.ruleId(), finding.references(), finding.codeSnippet());
    }

    private static Set<String> words(String text) {
        if (text == null) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
            .filter(w -> !w.isEmpty())
            .collect(Collectors.toSet());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
