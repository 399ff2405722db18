package com.codeguard.core.aggregator;

import com.codeguard.core.config.CodeGuardConfig;
import com.codeguard.core.config.ConfigurationException;
import com.codeguard.core.model.Severity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives prioritized recommendations from issue counts.
 *
 * <p>Order: an urgent message when CRITICAL issues exist, a high-priority message when HIGH
 * issues exist, then one message per category whose count exceeds its threshold, by
 * descending count and then name. The list is cut to the maximum size. If nothing applies,
 * a single {@link #NO_ISSUES_MESSAGE} is returned.
 *
 * @since 1.0.0
 */
public class RecommendationPolicy {

    public static final int DEFAULT_MAX_RECOMMENDATIONS = 10;
    public static final int DEFAULT_OTHER_THRESHOLD = 5;
    public static final String NO_ISSUES_MESSAGE = "No major issues found. Keep up the good work!";

    static final Map<String, Integer> DEFAULT_THRESHOLDS = Map.of(
        "security", 0,
        "dependency", 0,
        "performance", 0,
        "code_quality", 5,
        "best_practices", 3
    );

    private final Map<String, Integer> thresholds;
    private final int maxRecommendations;

    public RecommendationPolicy(Map<String, Integer> thresholds, int maxRecommendations) {
        if (maxRecommendations < 1) {
            throw new ConfigurationException("max_recommendations must be >= 1, got " + maxRecommendations);
        }
        Map<String, Integer> merged = new HashMap<>(DEFAULT_THRESHOLDS);
        if (thresholds != null) {
            merged.putAll(thresholds);
        }
        this.thresholds = Map.copyOf(merged);
        this.maxRecommendations = maxRecommendations;
    }

    public static RecommendationPolicy defaults() {
        return new RecommendationPolicy(Map.of(), DEFAULT_MAX_RECOMMENDATIONS);
    }

    public static RecommendationPolicy from(CodeGuardConfig.ScoringSettings settings) {
        Integer max = settings.maxRecommendations();
        return new RecommendationPolicy(settings.categoryThresholds(),
            max == null ? DEFAULT_MAX_RECOMMENDATIONS : max);
    }

    /**
     * @param bySeverity issue count per severity
     * @param byCategory issue count per category
     * @return recommendations, never empty
     */
    public List<String> recommend(Map<Severity, Integer> bySeverity, Map<String, Integer> byCategory) {
        List<String> recommendations = new ArrayList<>();

        int critical = bySeverity.getOrDefault(Severity.CRITICAL, 0);
        if (critical > 0) {
            recommendations.add("URGENT: Address " + critical + " critical issue(s) immediately");
        }
        int high = bySeverity.getOrDefault(Severity.HIGH, 0);
        if (high > 0) {
            recommendations.add("HIGH PRIORITY: Fix " + high + " high-severity issue(s)");
        }

        byCategory.entrySet().stream()
            .filter(entry -> entry.getValue() > thresholdFor(entry.getKey()))
            .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
            .forEach(entry -> recommendations.add(categoryMessage(entry.getKey(), entry.getValue())));

        if (recommendations.isEmpty()) {
            return List.of(NO_ISSUES_MESSAGE);
        }
        return List.copyOf(recommendations.subList(0, Math.min(recommendations.size(), maxRecommendations)));
    }

    int thresholdFor(String category) {
        return thresholds.getOrDefault(category, DEFAULT_OTHER_THRESHOLD);
    }

    private static String categoryMessage(String category, int count) {
        return switch (category) {
            case "security" -> "Review and fix " + count + " security issue(s) before release";
            case "dependency" -> "Update or pin " + count + " dependency issue(s)";
            case "performance" -> "Optimize " + count + " performance hotspot(s)";
            case "code_quality" -> "Refactor code to address " + count + " code quality issue(s)";
            case "best_practices" -> "Apply " + count + " best-practice improvement(s)";
            default -> "Address " + count + " " + category.replace('_', ' ') + " issue(s)";
        };
    }
}
