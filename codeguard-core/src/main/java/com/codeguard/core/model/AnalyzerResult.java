package com.codeguard.core.model;

import java.util.List;
import java.util.Map;

/**
 * What an analyzer returns for a single file.
 *
 * @param findings merged findings of both tiers
 * @param metrics numeric statistics about the analysis (counts, flags)
 * @param deepTierUsed true if the deep inspection tier ran for this file
 * @since 1.0.0
 */
public record AnalyzerResult(
    List<Finding> findings,
    Map<String, Number> metrics,
    boolean deepTierUsed
) {
    /**
     * Compact constructor with null-safe defaults.
     */
    public AnalyzerResult {
        findings = findings == null ? List.of() : List.copyOf(findings);
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }

    /**
     * Creates a result with no findings.
     *
     * @return empty result
     */
    public static AnalyzerResult empty() {
        return new AnalyzerResult(List.of(), Map.of(), false);
    }

    /**
     * Creates a Tier-1 only result.
     *
     * @param findings findings
     * @return result with a {@code tier1_findings} metric
     */
    public static AnalyzerResult of(List<Finding> findings) {
        return new AnalyzerResult(findings, Map.of("tier1_findings", findings.size()), false);
    }
}
