package com.codeguard.core.analyzer;

import com.codeguard.core.config.AnalysisConfig;
import com.codeguard.core.model.Finding;
import com.codeguard.core.model.SourceFile;

import java.util.List;
import java.util.Random;

/**
 * Decides whether a file's analysis escalates from Tier 1 to the deep inspection tier.
 *
 * <p>Implementations must be pure: the result may depend only on the arguments, and all
 * randomness must come from the supplied {@link Random}. This keeps escalation
 * reproducible for a given seed and testable without a deep inspector.
 *
 * @see DefaultEscalationPolicy
 * @since 1.0.0
 */
@FunctionalInterface
public interface EscalationPolicy {

    /**
     * Decides on escalation.
     *
     * @param file analyzed file
     * @param tier1Findings findings produced by Tier 1
     * @param config run configuration
     * @param random random source seeded for this task
     * @return decision with its reason
     */
    EscalationDecision decide(SourceFile file, List<Finding> tier1Findings, AnalysisConfig config, Random random);

    /**
     * Convenience form of {@link #decide}.
     *
     * @param file analyzed file
     * @param tier1Findings findings produced by Tier 1
     * @param config run configuration
     * @param random random source seeded for this task
     * @return true if Tier 2 should run
     */
    default boolean shouldEscalate(SourceFile file, List<Finding> tier1Findings, AnalysisConfig config, Random random) {
        return decide(file, tier1Findings, config, random).escalate();
    }
}
