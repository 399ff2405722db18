package com.codeguard.core.analyzer;

import com.codeguard.core.model.Finding;

import java.util.List;
import java.util.Set;

/**
 * Answer of a {@link DeepInspector}.
 *
 * <p>{@code confirmed} and {@code falsePositives} are zero-based indexes into the Tier-1
 * finding list of the request. Indexes out of range are ignored when merging.
 *
 * @param confirmed indexes of Tier-1 findings the inspection agrees with
 * @param falsePositives indexes of Tier-1 findings to drop
 * @param findings new findings, each with its own confidence
 * @param assessment free-text overall assessment (nullable)
 */
public record DeepInspection(
    Set<Integer> confirmed,
    Set<Integer> falsePositives,
    List<Finding> findings,
    String assessment
) {
    public DeepInspection {
        confirmed = confirmed == null ? Set.of() : Set.copyOf(confirmed);
        falsePositives = falsePositives == null ? Set.of() : Set.copyOf(falsePositives);
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public static DeepInspection empty() {
        return new DeepInspection(Set.of(), Set.of(), List.of(), null);
    }
}
