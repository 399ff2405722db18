package com.codeguard.core.analyzer;

import com.codeguard.core.model.Finding;
import com.codeguard.core.model.SourceFile;

import java.util.List;
import java.util.Objects;

/**
 * Input to a {@link DeepInspector}.
 *
 * @param file file under inspection
 * @param analyzerId id of the escalating analyzer
 * @param category category to assign to new findings
 * @param focus short description of what the analyzer cares about
 * @param tier1Findings findings of Tier 1, referenced by index in the answer
 */
public record DeepInspectionRequest(
    SourceFile file,
    String analyzerId,
    String category,
    String focus,
    List<Finding> tier1Findings
) {
    public DeepInspectionRequest {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(analyzerId, "analyzerId must not be null");
        tier1Findings = tier1Findings == null ? List.of() : List.copyOf(tier1Findings);
    }
}
