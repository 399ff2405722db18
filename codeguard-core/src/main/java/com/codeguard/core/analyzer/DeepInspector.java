package com.codeguard.core.analyzer;

/**
 * Tier-2 back end performing expensive inspection of one file.
 *
 * <p>Implementations may block on remote services; they are only invoked after the
 * {@link EscalationPolicy} decided the file is worth it. Implementations must be
 * thread-safe.
 *
 * @see com.codeguard.core.analyzer.deep.ChatCompletionDeepInspector
 * @since 1.0.0
 */
@FunctionalInterface
public interface DeepInspector {

    /**
     * Inspects a file given the Tier-1 findings of one analyzer.
     *
     * @param request file, analyzer focus and Tier-1 findings
     * @return verdicts on the Tier-1 findings plus new findings
     * @throws DeepInspectionException if the back end fails
     */
    DeepInspection inspect(DeepInspectionRequest request) throws DeepInspectionException;
}
