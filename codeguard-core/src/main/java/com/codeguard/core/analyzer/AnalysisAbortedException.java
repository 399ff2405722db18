package com.codeguard.core.analyzer;

/**
 * Thrown from {@link AnalysisContext#checkpoint()} when the task deadline has passed or
 * the run has been cancelled.
 *
 * <p>Analyzers let it propagate. The scheduler has already settled the task by the time it
 * is observed, so the partial work is discarded.
 *
 * @since 1.0.0
 */
public class AnalysisAbortedException extends RuntimeException {

    public AnalysisAbortedException(String message) {
        super(message);
    }
}
