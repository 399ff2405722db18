package com.codeguard.core.scheduler;

/**
 * Per-analyzer counters of a running analysis.
 *
 * @param filesProcessed files the analyzer completed
 * @param findingsFound findings reported by completed tasks
 * @param failures failed tasks
 * @param timeouts timed out tasks
 */
public record AnalyzerActivity(int filesProcessed, int findingsFound, int failures, int timeouts) {

    public static AnalyzerActivity empty() {
        return new AnalyzerActivity(0, 0, 0, 0);
    }
}
