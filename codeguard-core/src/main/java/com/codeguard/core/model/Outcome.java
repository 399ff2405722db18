package com.codeguard.core.model;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one (file, analyzer) task as settled by the scheduler.
 *
 * <p>Created exactly once per task through {@link #completed}, {@link #failed} or
 * {@link #timedOut}. Only completed outcomes carry findings.</p>
 *
 * @param analyzerId id of the analyzer that ran
 * @param filePath path of the analyzed file
 * @param findings findings reported (empty unless completed)
 * @param metrics numeric analyzer statistics
 * @param status terminal status
 * @param errorMessage reason for failure or timeout; null when completed
 * @param executionTime wall-clock time spent on the task
 * @since 1.0.0
 */
public record Outcome(
    String analyzerId,
    String filePath,
    List<Finding> findings,
    Map<String, Number> metrics,
    OutcomeStatus status,
    String errorMessage,
    Duration executionTime
) {
    /**
     * Compact constructor with validation.
     */
    public Outcome {
        Objects.requireNonNull(analyzerId, "analyzerId must not be null");
        Objects.requireNonNull(filePath, "filePath must not be null");
        Objects.requireNonNull(status, "status must not be null");
        findings = findings == null ? List.of() : List.copyOf(findings);
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
        if (executionTime == null || executionTime.isNegative()) {
            executionTime = Duration.ZERO;
        }
    }

    public static Outcome completed(String analyzerId, String filePath, AnalyzerResult result, Duration executionTime) {
        return new Outcome(analyzerId, filePath, result.findings(), result.metrics(),
            OutcomeStatus.COMPLETED, null, executionTime);
    }

    public static Outcome failed(String analyzerId, String filePath, String errorMessage, Duration executionTime) {
        return new Outcome(analyzerId, filePath, List.of(), Map.of(),
            OutcomeStatus.FAILED, errorMessage, executionTime);
    }

    public static Outcome timedOut(String analyzerId, String filePath, Duration timeout) {
        return new Outcome(analyzerId, filePath, List.of(), Map.of(),
            OutcomeStatus.TIMED_OUT, "Analysis exceeded timeout of " + timeout.toMillis() + " ms", timeout);
    }

    public boolean isCompleted() {
        return status == OutcomeStatus.COMPLETED;
    }
}
