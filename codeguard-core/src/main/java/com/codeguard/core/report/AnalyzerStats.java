package com.codeguard.core.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Per-analyzer statistics derived from outcomes.
 *
 * @param tasks tasks run by the analyzer
 * @param filesProcessed tasks that completed
 * @param findings findings reported before deduplication
 * @param failures failed tasks
 * @param timeouts timed out tasks
 * @param deepInspections completed tasks whose deep inspection was merged
 * @param executionTime summed execution time in seconds
 */
@JsonPropertyOrder({"tasks", "files_processed", "findings", "failures", "timeouts", "deep_inspections", "execution_time"})
public record AnalyzerStats(
    @JsonProperty("tasks") int tasks,
    @JsonProperty("files_processed") int filesProcessed,
    @JsonProperty("findings") int findings,
    @JsonProperty("failures") int failures,
    @JsonProperty("timeouts") int timeouts,
    @JsonProperty("deep_inspections") int deepInspections,
    @JsonProperty("execution_time") double executionTime
) {
    public static AnalyzerStats empty() {
        return new AnalyzerStats(0, 0, 0, 0, 0, 0, 0.0);
    }
}
