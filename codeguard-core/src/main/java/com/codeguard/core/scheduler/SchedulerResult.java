package com.codeguard.core.scheduler;

import com.codeguard.core.model.Outcome;

import java.time.Duration;
import java.util.List;

/**
 * Result of a scheduled run.
 *
 * @param outcomes settled outcomes in task order
 * @param cancelled true if the run was cancelled before all tasks settled
 * @param progress final progress snapshot
 * @param elapsed wall-clock duration of the run
 */
public record SchedulerResult(
    List<Outcome> outcomes,
    boolean cancelled,
    ProgressSnapshot progress,
    Duration elapsed
) {
    public SchedulerResult {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }
}
