package com.codeguard.core.scheduler;

import java.time.Duration;
import java.util.Map;

/**
 * Immutable view of a run's progress, handed to {@link ProgressObserver}s.
 *
 * @param totalTasks number of scheduled tasks
 * @param dispatchedTasks tasks handed to a worker so far
 * @param completedTasks tasks that settled as COMPLETED
 * @param failedTasks tasks that settled as FAILED
 * @param timedOutTasks tasks that settled as TIMED_OUT
 * @param inFlightTasks dispatched tasks that have not settled
 * @param peakInFlightTasks highest in-flight count observed
 * @param runningWorkers analyzer calls executing right now, including timed-out calls that
 *                       have not returned yet
 * @param peakRunningWorkers highest number of analyzer calls executing at once
 * @param findingsSoFar findings reported by completed tasks
 * @param elapsedTime time since the run started
 * @param perAnalyzerStats counters per analyzer id
 */
public record ProgressSnapshot(
    int totalTasks,
    int dispatchedTasks,
    int completedTasks,
    int failedTasks,
    int timedOutTasks,
    int inFlightTasks,
    int peakInFlightTasks,
    int runningWorkers,
    int peakRunningWorkers,
    int findingsSoFar,
    Duration elapsedTime,
    Map<String, AnalyzerActivity> perAnalyzerStats
) {
    public ProgressSnapshot {
        perAnalyzerStats = perAnalyzerStats == null ? Map.of() : Map.copyOf(perAnalyzerStats);
        elapsedTime = elapsedTime == null ? Duration.ZERO : elapsedTime;
    }

    /**
     * @return completed, failed and timed out tasks
     */
    public int settledTasks() {
        return completedTasks + failedTasks + timedOutTasks;
    }

    /**
     * @return settled share of all tasks in percent, 100 for an empty run
     */
    public double progressPercent() {
        if (totalTasks == 0) {
            return 100.0;
        }
        return settledTasks() * 100.0 / totalTasks;
    }
}
