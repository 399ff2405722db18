package com.codeguard.core.model;

/**
 * Terminal state of one (file, analyzer) task.
 *
 * @since 1.0.0
 */
public enum OutcomeStatus {
    /**
     * The analyzer finished and its findings are valid.
     */
    COMPLETED,

    /**
     * The analyzer raised an error; findings are discarded.
     */
    FAILED,

    /**
     * The task exceeded its deadline and was abandoned.
     */
    TIMED_OUT
}
