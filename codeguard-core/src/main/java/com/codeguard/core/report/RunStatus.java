package com.codeguard.core.report;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Overall status of a report.
 *
 * @since 1.0.0
 */
public enum RunStatus {
    /** At least one task completed. */
    COMPLETED,
    /** No task completed. */
    FAILED;

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }
}
