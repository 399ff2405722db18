package com.codeguard.core.report;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Timing section of a report.
 *
 * @param totalDuration duration in seconds, rounded to two decimals
 */
public record Timing(@JsonProperty("total_duration") double totalDuration) {

    public static Timing of(Duration duration) {
        double seconds = duration.toNanos() / 1_000_000_000.0;
        return new Timing(Math.round(seconds * 100.0) / 100.0);
    }
}
