package com.codeguard.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a {@link Finding}.
 *
 * <p>Declaration order is the total order used everywhere in the engine: {@link #CRITICAL}
 * is the most severe and {@link #INFO} the least. Use {@link #isMoreSevereThan(Severity)}
 * rather than comparing ordinals directly.</p>
 *
 * <p>Serialized in lowercase ({@code "critical"}, {@code "high"}, ...) to keep the report
 * format stable for downstream consumers.</p>
 *
 * @since 1.0.0
 */
public enum Severity {
    /**
     * Exploitable or data-losing problem that must be fixed before release.
     */
    CRITICAL,

    /**
     * Serious problem that should be fixed soon.
     */
    HIGH,

    /**
     * Problem worth fixing in the normal course of work.
     */
    MEDIUM,

    /**
     * Minor problem or style issue.
     */
    LOW,

    /**
     * Informational note, no action required.
     */
    INFO;

    /**
     * Returns true if this severity ranks above {@code other}.
     *
     * @param other severity to compare with
     * @return true if this is strictly more severe
     */
    public boolean isMoreSevereThan(Severity other) {
        return other == null || ordinal() < other.ordinal();
    }

    /**
     * Returns the more severe of two severities.
     *
     * @param a first severity (nullable)
     * @param b second severity (nullable)
     * @return the more severe one, or null if both are null
     */
    public static Severity max(Severity a, Severity b) {
        if (a == null) {
            return b;
        }
        return b != null && b.isMoreSevereThan(a) ? b : a;
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a severity name case-insensitively.
     *
     * @param value severity name such as {@code "high"} or {@code "CRITICAL"}
     * @return parsed severity, or null if the value is blank or unknown
     */
    @JsonCreator
    public static Severity fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
