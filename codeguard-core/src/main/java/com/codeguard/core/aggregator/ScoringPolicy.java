package com.codeguard.core.aggregator;

import com.codeguard.core.config.CodeGuardConfig;
import com.codeguard.core.config.ConfigurationException;
import com.codeguard.core.model.Severity;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns issues into a 0-100 score and a letter grade.
 *
 * <p>The score starts at {@value #MAX_SCORE} and loses a fixed penalty per issue:
 * <ul>
 *   <li>CRITICAL: {@value #CRITICAL_PENALTY}</li>
 *   <li>HIGH: {@value #HIGH_PENALTY}</li>
 *   <li>MEDIUM: {@value #MEDIUM_PENALTY}</li>
 *   <li>LOW: {@value #LOW_PENALTY}</li>
 *   <li>INFO: {@value #INFO_PENALTY}</li>
 * </ul>
 * It never drops below {@value #MIN_SCORE}. Penalties are non-negative, so adding an issue
 * never raises the score.
 *
 * <p>Letter bands are A (95+), B (85+), C (70+) and D (60+), each split into plus, plain and
 * minus; anything lower is F. A single CRITICAL issue therefore lands on 85, a B-.
 *
 * @since 1.0.0
 */
public class ScoringPolicy {

    public static final int MAX_SCORE = 100;
    public static final int MIN_SCORE = 0;

    public static final int CRITICAL_PENALTY = 15;
    public static final int HIGH_PENALTY = 8;
    public static final int MEDIUM_PENALTY = 4;
    public static final int LOW_PENALTY = 1;
    public static final int INFO_PENALTY = 0;

    private record GradeThreshold(int minScore, String grade) {}

    private static final List<GradeThreshold> GRADES = List.of(
        new GradeThreshold(99, "A+"),
        new GradeThreshold(97, "A"),
        new GradeThreshold(95, "A-"),
        new GradeThreshold(92, "B+"),
        new GradeThreshold(88, "B"),
        new GradeThreshold(85, "B-"),
        new GradeThreshold(80, "C+"),
        new GradeThreshold(75, "C"),
        new GradeThreshold(70, "C-"),
        new GradeThreshold(65, "D+"),
        new GradeThreshold(60, "D")
    );

    private static final String FAILING_GRADE = "F";

    private final Map<Severity, Integer> penalties;

    public ScoringPolicy(Map<Severity, Integer> penalties) {
        EnumMap<Severity, Integer> resolved = new EnumMap<>(defaultPenalties());
        if (penalties != null) {
            penalties.forEach((severity, penalty) -> {
                if (penalty == null || penalty < 0) {
                    throw new ConfigurationException("Penalty for " + severity + " must be >= 0, got " + penalty);
                }
                resolved.put(severity, penalty);
            });
        }
        this.penalties = resolved;
    }

    public static ScoringPolicy defaults() {
        return new ScoringPolicy(Map.of());
    }

    /**
     * Creates a policy with penalties overridden from configuration.
     *
     * @param settings scoring section, keys are severity names
     * @return policy
     * @throws ConfigurationException for unknown severities or negative penalties
     */
    public static ScoringPolicy from(CodeGuardConfig.ScoringSettings settings) {
        Map<Severity, Integer> overrides = new EnumMap<>(Severity.class);
        settings.penalties().forEach((name, penalty) -> {
            Severity severity = Severity.fromString(name);
            if (severity == null) {
                throw new ConfigurationException("Unknown severity in scoring.penalties: " + name);
            }
            overrides.put(severity, penalty);
        });
        return new ScoringPolicy(overrides);
    }

    /**
     * @param severities severity of each issue
     * @return score clamped to [0, 100]
     */
    public int score(Collection<Severity> severities) {
        long total = 0;
        for (Severity severity : severities) {
            total += penalty(severity);
        }
        return (int) Math.max(MIN_SCORE, Math.min(MAX_SCORE, MAX_SCORE - total));
    }

    public int penalty(Severity severity) {
        return penalties.getOrDefault(severity, 0);
    }

    /**
     * @param score score in [0, 100]
     * @return letter grade, ASCII hyphen for minus grades
     */
    public String grade(int score) {
        for (GradeThreshold threshold : GRADES) {
            if (score >= threshold.minScore()) {
                return threshold.grade();
            }
        }
        return FAILING_GRADE;
    }

    private static Map<Severity, Integer> defaultPenalties() {
        return Map.of(
            Severity.CRITICAL, CRITICAL_PENALTY,
            Severity.HIGH, HIGH_PENALTY,
            Severity.MEDIUM, MEDIUM_PENALTY,
            Severity.LOW, LOW_PENALTY,
            Severity.INFO, INFO_PENALTY);
    }
}
