package com.codeguard.core.analyzer;

/**
 * Result of an {@link EscalationPolicy} with the rule that produced it.
 *
 * @param escalate true if Tier 2 should run
 * @param reason rule that decided
 */
public record EscalationDecision(boolean escalate, Reason reason) {

    /**
     * Rule that produced a decision, in evaluation order.
     */
    public enum Reason {
        CRITICAL_FINDING,
        BELOW_MINIMUM_SIZE,
        CONFIGURATION_FILE,
        HIGH_COMPLEXITY,
        SAMPLED,
        NOT_SAMPLED
    }

    public static EscalationDecision escalate(Reason reason) {
        return new EscalationDecision(true, reason);
    }

    public static EscalationDecision skip(Reason reason) {
        return new EscalationDecision(false, reason);
    }
}
