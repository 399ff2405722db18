package com.codeguard.core.analyzer;

import com.codeguard.core.config.AnalysisConfig;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.function.BooleanSupplier;

/**
 * Per-task context handed to {@link Analyzer#analyze}.
 *
 * <p>Carries the run configuration, the escalation policy, the optional deep inspector, a
 * random source seeded for this (file, analyzer) pair, and the task's deadline and
 * cancellation signal. A context belongs to exactly one task and is not shared.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AnalysisContext context = AnalysisContext.builder(config)
 *     .deepInspector(inspector)
 *     .random(new Random(AnalysisContext.deriveSeed(config.randomSeed(), path, "security")))
 *     .deadlineNanos(System.nanoTime() + timeout.toNanos())
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class AnalysisContext {

    private final AnalysisConfig config;
    private final EscalationPolicy escalationPolicy;
    private final DeepInspector deepInspector;
    private final Random random;
    private final long deadlineNanos;
    private final BooleanSupplier cancelled;

    private AnalysisContext(Builder builder) {
        this.config = builder.config;
        this.escalationPolicy = builder.escalationPolicy;
        this.deepInspector = builder.deepInspector;
        this.random = builder.random;
        this.deadlineNanos = builder.deadlineNanos;
        this.cancelled = builder.cancelled;
    }

    public AnalysisConfig config() {
        return config;
    }

    public EscalationPolicy escalationPolicy() {
        return escalationPolicy;
    }

    public Optional<DeepInspector> deepInspector() {
        return Optional.ofNullable(deepInspector);
    }

    public Random random() {
        return random;
    }

    /**
     * Returns true if the deadline passed or the run was cancelled.
     *
     * @return true if the task should stop
     */
    public boolean isAborted() {
        return cancelled.getAsBoolean() || System.nanoTime() - deadlineNanos >= 0;
    }

    /**
     * Cooperative abort point. Analyzers call it between rules and before Tier 2.
     *
     * @throws AnalysisAbortedException if the task should stop
     */
    public void checkpoint() {
        if (cancelled.getAsBoolean()) {
            throw new AnalysisAbortedException("Analysis cancelled");
        }
        if (System.nanoTime() - deadlineNanos >= 0) {
            throw new AnalysisAbortedException("Analysis deadline exceeded");
        }
    }

    /**
     * Returns the time left until the deadline.
     *
     * @return remaining time, zero once the deadline passed
     */
    public Duration remainingTime() {
        long remaining = deadlineNanos - System.nanoTime();
        return remaining > 0 ? Duration.ofNanos(remaining) : Duration.ZERO;
    }

    /**
     * Derives the sampling seed of one task from the run seed.
     *
     * <p>The value depends only on its arguments, so escalation decisions do not depend on
     * the order in which tasks are dispatched.
     *
     * @param runSeed configured seed
     * @param filePath analyzed file
     * @param analyzerId analyzer id
     * @return task seed
     */
    public static long deriveSeed(long runSeed, String filePath, String analyzerId) {
        long h = runSeed;
        h = 31 * h + filePath.hashCode();
        h = 31 * h + analyzerId.hashCode();
        // SplitMix64 finalizer spreads nearby inputs
        h = (h ^ (h >>> 30)) * 0xbf58476d1ce4e5b9L;
        h = (h ^ (h >>> 27)) * 0x94d049bb133111ebL;
        return h ^ (h >>> 31);
    }

    public static Builder builder(AnalysisConfig config) {
        return new Builder(config);
    }

    /**
     * Builder for {@link AnalysisContext}. Defaults: {@link DefaultEscalationPolicy}, no deep
     * inspector, a random seeded with the run seed, no deadline, never cancelled.
     */
    public static class Builder {
        private final AnalysisConfig config;
        private EscalationPolicy escalationPolicy = new DefaultEscalationPolicy();
        private DeepInspector deepInspector;
        private Random random;
        private long deadlineNanos;
        private boolean hasDeadline;
        private BooleanSupplier cancelled = () -> false;

        private Builder(AnalysisConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
        }

        public Builder escalationPolicy(EscalationPolicy escalationPolicy) {
            this.escalationPolicy = Objects.requireNonNull(escalationPolicy, "escalationPolicy must not be null");
            return this;
        }

        public Builder deepInspector(DeepInspector deepInspector) {
            this.deepInspector = deepInspector;
            return this;
        }

        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        public Builder deadlineNanos(long deadlineNanos) {
            this.deadlineNanos = deadlineNanos;
            this.hasDeadline = true;
            return this;
        }

        public Builder cancellation(BooleanSupplier cancelled) {
            this.cancelled = Objects.requireNonNull(cancelled, "cancelled must not be null");
            return this;
        }

        public AnalysisContext build() {
            if (random == null) {
                random = new Random(config.randomSeed());
            }
            if (!hasDeadline) {
                // Far enough in the future to never trigger while staying overflow-safe
                deadlineNanos = System.nanoTime() + Duration.ofDays(365).toNanos();
            }
            return new AnalysisContext(this);
        }
    }
}
