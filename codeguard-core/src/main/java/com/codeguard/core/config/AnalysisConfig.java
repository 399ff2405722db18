package com.codeguard.core.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable settings for one analysis run.
 *
 * <p>Numeric settings are validated on construction and violations raise
 * {@link ConfigurationException}. The enabled analyzer set may be empty here; the scheduler
 * rejects an empty set when a run is started.</p>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AnalysisConfig config = AnalysisConfig.builder()
 *     .enabledAnalyzers(Set.of("security", "dependency"))
 *     .maxConcurrentTasks(4)
 *     .perTaskTimeout(Duration.ofSeconds(10))
 *     .randomSeed(42L)
 *     .build();
 * }</pre>
 *
 * @param maxConcurrentTasks upper bound of tasks in flight, at least 1
 * @param perTaskTimeout deadline for one (file, analyzer) task, positive
 * @param enabledAnalyzers analyzer ids to run, iterated in sorted order
 * @param useDeepTier whether analyzers may escalate to deep inspection
 * @param deepTierSampleRate probability of escalating an unremarkable file, in [0, 1]
 * @param skipPatterns glob patterns of file paths excluded from analysis
 * @param randomSeed seed for escalation sampling
 * @since 1.0.0
 */
public record AnalysisConfig(
    int maxConcurrentTasks,
    Duration perTaskTimeout,
    Set<String> enabledAnalyzers,
    boolean useDeepTier,
    double deepTierSampleRate,
    List<String> skipPatterns,
    long randomSeed
) {
    public static final int DEFAULT_MAX_CONCURRENT_TASKS = 10;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final double DEFAULT_SAMPLE_RATE = 0.2;
    public static final long DEFAULT_SEED = 0L;

    public static final Set<String> DEFAULT_ANALYZERS = Set.of(
        "security", "dependency", "code_quality", "performance", "best_practices"
    );

    public static final List<String> DEFAULT_SKIP_PATTERNS = List.of(
        "*.min.js", "*.map", "node_modules/*", "__pycache__/*", ".git/*", "*.pyc",
        "venv/*", "env/*", ".venv/*", "dist/*", "build/*"
    );

    /**
     * Compact constructor with validation.
     */
    public AnalysisConfig {
        if (maxConcurrentTasks < 1) {
            throw new ConfigurationException("maxConcurrentTasks must be at least 1, got " + maxConcurrentTasks);
        }
        if (perTaskTimeout == null || perTaskTimeout.isZero() || perTaskTimeout.isNegative()) {
            throw new ConfigurationException("perTaskTimeout must be positive, got " + perTaskTimeout);
        }
        if (Double.isNaN(deepTierSampleRate) || deepTierSampleRate < 0.0 || deepTierSampleRate > 1.0) {
            throw new ConfigurationException("deepTierSampleRate must be within [0, 1], got " + deepTierSampleRate);
        }
        enabledAnalyzers = enabledAnalyzers == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(new TreeSet<>(enabledAnalyzers)));
        skipPatterns = skipPatterns == null ? List.of() : List.copyOf(skipPatterns);
    }

    /**
     * Creates the default configuration: all built-in analyzers, 10 concurrent tasks,
     * 30 second timeout, deep tier disabled.
     *
     * @return default configuration
     */
    public static AnalysisConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-filled with this configuration.
     *
     * @return builder copy
     */
    public Builder toBuilder() {
        return new Builder()
            .maxConcurrentTasks(maxConcurrentTasks)
            .perTaskTimeout(perTaskTimeout)
            .enabledAnalyzers(enabledAnalyzers)
            .useDeepTier(useDeepTier)
            .deepTierSampleRate(deepTierSampleRate)
            .skipPatterns(skipPatterns)
            .randomSeed(randomSeed);
    }

    /**
     * Builder for {@link AnalysisConfig}.
     */
    public static class Builder {
        private int maxConcurrentTasks = DEFAULT_MAX_CONCURRENT_TASKS;
        private Duration perTaskTimeout = DEFAULT_TIMEOUT;
        private Set<String> enabledAnalyzers = new TreeSet<>(DEFAULT_ANALYZERS);
        private boolean useDeepTier = false;
        private double deepTierSampleRate = DEFAULT_SAMPLE_RATE;
        private List<String> skipPatterns = new ArrayList<>(DEFAULT_SKIP_PATTERNS);
        private long randomSeed = DEFAULT_SEED;

        public Builder maxConcurrentTasks(int maxConcurrentTasks) {
            this.maxConcurrentTasks = maxConcurrentTasks;
            return this;
        }

        public Builder perTaskTimeout(Duration perTaskTimeout) {
            this.perTaskTimeout = perTaskTimeout;
            return this;
        }

        public Builder enabledAnalyzers(Set<String> enabledAnalyzers) {
            this.enabledAnalyzers = enabledAnalyzers == null ? new TreeSet<>() : new TreeSet<>(enabledAnalyzers);
            return this;
        }

        public Builder useDeepTier(boolean useDeepTier) {
            this.useDeepTier = useDeepTier;
            return this;
        }

        public Builder deepTierSampleRate(double deepTierSampleRate) {
            this.deepTierSampleRate = deepTierSampleRate;
            return this;
        }

        public Builder skipPatterns(List<String> skipPatterns) {
            this.skipPatterns = skipPatterns == null ? new ArrayList<>() : new ArrayList<>(skipPatterns);
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public AnalysisConfig build() {
            return new AnalysisConfig(maxConcurrentTasks, perTaskTimeout, enabledAnalyzers,
                useDeepTier, deepTierSampleRate, skipPatterns, randomSeed);
        }
    }
}
