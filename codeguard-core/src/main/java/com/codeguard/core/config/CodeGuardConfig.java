package com.codeguard.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Root configuration for CodeGuard.
 *
 * <p>Loaded from {@code codeguard.yaml}. Every section and every key is optional; missing
 * values fall back to the defaults of {@link AnalysisConfig}, {@link DeepTierSettings} and
 * {@link ScoringSettings}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * analysis:
 *   enabled_agents:
 *     - security
 *     - dependency
 *   max_concurrent_files: 8
 *   timeout_per_file: 20
 *   use_llm: true
 *   llm_sample_rate: 0.1
 *   skip_patterns:
 *     - "*.min.js"
 *     - "vendor/*"
 *   random_seed: 42
 *
 * deep_tier:
 *   base_url: "http://localhost:11434/v1"
 *   model: "qwen3:8b"
 *   api_key_env: "CODEGUARD_LLM_API_KEY"
 *
 * scoring:
 *   penalties:
 *     critical: 20
 *   category_thresholds:
 *     code_quality: 10
 *   max_recommendations: 5
 * }</pre>
 *
 * @param analysis scheduler and analyzer settings
 * @param deepTier deep inspection back-end settings
 * @param scoring scoring and recommendation settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CodeGuardConfig(
    @JsonProperty("analysis") AnalysisSettings analysis,
    @JsonProperty("deep_tier") DeepTierSettings deepTier,
    @JsonProperty("scoring") ScoringSettings scoring
) {
    /**
     * Compact constructor substituting empty sections for missing ones.
     */
    public CodeGuardConfig {
        if (analysis == null) {
            analysis = AnalysisSettings.empty();
        }
        if (deepTier == null) {
            deepTier = DeepTierSettings.empty();
        }
        if (scoring == null) {
            scoring = ScoringSettings.empty();
        }
    }

    /**
     * Creates a configuration where every value is the default.
     *
     * @return default configuration
     */
    public static CodeGuardConfig defaults() {
        return new CodeGuardConfig(null, null, null);
    }

    /**
     * Converts the analysis section into a validated {@link AnalysisConfig}.
     *
     * @return run configuration
     * @throws ConfigurationException if a numeric setting is out of range
     */
    public AnalysisConfig toAnalysisConfig() {
        return analysis.toAnalysisConfig();
    }

    /**
     * The {@code analysis} section.
     *
     * @param enabledAgents explicit analyzer ids; an explicit empty list disables everything
     * @param enabledGroups analyzer group names expanded via {@link AnalyzerGroups}
     * @param maxConcurrentFiles maximum tasks in flight
     * @param timeoutPerFile per-task timeout in seconds
     * @param useLlm enables the deep inspection tier
     * @param llmSampleRate escalation sample rate
     * @param skipPatterns glob patterns excluded from analysis
     * @param randomSeed seed for escalation sampling
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnalysisSettings(
        @JsonProperty("enabled_agents") List<String> enabledAgents,
        @JsonProperty("enabled_groups") List<String> enabledGroups,
        @JsonProperty("max_concurrent_files") Integer maxConcurrentFiles,
        @JsonProperty("timeout_per_file") Double timeoutPerFile,
        @JsonProperty("use_llm") Boolean useLlm,
        @JsonProperty("llm_sample_rate") Double llmSampleRate,
        @JsonProperty("skip_patterns") List<String> skipPatterns,
        @JsonProperty("random_seed") Long randomSeed
    ) {
        public static AnalysisSettings empty() {
            return new AnalysisSettings(null, null, null, null, null, null, null, null);
        }

        /**
         * Resolves the enabled analyzer set.
         *
         * <p>When neither agents nor groups are configured, every built-in analyzer is enabled.
         * Otherwise the result is the union of the explicit ids and the expanded groups.</p>
         *
         * @return sorted analyzer ids
         */
        public Set<String> resolveEnabledAnalyzers() {
            if (enabledAgents == null && enabledGroups == null) {
                return new TreeSet<>(AnalysisConfig.DEFAULT_ANALYZERS);
            }
            Set<String> resolved = new TreeSet<>();
            if (enabledAgents != null) {
                enabledAgents.stream()
                    .filter(id -> id != null && !id.isBlank())
                    .map(String::trim)
                    .forEach(resolved::add);
            }
            if (enabledGroups != null) {
                resolved.addAll(AnalyzerGroups.getAnalyzersForGroups(enabledGroups));
            }
            return resolved;
        }

        public AnalysisConfig toAnalysisConfig() {
            AnalysisConfig.Builder builder = AnalysisConfig.builder()
                .enabledAnalyzers(resolveEnabledAnalyzers());
            if (maxConcurrentFiles != null) {
                builder.maxConcurrentTasks(maxConcurrentFiles);
            }
            if (timeoutPerFile != null) {
                if (timeoutPerFile.isNaN() || timeoutPerFile <= 0) {
                    throw new ConfigurationException("timeout_per_file must be positive, got " + timeoutPerFile);
                }
                builder.perTaskTimeout(Duration.ofMillis(Math.round(timeoutPerFile * 1000)));
            }
            if (useLlm != null) {
                builder.useDeepTier(useLlm);
            }
            if (llmSampleRate != null) {
                builder.deepTierSampleRate(llmSampleRate);
            }
            if (skipPatterns != null) {
                builder.skipPatterns(skipPatterns);
            }
            if (randomSeed != null) {
                builder.randomSeed(randomSeed);
            }
            return builder.build();
        }
    }

    /**
     * The {@code deep_tier} section describing an OpenAI-compatible chat completion endpoint.
     *
     * @param baseUrl endpoint base URL, {@code /chat/completions} is appended
     * @param model model name
     * @param apiKeyEnv name of the environment variable holding the API key
     * @param requestTimeout request timeout in seconds
     * @param maxContentChars file content is truncated to this many characters in prompts
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DeepTierSettings(
        @JsonProperty("base_url") String baseUrl,
        @JsonProperty("model") String model,
        @JsonProperty("api_key_env") String apiKeyEnv,
        @JsonProperty("request_timeout") Integer requestTimeout,
        @JsonProperty("max_content_chars") Integer maxContentChars
    ) {
        public static final String DEFAULT_BASE_URL = "http://localhost:11434/v1";
        public static final String DEFAULT_MODEL = "qwen3:8b";
        public static final String DEFAULT_API_KEY_ENV = "CODEGUARD_LLM_API_KEY";
        public static final int DEFAULT_REQUEST_TIMEOUT = 120;
        public static final int DEFAULT_MAX_CONTENT_CHARS = 8000;

        public static DeepTierSettings empty() {
            return new DeepTierSettings(null, null, null, null, null);
        }

        public String effectiveBaseUrl() {
            String url = baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl.trim();
            return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        }

        public String effectiveModel() {
            return model == null || model.isBlank() ? DEFAULT_MODEL : model;
        }

        public String effectiveApiKeyEnv() {
            return apiKeyEnv == null || apiKeyEnv.isBlank() ? DEFAULT_API_KEY_ENV : apiKeyEnv;
        }

        public Duration effectiveRequestTimeout() {
            return Duration.ofSeconds(requestTimeout == null || requestTimeout <= 0
                ? DEFAULT_REQUEST_TIMEOUT : requestTimeout);
        }

        public int effectiveMaxContentChars() {
            return maxContentChars == null || maxContentChars <= 0
                ? DEFAULT_MAX_CONTENT_CHARS : maxContentChars;
        }
    }

    /**
     * The {@code scoring} section.
     *
     * @param penalties score penalty per severity name; missing severities keep their default
     * @param categoryThresholds finding count a category must exceed to get a recommendation
     * @param maxRecommendations maximum number of recommendations
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScoringSettings(
        @JsonProperty("penalties") Map<String, Integer> penalties,
        @JsonProperty("category_thresholds") Map<String, Integer> categoryThresholds,
        @JsonProperty("max_recommendations") Integer maxRecommendations
    ) {
        public ScoringSettings {
            penalties = penalties == null ? Map.of() : Map.copyOf(penalties);
            categoryThresholds = categoryThresholds == null ? Map.of() : Map.copyOf(categoryThresholds);
        }

        public static ScoringSettings empty() {
            return new ScoringSettings(null, null, null);
        }
    }
}
