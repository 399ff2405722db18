package com.codeguard.core.engine;

import com.codeguard.core.aggregator.RecommendationPolicy;
import com.codeguard.core.aggregator.ResultAggregator;
import com.codeguard.core.aggregator.ScoringPolicy;
import com.codeguard.core.analyzer.AnalyzerRegistry;
import com.codeguard.core.analyzer.DefaultEscalationPolicy;
import com.codeguard.core.analyzer.deep.ChatCompletionDeepInspector;
import com.codeguard.core.config.AnalysisConfig;
import com.codeguard.core.config.CodeGuardConfig;
import com.codeguard.core.model.SourceFile;
import com.codeguard.core.report.Report;
import com.codeguard.core.scheduler.AnalysisScheduler;
import com.codeguard.core.scheduler.ProgressObserver;
import com.codeguard.core.scheduler.ScheduledRun;
import com.codeguard.core.scheduler.SchedulerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Entry point that wires analyzers, scheduler and aggregator.
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * CodeGuardConfig config = ConfigLoader.load(Path.of("codeguard.yaml"));
 * AnalysisConfig analysisConfig = config.toAnalysisConfig();
 * AnalysisEngine engine = AnalysisEngine.create(config, analysisConfig);
 * Report report = engine.analyze(catalog, analysisConfig, List.of());
 * }</pre>
 *
 * @since 1.0.0
 */
public class AnalysisEngine {

    private static final Logger log = LoggerFactory.getLogger(AnalysisEngine.class);

    private final AnalyzerRegistry registry;
    private final AnalysisScheduler scheduler;
    private final ResultAggregator aggregator;

    public AnalysisEngine(AnalyzerRegistry registry, AnalysisScheduler scheduler, ResultAggregator aggregator) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
    }

    /**
     * Creates an engine with SPI-discovered analyzers. A chat-completion deep inspector is
     * attached when the run configuration enables the deep tier.
     *
     * @param config loaded configuration, for the deep tier and scoring sections
     * @param analysisConfig effective run configuration
     * @return engine
     */
    public static AnalysisEngine create(CodeGuardConfig config, AnalysisConfig analysisConfig) {
        AnalysisScheduler scheduler;
        if (analysisConfig.useDeepTier()) {
            log.info("Deep tier enabled using model {} at {}",
                config.deepTier().effectiveModel(), config.deepTier().effectiveBaseUrl());
            scheduler = new AnalysisScheduler(new DefaultEscalationPolicy(),
                ChatCompletionDeepInspector.fromSettings(config.deepTier()));
        } else {
            scheduler = new AnalysisScheduler();
        }
        ResultAggregator aggregator = new ResultAggregator(
            ScoringPolicy.from(config.scoring()),
            RecommendationPolicy.from(config.scoring()));
        return new AnalysisEngine(AnalyzerRegistry.discover(), scheduler, aggregator);
    }

    public AnalyzerRegistry registry() {
        return registry;
    }

    /**
     * Starts an analysis without waiting for it.
     *
     * @param catalog files to analyze
     * @param config run configuration
     * @param observers progress observers
     * @return handle of the run
     */
    public ScheduledRun start(List<SourceFile> catalog, AnalysisConfig config, List<ProgressObserver> observers) {
        return scheduler.start(catalog, registry, config, observers);
    }

    /**
     * Runs an analysis and aggregates the outcomes.
     *
     * @param catalog files to analyze
     * @param config run configuration
     * @param observers progress observers
     * @return report
     */
    public Report analyze(List<SourceFile> catalog, AnalysisConfig config, List<ProgressObserver> observers) {
        return report(start(catalog, config, observers).await());
    }

    /**
     * Aggregates the outcomes of a finished run.
     *
     * @param result scheduler result
     * @return report
     */
    public Report report(SchedulerResult result) {
        if (result.cancelled()) {
            log.warn("Analysis was cancelled, report covers {} settled tasks", result.outcomes().size());
        }
        return aggregator.aggregate(result.outcomes(), registry.ids(), result.elapsed());
    }
}
