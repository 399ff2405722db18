package com.codeguard.core.scheduler;

import com.codeguard.core.analyzer.Analyzer;
import com.codeguard.core.analyzer.AnalyzerRegistry;
import com.codeguard.core.analyzer.DeepInspector;
import com.codeguard.core.analyzer.DefaultEscalationPolicy;
import com.codeguard.core.analyzer.EscalationPolicy;
import com.codeguard.core.config.AnalysisConfig;
import com.codeguard.core.config.ConfigurationException;
import com.codeguard.core.model.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Runs every enabled analyzer on every supported catalog file with bounded concurrency.
 *
 * <p><b>Task set:</b> catalog order × analyzer id order, skipping files that match a skip
 * pattern and pairs the analyzer does not support. The same catalog and configuration
 * always yield the same tasks in the same order.
 *
 * <p><b>Validation:</b> an empty catalog, an empty enabled-analyzer set, or a set naming
 * no registered analyzer raises {@link ConfigurationException} before anything runs.
 * Unknown ids next to known ones are logged and ignored.
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * AnalysisScheduler scheduler = new AnalysisScheduler();
 * SchedulerResult result = scheduler.run(catalog, AnalyzerRegistry.discover(), config, List.of());
 * }</pre>
 *
 * @see ScheduledRun
 * @since 1.0.0
 */
public class AnalysisScheduler {

    private static final Logger log = LoggerFactory.getLogger(AnalysisScheduler.class);

    private final EscalationPolicy escalationPolicy;
    private final DeepInspector deepInspector;

    public AnalysisScheduler() {
        this(new DefaultEscalationPolicy(), null);
    }

    /**
     * @param escalationPolicy policy deciding Tier-2 escalation
     * @param deepInspector Tier-2 back end, null to run Tier 1 only
     */
    public AnalysisScheduler(EscalationPolicy escalationPolicy, DeepInspector deepInspector) {
        this.escalationPolicy = Objects.requireNonNull(escalationPolicy, "escalationPolicy must not be null");
        this.deepInspector = deepInspector;
    }

    /**
     * Validates the input, builds the task set and starts dispatching.
     *
     * @param catalog files to analyze
     * @param registry available analyzers
     * @param config run configuration
     * @param observers progress observers
     * @return handle of the running analysis
     * @throws ConfigurationException if there is nothing valid to run
     */
    public ScheduledRun start(List<SourceFile> catalog, AnalyzerRegistry registry, AnalysisConfig config,
                              List<ProgressObserver> observers) {
        Objects.requireNonNull(registry, "registry must not be null");
        Objects.requireNonNull(config, "config must not be null");
        if (catalog == null || catalog.isEmpty()) {
            throw new ConfigurationException("Catalog is empty, nothing to analyze");
        }
        if (config.enabledAnalyzers().isEmpty()) {
            throw new ConfigurationException("No analyzers enabled");
        }

        AnalyzerRegistry.Resolution resolution = registry.resolve(config.enabledAnalyzers());
        if (!resolution.unknownIds().isEmpty()) {
            log.warn("Ignoring unknown analyzers: {} (available: {})", resolution.unknownIds(), registry.ids());
        }
        if (resolution.analyzers().isEmpty()) {
            throw new ConfigurationException("None of the enabled analyzers " + config.enabledAnalyzers()
                + " is registered (available: " + registry.ids() + ")");
        }

        List<AnalysisTask> tasks = buildTasks(catalog, resolution.analyzers(), config);
        log.info("Scheduled {} tasks for {} files and {} analyzers", tasks.size(), catalog.size(),
            resolution.analyzers().size());

        ScheduledRun run = new ScheduledRun(tasks, config, escalationPolicy, deepInspector,
            observers == null ? List.of() : observers);
        run.begin();
        return run;
    }

    /**
     * Starts a run with explicit analyzer instances.
     *
     * @param catalog files to analyze
     * @param analyzers analyzer instances
     * @param config run configuration
     * @param observers progress observers
     * @return handle of the running analysis
     */
    public ScheduledRun start(List<SourceFile> catalog, Collection<? extends Analyzer> analyzers,
                              AnalysisConfig config, List<ProgressObserver> observers) {
        return start(catalog, AnalyzerRegistry.of(analyzers), config, observers);
    }

    /**
     * Starts a run and waits for it.
     *
     * @param catalog files to analyze
     * @param registry available analyzers
     * @param config run configuration
     * @param observers progress observers
     * @return settled outcomes
     */
    public SchedulerResult run(List<SourceFile> catalog, AnalyzerRegistry registry, AnalysisConfig config,
                               List<ProgressObserver> observers) {
        return start(catalog, registry, config, observers).await();
    }

    public SchedulerResult run(List<SourceFile> catalog, Collection<? extends Analyzer> analyzers,
                               AnalysisConfig config, List<ProgressObserver> observers) {
        return start(catalog, analyzers, config, observers).await();
    }

    static List<AnalysisTask> buildTasks(List<SourceFile> catalog, List<Analyzer> analyzers, AnalysisConfig config) {
        SkipPatternMatcher skip = new SkipPatternMatcher(config.skipPatterns());
        List<AnalysisTask> tasks = new ArrayList<>();
        for (SourceFile file : catalog) {
            if (skip.matches(file.path())) {
                log.debug("Skipping {} (matches skip pattern)", file.path());
                continue;
            }
            for (Analyzer analyzer : analyzers) {
                if (analyzer.supports(file)) {
                    tasks.add(new AnalysisTask(tasks.size(), file, analyzer));
                }
            }
        }
        return tasks;
    }
}
