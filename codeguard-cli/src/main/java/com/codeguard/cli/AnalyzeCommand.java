package com.codeguard.cli;

import com.codeguard.cli.catalog.DirectoryCatalogLoader;
import com.codeguard.core.config.AnalysisConfig;
import com.codeguard.core.config.AnalyzerGroups;
import com.codeguard.core.config.CodeGuardConfig;
import com.codeguard.core.config.ConfigLoader;
import com.codeguard.core.config.ConfigurationException;
import com.codeguard.core.engine.AnalysisEngine;
import com.codeguard.core.model.SourceFile;
import com.codeguard.core.renderer.RenderContext;
import com.codeguard.core.renderer.ReportRenderer;
import com.codeguard.core.renderer.ReportRenderers;
import com.codeguard.core.report.Report;
import com.codeguard.core.report.RunStatus;
import com.codeguard.core.scheduler.ProgressObserver;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Command to analyze a directory and report the findings.
 *
 * <p>Execution flow:
 * <ol>
 *   <li>Load configuration from {@code codeguard.yaml} (or the file given with {@code -c})</li>
 *   <li>Apply command-line overrides</li>
 *   <li>Load the file catalog from the project directory</li>
 *   <li>Run the enabled analyzers concurrently</li>
 *   <li>Render the report to the console and, with {@code -o}, to a JSON file</li>
 * </ol>
 *
 * <p>Exit codes: {@code 0} when the report was produced, {@code 1} on configuration or
 * I/O errors, {@code 2} when every analysis task failed.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * codeguard analyze
 * codeguard analyze ./service --agents security,performance -o report.json
 * codeguard analyze --groups quality --max-concurrent 4 --timeout 10
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Analyze a codebase and report quality issues",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    static final int EXIT_ANALYSIS_FAILED = 2;

    @Parameters(
        index = "0",
        description = "Project directory (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: codeguard.yaml in the project directory)"
    )
    private Path configFile;

    @Option(
        names = {"-o", "--output"},
        description = "Write the JSON report to this file"
    )
    private Path outputFile;

    @Option(
        names = {"--agents"},
        split = ",",
        description = "Analyzer ids to run (overrides config)"
    )
    private List<String> agents;

    @Option(
        names = {"--groups"},
        split = ",",
        description = "Analyzer groups to run: ${COMPLETION-CANDIDATES}",
        completionCandidates = GroupCandidates.class
    )
    private List<String> groups;

    @Option(
        names = {"--use-llm"},
        description = "Enable deep inspection through the configured chat completion endpoint"
    )
    private Boolean useLlm;

    @Option(
        names = {"--max-concurrent"},
        description = "Maximum analysis tasks in flight"
    )
    private Integer maxConcurrent;

    @Option(
        names = {"--timeout"},
        description = "Per-task timeout in seconds"
    )
    private Double timeoutSeconds;

    @Option(
        names = {"--seed"},
        description = "Random seed for deep inspection sampling"
    )
    private Long seed;

    @Option(
        names = {"--no-color"},
        description = "Disable ANSI colors in console output"
    )
    private boolean noColor;

    @Option(
        names = {"--max-issues"},
        description = "Issues listed in console output (default: 20)",
        defaultValue = "20"
    )
    private int maxIssues;

    @Override
    public Integer call() {
        try {
            Path root = projectPath.toAbsolutePath().normalize();
            System.out.println("Analyzing project: " + root);

            CodeGuardConfig config = loadConfig(root);
            AnalysisConfig analysisConfig = applyOverrides(config.toAnalysisConfig());
            log.debug("Effective analysis configuration: {}", analysisConfig);

            List<SourceFile> catalog = new DirectoryCatalogLoader().load(root);
            System.out.println("✓ Loaded " + catalog.size() + " files");

            AnalysisEngine engine = AnalysisEngine.create(config, analysisConfig);
            Report report = engine.analyze(catalog, analysisConfig, List.of(progressLogger()));

            render(report);

            if (report.status() == RunStatus.FAILED) {
                System.err.println("✗ Analysis failed: no task completed");
                return EXIT_ANALYSIS_FAILED;
            }
            System.out.println("✓ Analysis complete");
            return 0;

        } catch (ConfigurationException e) {
            log.debug("Invalid configuration", e);
            System.err.println("✗ Invalid configuration: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Analysis failed", e);
            System.err.println("✗ Analysis failed: " + e.getMessage());
            return 1;
        }
    }

    private CodeGuardConfig loadConfig(Path root) {
        if (configFile != null) {
            return ConfigLoader.parse(configFile);
        }
        return ConfigLoader.load(root.resolve(ConfigLoader.DEFAULT_FILE_NAME));
    }

    /**
     * Applies command-line options on top of the file configuration.
     *
     * @param base configuration from the file
     * @return effective configuration
     */
    AnalysisConfig applyOverrides(AnalysisConfig base) {
        AnalysisConfig.Builder builder = base.toBuilder();

        if (agents != null || groups != null) {
            Set<String> selected = new LinkedHashSet<>();
            if (agents != null) {
                agents.stream().map(String::trim).filter(id -> !id.isEmpty()).forEach(selected::add);
            }
            if (groups != null) {
                for (String group : groups) {
                    if (!AnalyzerGroups.GROUPS.containsKey(group.trim())) {
                        throw new ConfigurationException("Unknown analyzer group: " + group
                            + ". Available: " + AnalyzerGroups.getAvailableGroups());
                    }
                }
                selected.addAll(AnalyzerGroups.getAnalyzersForGroups(groups.stream().map(String::trim).toList()));
            }
            builder.enabledAnalyzers(selected);
        }
        if (useLlm != null) {
            builder.useDeepTier(useLlm);
        }
        if (maxConcurrent != null) {
            builder.maxConcurrentTasks(maxConcurrent);
        }
        if (timeoutSeconds != null) {
            if (timeoutSeconds.isNaN() || timeoutSeconds <= 0) {
                throw new ConfigurationException("--timeout must be positive, got " + timeoutSeconds);
            }
            builder.perTaskTimeout(Duration.ofMillis(Math.round(timeoutSeconds * 1000)));
        }
        if (seed != null) {
            builder.randomSeed(seed);
        }
        return builder.build();
    }

    private void render(Report report) {
        ReportRenderer console = ReportRenderers.find("console")
            .orElseThrow(() -> new IllegalStateException("Console renderer not available"));
        console.render(report, new RenderContext(null, Map.of(
            "console.colors", String.valueOf(!noColor),
            "console.maxIssues", String.valueOf(maxIssues))));

        if (outputFile != null) {
            ReportRenderer json = ReportRenderers.find("json")
                .orElseThrow(() -> new IllegalStateException("JSON renderer not available"));
            json.render(report, new RenderContext(outputFile.toString(), Map.of()));
            System.out.println("✓ Wrote report to: " + outputFile.toAbsolutePath());
        }
    }

    private static ProgressObserver progressLogger() {
        return snapshot -> log.debug("Progress {}/{} tasks ({} findings, {} in flight)",
            snapshot.settledTasks(), snapshot.totalTasks(), snapshot.findingsSoFar(), snapshot.inFlightTasks());
    }

    /**
     * Completion candidates for {@code --groups}.
     */
    static class GroupCandidates implements Iterable<String> {
        @Override
        public Iterator<String> iterator() {
            return AnalyzerGroups.getAvailableGroups().iterator();
        }
    }
}
