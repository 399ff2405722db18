package com.codeguard.cli;

import com.codeguard.core.aggregator.RecommendationPolicy;
import com.codeguard.core.aggregator.ScoringPolicy;
import com.codeguard.core.analyzer.AnalyzerRegistry;
import com.codeguard.core.config.AnalysisConfig;
import com.codeguard.core.config.CodeGuardConfig;
import com.codeguard.core.config.ConfigLoader;
import com.codeguard.core.config.ConfigurationException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to validate a configuration file without running an analysis.
 *
 * <p>Checks that the YAML parses, that numeric settings are in range, that scoring
 * penalties name real severities and that at least one enabled analyzer is installed.
 * Enabled ids with no installed analyzer are reported as warnings.
 */
@Command(
    name = "validate",
    description = "Validate a configuration file",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Config file to validate", defaultValue = ConfigLoader.DEFAULT_FILE_NAME)
    private Path configFile;

    @Override
    public Integer call() {
        log.info("Validating configuration: {}", configFile);
        try {
            CodeGuardConfig config = ConfigLoader.parse(configFile);
            AnalysisConfig analysisConfig = config.toAnalysisConfig();
            ScoringPolicy.from(config.scoring());
            RecommendationPolicy.from(config.scoring());

            AnalyzerRegistry registry = AnalyzerRegistry.discover();
            AnalyzerRegistry.Resolution resolution = registry.resolve(analysisConfig.enabledAnalyzers());
            for (String id : resolution.unknownIds()) {
                System.out.println("⚠ Unknown analyzer: " + id + " (available: " + registry.ids() + ")");
            }
            if (resolution.analyzers().isEmpty()) {
                System.err.println("✗ No installed analyzer is enabled");
                return 1;
            }

            System.out.printf("✓ Configuration is valid: %d analyzers, %d concurrent tasks, %ss timeout%n",
                resolution.analyzers().size(),
                analysisConfig.maxConcurrentTasks(),
                analysisConfig.perTaskTimeout().toMillis() / 1000.0);
            return 0;

        } catch (ConfigurationException e) {
            System.err.println("✗ Invalid configuration: " + e.getMessage());
            return 1;
        }
    }
}
