package com.codeguard.cli;

import com.codeguard.core.analyzer.Analyzer;
import com.codeguard.core.analyzer.AnalyzerRegistry;
import com.codeguard.core.config.AnalyzerGroups;
import com.codeguard.core.renderer.ReportRenderer;
import com.codeguard.core.renderer.ReportRenderers;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list available analyzers, analyzer groups, or renderers.
 *
 * <p>Analyzers and renderers are discovered via the Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # List all analyzers
 * codeguard list analyzers
 *
 * # List analyzer groups usable with --groups and enabled_groups
 * codeguard list groups
 *
 * # List all renderers
 * codeguard list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available analyzers, groups, or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: analyzers, groups, or renderers"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "analyzers", "analyzer", "agents" -> listAnalyzers();
            case "groups", "group" -> listGroups();
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: analyzers, groups, or renderers", type);
                yield 1;
            }
        };
    }

    private int listAnalyzers() {
        System.out.println("Available Analyzers:");
        System.out.println();

        AnalyzerRegistry registry = AnalyzerRegistry.discover();
        if (registry.isEmpty()) {
            System.out.println("  No analyzers found.");
            return 0;
        }

        for (Analyzer analyzer : registry.all()) {
            System.out.printf("  • %s (ID: %s)%n", analyzer.getDisplayName(), analyzer.getId());
            System.out.printf("    %s%n", analyzer.getDescription());
            if (!analyzer.getSupportedLanguages().isEmpty()) {
                System.out.printf("    Languages: %s%n", analyzer.getSupportedLanguages().stream().sorted().toList());
            }
            if (!analyzer.getSupportedFilePatterns().isEmpty()) {
                System.out.printf("    Files: %s%n", analyzer.getSupportedFilePatterns().stream().sorted().toList());
            }
            System.out.println();
        }
        return 0;
    }

    private int listGroups() {
        System.out.println("Available Groups:");
        System.out.println();

        for (String group : AnalyzerGroups.getAvailableGroups()) {
            System.out.printf("  • %s: %s%n", group, String.join(", ", AnalyzerGroups.GROUPS.get(group)));
        }
        return 0;
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        List<ReportRenderer> renderers = ReportRenderers.discover();
        if (renderers.isEmpty()) {
            System.out.println("  No renderers found.");
        }
        for (ReportRenderer renderer : renderers) {
            System.out.printf("  • %s%n", renderer.getId());
        }
        return 0;
    }
}
