package com.codeguard.core.renderer.impl;

import com.codeguard.core.model.Severity;
import com.codeguard.core.renderer.RenderContext;
import com.codeguard.core.renderer.ReportRenderer;
import com.codeguard.core.report.FileRanking;
import com.codeguard.core.report.Report;
import com.codeguard.core.report.ReportedIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renderer that prints a report summary to the console with optional ANSI colors.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - Enable/disable ANSI colors ("true"/"false", default: "true")</li>
 *   <li>{@code console.maxIssues} - Number of issues listed (default: "20")</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * RenderContext context = new RenderContext(null, Map.of("console.colors", "false"));
 * new ConsoleRenderer().render(report, context);
 * }</pre>
 */
public class ConsoleRenderer implements ReportRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_CYAN = "\u001B[36m";

    private static final String SEPARATOR = "-".repeat(80);
    private static final String DEFAULT_MAX_ISSUES = "20";

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = out;
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(Report report, RenderContext context) {
        boolean useColors = Boolean.parseBoolean(context.getSettingOrDefault("console.colors", "true"));
        int maxIssues = parseMaxIssues(context.getSettingOrDefault("console.maxIssues", DEFAULT_MAX_ISSUES));
        logger.debug("Rendering report to console (colors: {}, max issues: {})", useColors, maxIssues);

        printHeader(report, useColors);
        out.println(SEPARATOR);
        printCounts(report.summary().bySeverity(), useColors);
        out.println(SEPARATOR);
        printIssues(report.issues(), maxIssues, useColors);
        printTopFiles(report.summary().topProblematicFiles(), useColors);
        out.println(SEPARATOR);
        out.println(color(ANSI_BOLD, useColors) + "Recommendations" + reset(useColors));
        report.summary().recommendations().forEach(recommendation -> out.println("  * " + recommendation));
        out.flush();
    }

    private void printHeader(Report report, boolean useColors) {
        String gradeColor = report.summary().overallScore() >= 80 ? ANSI_GREEN
            : report.summary().overallScore() >= 60 ? ANSI_YELLOW : ANSI_RED;
        out.println(color(ANSI_BOLD + ANSI_CYAN, useColors) + "CodeGuard Report" + reset(useColors));
        out.println("Status: " + report.status().toJson()
            + "   Files analyzed: " + report.filesAnalyzed()
            + "   Issues: " + report.totalIssues()
            + "   Duration: " + report.timing().totalDuration() + "s");
        out.println("Score: " + color(ANSI_BOLD + gradeColor, useColors)
            + report.summary().overallScore() + "/100 (" + report.summary().grade() + ")" + reset(useColors));
    }

    private void printCounts(Map<String, Integer> bySeverity, boolean useColors) {
        StringBuilder line = new StringBuilder();
        bySeverity.forEach((severity, count) -> {
            Severity parsed = Severity.fromString(severity);
            line.append(color(severityColor(parsed), useColors))
                .append(severity.toUpperCase(Locale.ROOT)).append(": ").append(count)
                .append(reset(useColors)).append("  ");
        });
        out.println(line.toString().stripTrailing());
    }

    private void printIssues(List<ReportedIssue> issues, int maxIssues, boolean useColors) {
        if (issues.isEmpty()) {
            out.println(color(ANSI_GREEN, useColors) + "No issues found" + reset(useColors));
            return;
        }
        issues.stream().limit(maxIssues).forEach(issue -> out.println(
            color(severityColor(issue.severity()), useColors)
                + String.format("[%-8s]", issue.severity().name()) + reset(useColors)
                + " " + issue.filePath() + (issue.line() == null ? "" : ":" + issue.line())
                + "  " + issue.title() + " (" + issue.analyzer() + ")"));
        if (issues.size() > maxIssues) {
            out.println("  ... and " + (issues.size() - maxIssues) + " more");
        }
    }

    private void printTopFiles(List<FileRanking> topFiles, boolean useColors) {
        if (topFiles.isEmpty()) {
            return;
        }
        out.println(SEPARATOR);
        out.println(color(ANSI_BOLD, useColors) + "Most problematic files" + reset(useColors));
        topFiles.forEach(file -> out.println("  " + file.filePath() + ": " + file.issueCount()
            + " issue(s), worst " + file.highestSeverity().toJson()));
    }

    private static String severityColor(Severity severity) {
        if (severity == null) {
            return "";
        }
        return switch (severity) {
            case CRITICAL, HIGH -> ANSI_RED;
            case MEDIUM -> ANSI_YELLOW;
            case LOW, INFO -> ANSI_CYAN;
        };
    }

    private static String color(String code, boolean useColors) {
        return useColors ? code : "";
    }

    private static String reset(boolean useColors) {
        return useColors ? ANSI_RESET : "";
    }

    private static int parseMaxIssues(String value) {
        try {
            return Math.max(0, Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            logger.warn("Invalid console.maxIssues '{}', using {}", value, DEFAULT_MAX_ISSUES);
            return Integer.parseInt(DEFAULT_MAX_ISSUES);
        }
    }
}
