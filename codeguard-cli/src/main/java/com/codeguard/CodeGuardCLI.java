package com.codeguard;

import com.codeguard.cli.AnalyzeCommand;
import com.codeguard.cli.ListCommand;
import com.codeguard.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for CodeGuard.
 *
 * <p>CodeGuard runs a set of static analyzers over a source tree concurrently and
 * produces a scored, deduplicated quality report.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code analyze} - Analyze a directory and write a report</li>
 *   <li>{@code list} - List available analyzers, groups, or renderers</li>
 *   <li>{@code validate} - Validate a configuration file</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Analyze current directory
 * codeguard analyze
 *
 * # Only security checks, JSON report
 * codeguard analyze src --groups security -o report.json
 *
 * # List available analyzers
 * codeguard list analyzers
 * }</pre>
 */
@Command(
    name = "codeguard",
    mixinStandardHelpOptions = true,
    version = "CodeGuard 1.0.0-SNAPSHOT",
    description = "Concurrent multi-analyzer code quality engine",
    subcommands = {
        AnalyzeCommand.class,
        ListCommand.class,
        ValidateCommand.class
    }
)
public class CodeGuardCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CodeGuardCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("CodeGuard - Concurrent Multi-Analyzer Code Quality Engine");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'codeguard --help' to see available commands");
        System.out.println("Use 'codeguard <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Root log level set to {}", root.getLevel());
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        CodeGuardCLI cli = new CodeGuardCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
