package com.codeguard.cli;

import com.codeguard.CodeGuardCLI;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ValidateCommand}.
 */
class ValidateCommandTest {

    @TempDir
    Path tempDir;

    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    void captureOutput() {
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void validate_validConfig_returnsZero() throws IOException {
        Path config = write("""
            analysis:
              enabled_groups: [security]
              max_concurrent_files: 4
              timeout_per_file: 12
            scoring:
              penalties:
                high: 10
            """);

        int exitCode = CodeGuardCLI.commandLine().execute("-q", "validate", config.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8))
            .contains("✓ Configuration is valid: 2 analyzers, 4 concurrent tasks, 12.0s timeout");
    }

    @Test
    void validate_someUnknownAnalyzers_warnsAndReturnsZero() throws IOException {
        Path config = write("""
            analysis:
              enabled_agents: [security, linting]
            """);

        int exitCode = CodeGuardCLI.commandLine().execute("-q", "validate", config.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("⚠ Unknown analyzer: linting");
    }

    @Test
    void validate_onlyUnknownAnalyzers_returnsOne() throws IOException {
        Path config = write("""
            analysis:
              enabled_agents: [linting]
            """);

        int exitCode = CodeGuardCLI.commandLine().execute("-q", "validate", config.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("No installed analyzer is enabled");
    }

    @Test
    void validate_invalidScoring_returnsOne() throws IOException {
        Path config = write("""
            scoring:
              penalties:
                blocker: 50
            """);

        int exitCode = CodeGuardCLI.commandLine().execute("-q", "validate", config.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("blocker");
    }

    @Test
    void validate_missingFile_returnsOne() {
        int exitCode = CodeGuardCLI.commandLine().execute("-q", "validate", tempDir.resolve("none.yaml").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("not found");
    }

    private Path write(String yaml) throws IOException {
        Path config = tempDir.resolve("codeguard.yaml");
        Files.writeString(config, yaml);
        return config;
    }
}
