package com.codeguard.core.renderer.impl;

import com.codeguard.core.aggregator.ResultAggregator;
import com.codeguard.core.model.AnalyzerResult;
import com.codeguard.core.model.Outcome;
import com.codeguard.core.renderer.RenderContext;
import com.codeguard.core.report.Report;
import com.codeguard.core.report.ReportWriter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link JsonFileRenderer}.
 */
class JsonFileRendererTest {

    @TempDir
    Path tempDir;

    private final JsonFileRenderer renderer = new JsonFileRenderer();

    @Test
    void render_withOutputPath_writesReport() throws IOException {
        // Given
        Report report = emptyReport();
        Path target = tempDir.resolve("out/report.json");

        // When
        renderer.render(report, new RenderContext(target.toString(), Map.of()));

        // Then
        assertThat(target).exists();
        assertThat(ReportWriter.fromJson(Files.readString(target)).summary().grade()).isEqualTo("A+");
    }

    @Test
    void render_withoutOutputPath_throwsException() {
        assertThatThrownBy(() -> renderer.render(emptyReport(), new RenderContext(" ", Map.of())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("output path");
    }

    private static Report emptyReport() {
        return new ResultAggregator().aggregate(List.of(
            Outcome.completed("security", "a.py", AnalyzerResult.empty(), Duration.ofMillis(10))));
    }
}
