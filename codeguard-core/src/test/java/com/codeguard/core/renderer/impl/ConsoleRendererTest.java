package com.codeguard.core.renderer.impl;

import com.codeguard.core.aggregator.ResultAggregator;
import com.codeguard.core.model.AnalyzerResult;
import com.codeguard.core.model.Finding;
import com.codeguard.core.model.Outcome;
import com.codeguard.core.model.Severity;
import com.codeguard.core.renderer.RenderContext;
import com.codeguard.core.renderer.ReportRenderer;
import com.codeguard.core.renderer.ReportRenderers;
import com.codeguard.core.report.Report;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest {

    private ByteArrayOutputStream buffer;
    private ConsoleRenderer renderer;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        renderer = new ConsoleRenderer(new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @Test
    void render_withIssues_printsScoreIssuesAndRecommendations() {
        // Given
        Report report = report(3);

        // When
        renderer.render(report, new RenderContext(null, Map.of("console.colors", "false")));

        // Then
        String output = output();
        assertThat(output)
            .contains("CodeGuard Report")
            .contains("Files analyzed: 1")
            .contains("Score: 76/100 (C)")
            .contains("CRITICAL: 0  HIGH: 3  MEDIUM: 0  LOW: 0  INFO: 0")
            .contains("[HIGH    ] src/app.py:1  Issue 0 (security)")
            .contains("Most problematic files")
            .contains("src/app.py: 3 issue(s), worst high")
            .contains("* HIGH PRIORITY: Fix 3 high-severity issue(s)")
            .doesNotContain("\u001B[");
    }

    @Test
    void render_withIssueLimit_summarizesTheRest() {
        // When
        renderer.render(report(5), new RenderContext(null, Map.of("console.colors", "false", "console.maxIssues", "2")));

        // Then
        assertThat(output()).contains("Issue 0").contains("Issue 1").doesNotContain("Issue 2 ")
            .contains("... and 3 more");
    }

    @Test
    void render_withoutIssues_saysSo() {
        // When
        renderer.render(report(0), new RenderContext(null, Map.of("console.colors", "false")));

        // Then
        assertThat(output()).contains("No issues found").doesNotContain("Most problematic files");
    }

    @Test
    void render_withColorsByDefault_emitsAnsiCodes() {
        // When
        renderer.render(report(1), new RenderContext(null, null));

        // Then
        assertThat(output()).contains("\u001B[31m");
    }

    @Test
    void render_withInvalidIssueLimit_usesDefault() {
        // When
        renderer.render(report(1), new RenderContext(null, Map.of("console.colors", "false", "console.maxIssues", "many")));

        // Then
        assertThat(output()).contains("Issue 0");
    }

    @Test
    void discover_findsBuiltInRenderers() {
        assertThat(ReportRenderers.discover()).extracting(ReportRenderer::getId).containsExactly("console", "json");
        assertThat(ReportRenderers.find("json")).get().isInstanceOf(JsonFileRenderer.class);
        assertThat(ReportRenderers.find("html")).isEmpty();
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static Report report(int issueCount) {
        List<Finding> findings = new ArrayList<>();
        for (int i = 0; i < issueCount; i++) {
            findings.add(Finding.builder()
                .title("Issue " + i).severity(Severity.HIGH).category("security")
                .filePath("src/app.py").line(1 + i * 10)
                .build());
        }
        return new ResultAggregator().aggregate(List.of(
            Outcome.completed("security", "src/app.py", AnalyzerResult.of(findings), Duration.ofMillis(50))));
    }
}
