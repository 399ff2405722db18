package com.codeguard.core.renderer.impl;

import com.codeguard.core.renderer.RenderContext;
import com.codeguard.core.renderer.ReportRenderer;
import com.codeguard.core.report.Report;
import com.codeguard.core.report.ReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Renderer that writes the report as pretty-printed JSON.
 *
 * <p><b>Configuration:</b>
 * <ul>
 *   <li>{@code outputPath} - Target file (from RenderContext), parent directories are created</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * new JsonFileRenderer().render(report, new RenderContext("build/codeguard-report.json", Map.of()));
 * }</pre>
 */
public class JsonFileRenderer implements ReportRenderer {

    private static final Logger logger = LoggerFactory.getLogger(JsonFileRenderer.class);

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public void render(Report report, RenderContext context) {
        if (context.outputPath() == null || context.outputPath().isBlank()) {
            throw new IllegalStateException("JSON renderer requires an output path");
        }
        Path target = Path.of(context.outputPath());
        try {
            ReportWriter.write(report, target);
            logger.info("Wrote report with {} issues to {}", report.totalIssues(), target);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write report: " + target, e);
        }
    }
}
