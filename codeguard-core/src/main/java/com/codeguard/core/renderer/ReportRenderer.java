package com.codeguard.core.renderer;

import com.codeguard.core.report.Report;

/**
 * Interface for renderers that deliver a {@link Report} to a destination.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI) and can be
 * combined, e.g. print a console summary AND write the JSON file.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class JsonFileRenderer implements ReportRenderer {
 *     @Override
 *     public String getId() {
 *         return "json";
 *     }
 *
 *     @Override
 *     public void render(Report report, RenderContext context) {
 *         ReportWriter.write(report, Path.of(context.outputPath()));
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.codeguard.core.renderer.ReportRenderer}
 *
 * @see RenderContext
 */
public interface ReportRenderer {

    /**
     * Returns unique identifier for this renderer, lowercase (e.g. "json", "console").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders the report.
     *
     * <p>Implementations validate required settings and throw {@link IllegalStateException}
     * if configuration is invalid or the destination cannot be written.
     *
     * @param report report to render
     * @param context rendering context with destination and settings
     * @throws IllegalStateException if required configuration is missing
     */
    void render(Report report, RenderContext context);
}
