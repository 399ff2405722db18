package com.codeguard.core.renderer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Discovers {@link ReportRenderer} implementations via {@link ServiceLoader}.
 *
 * @since 1.0.0
 */
public final class ReportRenderers {

    private static final Logger log = LoggerFactory.getLogger(ReportRenderers.class);

    private ReportRenderers() {
    }

    /**
     * @return discovered renderers sorted by id
     */
    public static List<ReportRenderer> discover() {
        List<ReportRenderer> renderers = new ArrayList<>();
        ServiceLoader.load(ReportRenderer.class).forEach(renderers::add);
        renderers.sort(Comparator.comparing(ReportRenderer::getId));
        log.debug("Discovered {} renderers", renderers.size());
        return renderers;
    }

    /**
     * @param id renderer id
     * @return the renderer with that id
     */
    public static Optional<ReportRenderer> find(String id) {
        return discover().stream()
            .filter(renderer -> renderer.getId().equals(id))
            .findFirst();
    }
}
