package com.mdpress.core.renderer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Looks up {@link OutputRenderer} implementations through {@link ServiceLoader}.
 */
public final class OutputRenderers {

    private static final Logger log = LoggerFactory.getLogger(OutputRenderers.class);

    public static final String FILESYSTEM = "filesystem";
    public static final String CONSOLE = "console";

    private OutputRenderers() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Discovers all registered renderers.
     *
     * @return renderers in discovery order
     */
    public static List<OutputRenderer> discover() {
        List<OutputRenderer> renderers = new ArrayList<>();
        ServiceLoader.load(OutputRenderer.class).forEach(renderers::add);
        log.debug("Discovered {} output renderers", renderers.size());
        return renderers;
    }

    /**
     * Finds a renderer by identifier.
     *
     * @param id renderer identifier
     * @return the renderer
     * @throws IllegalStateException if no renderer has that identifier
     */
    public static OutputRenderer find(String id) {
        return discover().stream()
            .filter(r -> id.equals(r.getId()))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Output renderer not found: " + id));
    }
}
