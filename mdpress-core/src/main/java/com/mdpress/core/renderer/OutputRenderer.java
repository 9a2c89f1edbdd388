package com.mdpress.core.renderer;

/**
 * Writes a rendered page to a destination.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI).
 * Register implementations in
 * {@code META-INF/services/com.mdpress.core.renderer.OutputRenderer}.
 *
 * @see OutputRenderers
 */
public interface OutputRenderer {

    /**
     * Returns the unique, lowercase identifier of this renderer
     * (e.g. "filesystem", "console").
     *
     * @return renderer identifier
     */
    String getId();

    /**
     * Writes the page.
     *
     * <p>Implementations must not leave a partially written destination behind
     * when they fail.
     *
     * @param document page to write
     * @param context destination and settings
     * @throws IllegalStateException if the page cannot be written
     */
    void render(RenderedDocument document, RenderContext context);
}
