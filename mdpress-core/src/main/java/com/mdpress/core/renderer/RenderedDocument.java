package com.mdpress.core.renderer;

import java.util.Objects;

/**
 * A fully rendered HTML page waiting to be written.
 *
 * @param title page title, used in logs
 * @param html complete page
 */
public record RenderedDocument(
    String title,
    String html
) {
    /**
     * Compact constructor with validation.
     */
    public RenderedDocument {
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(html, "html must not be null");
    }
}
