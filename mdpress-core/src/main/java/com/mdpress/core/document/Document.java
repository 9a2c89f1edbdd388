package com.mdpress.core.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A converted document ready for templating.
 *
 * @param title document title
 * @param metadata front-matter metadata as written by the author
 * @param content joined HTML body, byline included
 */
public record Document(
    String title,
    Map<String, String> metadata,
    String content
) {
    /**
     * Compact constructor with validation.
     */
    public Document {
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(content, "content must not be null");
        metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
