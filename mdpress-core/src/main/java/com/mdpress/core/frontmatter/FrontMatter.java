package com.mdpress.core.frontmatter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of front-matter extraction.
 *
 * @param metadata parsed key/value pairs in source order, last duplicate wins
 * @param body text following the closing delimiter, or the whole input when
 *             no front matter is present
 */
public record FrontMatter(
    Map<String, String> metadata,
    String body
) {
    /**
     * Compact constructor with validation.
     */
    public FrontMatter {
        Objects.requireNonNull(body, "body must not be null");
        metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Creates a result for input without front matter.
     *
     * @param body the entire input
     * @return result with empty metadata
     */
    public static FrontMatter none(String body) {
        return new FrontMatter(Map.of(), body);
    }

    public boolean hasMetadata() {
        return !metadata.isEmpty();
    }
}
