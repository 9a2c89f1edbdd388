package com.mdpress.core.block;

import java.util.List;
import java.util.Objects;

/**
 * An ordered unit of emitted HTML.
 *
 * @param kind block kind
 * @param html rendered HTML, possibly spanning several lines
 */
public record Block(BlockKind kind, String html) {

    public Block {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(html, "html must not be null");
    }

    public List<String> lines() {
        return List.of(html.split("\n", -1));
    }
}
