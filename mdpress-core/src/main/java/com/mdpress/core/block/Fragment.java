package com.mdpress.core.block;

import java.util.Objects;

/**
 * Rendered HTML for one source line, tagged with what it is so the buffer
 * never has to guess from the markup.
 *
 * @param kind fragment kind
 * @param html rendered HTML
 */
public record Fragment(FragmentKind kind, String html) {

    public Fragment {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(html, "html must not be null");
    }
}
