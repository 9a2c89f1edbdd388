package com.mdpress.core.block;

import com.mdpress.core.html.ElementKind;

/**
 * One open list on the nesting stack.
 *
 * @param indent leading whitespace length of the items in this list
 * @param ordered true for {@code <ol>}, false for {@code <ul>}
 */
public record ListFrame(int indent, boolean ordered) {

    public ListFrame {
        if (indent < 0) {
            throw new IllegalArgumentException("indent must not be negative: " + indent);
        }
    }

    public ElementKind elementKind() {
        return ordered ? ElementKind.ORDERED_LIST : ElementKind.UNORDERED_LIST;
    }
}
