package com.mdpress.core.block;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Tags emitted when a list item moves the nesting stack.
 *
 * @param closingTags closing tags of popped frames, innermost first
 * @param openingTag opening tag of a pushed frame, or null when the item
 *                   continues the current list
 */
public record ListTransition(
    List<String> closingTags,
    String openingTag
) {
    public ListTransition {
        Objects.requireNonNull(closingTags, "closingTags must not be null");
        closingTags = List.copyOf(closingTags);
    }

    public boolean opened() {
        return openingTag != null;
    }

    /**
     * Returns true if the emission begins with an opening tag, i.e. a frame
     * was pushed without any frame being popped first.
     *
     * @return true when a fresh list starts
     */
    public boolean startsNewList() {
        return closingTags.isEmpty() && openingTag != null;
    }

    /**
     * Returns closing tags followed by the opening tag, in emission order.
     *
     * @return all tags of this transition
     */
    public List<String> tags() {
        List<String> tags = new ArrayList<>(closingTags);
        if (openingTag != null) {
            tags.add(openingTag);
        }
        return tags;
    }
}
