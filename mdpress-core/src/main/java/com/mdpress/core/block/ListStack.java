package com.mdpress.core.block;

import com.mdpress.core.html.HtmlStyles;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Stack of open lists with strictly increasing indent from bottom to top.
 *
 * <p>Not thread-safe. A new stack is created for every conversion so no
 * frame can leak from one document into the next.
 *
 * <p><b>Transitions for an item at indent {@code n}:</b>
 * <ul>
 *   <li>frames deeper than {@code n} are popped and closed</li>
 *   <li>if the stack is empty or the top is shallower than {@code n}, a frame is pushed and opened</li>
 *   <li>if the top sits exactly at {@code n} the item joins it, keeping that frame's ordered flag
 *       even when the item uses the other marker type</li>
 * </ul>
 */
public class ListStack {

    private final Deque<ListFrame> frames = new ArrayDeque<>();
    private final HtmlStyles styles;

    public ListStack(HtmlStyles styles) {
        this.styles = Objects.requireNonNull(styles, "styles must not be null");
    }

    /**
     * Moves the stack to accept an item at the given indent.
     *
     * @param indent raw leading whitespace length of the item
     * @param ordered whether the item uses an ordered marker
     * @return tags to emit before the item
     */
    public ListTransition enter(int indent, boolean ordered) {
        List<String> closing = new ArrayList<>();
        while (!frames.isEmpty() && frames.peek().indent() > indent) {
            closing.add(close(frames.pop()));
        }

        String opening = null;
        if (frames.isEmpty() || frames.peek().indent() < indent) {
            ListFrame frame = new ListFrame(indent, ordered);
            frames.push(frame);
            opening = styles.openTag(frame.elementKind());
        }
        return new ListTransition(closing, opening);
    }

    /**
     * Pops every open frame.
     *
     * @return closing tags, innermost first; empty if nothing was open
     */
    public List<String> closeAll() {
        List<String> closing = new ArrayList<>();
        while (!frames.isEmpty()) {
            closing.add(close(frames.pop()));
        }
        return closing;
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    public int depth() {
        return frames.size();
    }

    public Optional<ListFrame> top() {
        return Optional.ofNullable(frames.peek());
    }

    private String close(ListFrame frame) {
        return styles.closeTag(frame.elementKind());
    }
}
