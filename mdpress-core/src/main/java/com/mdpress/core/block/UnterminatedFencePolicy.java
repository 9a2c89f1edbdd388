package com.mdpress.core.block;

/**
 * What happens to code buffered after an opening fence that is never closed.
 */
public enum UnterminatedFencePolicy {
    /** Drop the buffered lines. */
    DISCARD,
    /** Emit the buffered lines as a code block at end of input. */
    FLUSH
}
