package com.mdpress.core.block;

/**
 * Kind of a fragment waiting in the paragraph buffer.
 */
public enum FragmentKind {
    HEADER,
    LIST,
    TEXT
}
