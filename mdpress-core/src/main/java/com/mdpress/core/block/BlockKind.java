package com.mdpress.core.block;

/**
 * Kind of an emitted block.
 */
public enum BlockKind {
    HEADER,
    PARAGRAPH,
    LIST,
    CODE,
    BYLINE
}
