package com.mdpress.core.document;

import com.mdpress.core.block.Block;
import com.mdpress.core.block.BlockKind;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Indents block lines for the document body.
 *
 * <p>List-item lines ({@code <li}, {@code </li>}) get four spaces, every
 * other line two. Code blocks are shifted uniformly so their content keeps
 * its relative layout, and bylines are emitted as is.
 */
public class BlockFormatter {

    static final String INDENT = "  ";
    static final String ITEM_INDENT = "    ";

    /**
     * Formats one block.
     *
     * @param block block to format
     * @return indented HTML
     */
    public String format(Block block) {
        if (block.kind() == BlockKind.BYLINE) {
            return block.html();
        }
        return block.lines().stream()
            .map(line -> indentFor(block.kind(), line) + line)
            .collect(Collectors.joining("\n"));
    }

    /**
     * Formats and newline-joins blocks in order.
     *
     * @param blocks blocks to join
     * @return document body
     */
    public String join(List<Block> blocks) {
        return blocks.stream()
            .map(this::format)
            .collect(Collectors.joining("\n"));
    }

    private static String indentFor(BlockKind kind, String line) {
        if (kind != BlockKind.CODE && (line.startsWith("<li") || line.startsWith("</li>"))) {
            return ITEM_INDENT;
        }
        return INDENT;
    }
}
