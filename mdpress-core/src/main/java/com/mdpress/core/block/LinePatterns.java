package com.mdpress.core.block;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared line-classification patterns for the block segmenter.
 *
 * <p>Patterns are compiled once and matched against whole lines. Lines are
 * split on {@code \n} only, so {@code .} must also match the other line
 * separators ({@link Pattern#DOTALL}).
 */
public final class LinePatterns {

    public static final String FENCE = "```";

    public static final Pattern HEADER_PATTERN =
        Pattern.compile("^(#{1,6})\\s(.+)$", Pattern.DOTALL);

    public static final Pattern UNORDERED_ITEM_PATTERN =
        Pattern.compile("^(\\s*)[-*]\\s(.+)$", Pattern.DOTALL);

    public static final Pattern ORDERED_ITEM_PATTERN =
        Pattern.compile("^(\\s*)(\\d+)\\.\\s(.+)$", Pattern.DOTALL);

    private LinePatterns() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * A header line.
     *
     * @param level number of leading hashes (1-6)
     * @param text header text, not yet inline formatted
     */
    public record HeaderLine(int level, String text) {}

    /**
     * A list item line.
     *
     * @param indent raw leading whitespace length, tabs count as one
     * @param ordered true for {@code N.} markers, false for {@code -} and {@code *}
     * @param content item text, not yet inline formatted
     */
    public record ListItemLine(int indent, boolean ordered, String content) {}

    /**
     * Returns true if the trimmed line starts with a fence delimiter.
     *
     * @param line raw line
     * @return true for fence boundaries
     */
    public static boolean isFence(String line) {
        return line.strip().startsWith(FENCE);
    }

    /**
     * Extracts the language tag of an opening fence line.
     *
     * @param line raw fence line
     * @return trimmed text after the delimiter, empty if absent
     */
    public static String fenceLanguage(String line) {
        return line.strip().substring(FENCE.length()).trim();
    }

    public static Optional<HeaderLine> matchHeader(String line) {
        Matcher matcher = HEADER_PATTERN.matcher(line);
        if (matcher.matches()) {
            return Optional.of(new HeaderLine(matcher.group(1).length(), matcher.group(2)));
        }
        return Optional.empty();
    }

    /**
     * Matches an unordered or ordered list item; unordered markers win.
     *
     * @param line raw line
     * @return list item, or empty for any other line
     */
    public static Optional<ListItemLine> matchListItem(String line) {
        Matcher unordered = UNORDERED_ITEM_PATTERN.matcher(line);
        if (unordered.matches()) {
            return Optional.of(new ListItemLine(unordered.group(1).length(), false, unordered.group(2)));
        }
        Matcher ordered = ORDERED_ITEM_PATTERN.matcher(line);
        if (ordered.matches()) {
            return Optional.of(new ListItemLine(ordered.group(1).length(), true, ordered.group(3)));
        }
        return Optional.empty();
    }

    public static boolean isListItem(String line) {
        return matchListItem(line).isPresent();
    }
}
