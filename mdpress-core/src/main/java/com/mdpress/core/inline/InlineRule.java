package com.mdpress.core.inline;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One inline substitution: every non-overlapping match of {@code pattern}
 * in a line is replaced, left to right, by {@code replacement}.
 *
 * <p>Patterns should be compiled with {@link Pattern#DOTALL} so that a
 * delimited span may contain any character, line separators included.
 *
 * <p>The replacement uses {@link java.util.regex.Matcher} group references
 * ({@code $1}, {@code $2}). Captured text is inserted as is.
 *
 * @param name rule name, exposed through {@link InlineFormatter#rules()}
 * @param pattern delimiter pattern with reluctant capture groups
 * @param replacement replacement template
 */
public record InlineRule(
    String name,
    Pattern pattern,
    String replacement
) {
    /**
     * Compact constructor with validation.
     */
    public InlineRule {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(pattern, "pattern must not be null");
        Objects.requireNonNull(replacement, "replacement must not be null");
    }

    /**
     * Applies this rule in a single pass.
     *
     * @param text current state of the line
     * @return text with all matches replaced
     */
    public String apply(String text) {
        return pattern.matcher(text).replaceAll(replacement);
    }
}
