package com.mdpress.core.frontmatter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Strips an optional leading {@code ---} delimited metadata block.
 *
 * <p>The block is recognized only at offset zero: the first line must be
 * {@code ---} (trailing whitespace allowed), followed by {@code key: value}
 * lines and a closing {@code ---} line. A triple dash anywhere else is
 * ordinary body text, and an opening delimiter without a closing one leaves
 * the input untouched.
 *
 * <p>Each metadata line is split on its first colon. Key and value are
 * trimmed and one matching pair of single or double quotes around the value
 * is removed. Lines without a colon are skipped.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * FrontMatter fm = FrontMatterExtractor.extract("---\ntitle: Foo\n---\nBody");
 * fm.metadata(); // {title=Foo}
 * fm.body();     // "Body"
 * }</pre>
 */
public final class FrontMatterExtractor {

    private static final Logger log = LoggerFactory.getLogger(FrontMatterExtractor.class);

    public static final String DELIMITER = "---";

    private FrontMatterExtractor() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Extracts front matter from a document.
     *
     * @param text full document text with LF line endings
     * @return metadata and remaining body
     */
    public static FrontMatter extract(String text) {
        if (text == null || text.isEmpty()) {
            return FrontMatter.none(text == null ? "" : text);
        }

        int firstLineEnd = text.indexOf('\n');
        if (firstLineEnd < 0 || !isDelimiter(text.substring(0, firstLineEnd))) {
            return FrontMatter.none(text);
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        int lineStart = firstLineEnd + 1;
        while (lineStart <= text.length()) {
            int lineEnd = text.indexOf('\n', lineStart);
            int end = lineEnd < 0 ? text.length() : lineEnd;
            String line = text.substring(lineStart, end);

            if (isDelimiter(line)) {
                String body = lineEnd < 0 ? "" : text.substring(lineEnd + 1);
                log.debug("Parsed {} front matter entries", metadata.size());
                return new FrontMatter(metadata, body);
            }
            parseEntry(line, metadata);

            if (lineEnd < 0) {
                break;
            }
            lineStart = lineEnd + 1;
        }

        log.debug("Opening front matter delimiter without a closing one; treating input as body");
        return FrontMatter.none(text);
    }

    private static boolean isDelimiter(String line) {
        return line.stripTrailing().equals(DELIMITER);
    }

    private static void parseEntry(String line, Map<String, String> metadata) {
        int colon = line.indexOf(':');
        if (colon < 0) {
            return;
        }
        String key = line.substring(0, colon).trim();
        String value = unquote(line.substring(colon + 1).trim());
        metadata.put(key, value);
    }

    /**
     * Removes one matching pair of surrounding single or double quotes.
     *
     * @param value trimmed value
     * @return value without the quotes
     */
    static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }
}
