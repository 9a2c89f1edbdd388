package com.mdpress.core.document;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * User-supplied HTML page with literal placeholders.
 *
 * <p>Recognized tokens are {@code {{title}}}, {@code {{content}}} and
 * {@code {{<key>}}} for every metadata key. Substitution is plain textual
 * replacement of every occurrence; there is no escaping, no conditionals and
 * no loops. A template without {@code {{content}}} is rejected when it is
 * created.
 */
public final class HtmlTemplate {

    public static final String TITLE_PLACEHOLDER = "{{title}}";
    public static final String CONTENT_PLACEHOLDER = "{{content}}";

    private final String source;
    private final String text;

    private HtmlTemplate(String source, String text) {
        this.source = source;
        this.text = text;
    }

    /**
     * Creates a template from text.
     *
     * @param source where the text came from, for error messages
     * @param text template text
     * @return validated template
     * @throws InvalidTemplateException if the content placeholder is missing
     */
    public static HtmlTemplate of(String source, String text) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(text, "text must not be null");
        if (!text.contains(CONTENT_PLACEHOLDER)) {
            throw new InvalidTemplateException(
                "Template " + source + " must contain " + CONTENT_PLACEHOLDER + " mark in the body");
        }
        return new HtmlTemplate(source, text);
    }

    /**
     * Reads and validates a UTF-8 template file.
     *
     * @param path template path
     * @return validated template
     * @throws IOException if the file cannot be read
     * @throws InvalidTemplateException if the content placeholder is missing
     */
    public static HtmlTemplate load(Path path) throws IOException {
        return of(path.toString(), Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * Fills the template. The title goes first, then each metadata key, and
     * the content last so body text is never treated as placeholders.
     *
     * @param title document title
     * @param metadata author-supplied metadata
     * @param content document body
     * @return final page
     */
    public String apply(String title, Map<String, String> metadata, String content) {
        String result = text.replace(TITLE_PLACEHOLDER, title);
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            result = result.replace("{{" + entry.getKey() + "}}", entry.getValue());
        }
        return result.replace(CONTENT_PLACEHOLDER, content);
    }

    public String source() {
        return source;
    }

    public String text() {
        return text;
    }

    /**
     * Exception thrown when a template lacks the content placeholder.
     */
    public static class InvalidTemplateException extends IllegalArgumentException {
        public InvalidTemplateException(String message) {
            super(message);
        }
    }
}
