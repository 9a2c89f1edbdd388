package com.mdpress.core.document;

import java.util.Objects;

/**
 * Minimal HTML page used when no template is supplied.
 */
public class DefaultHtmlShell {

    private static final String PAGE = """
        <!DOCTYPE html>
        <html lang="%s">
        <head>
            <meta charset="UTF-8">
            <meta name="viewport" content="width=device-width, initial-scale=1.0">
            <title>%s</title>
        %s</head>
        <body>
            %s
        </body>
        </html>""";

    private final String lang;
    private final String stylesheet;

    /**
     * @param lang value of the {@code lang} attribute
     * @param stylesheet stylesheet href, or null/blank to omit the link element
     */
    public DefaultHtmlShell(String lang, String stylesheet) {
        this.lang = Objects.requireNonNull(lang, "lang must not be null");
        this.stylesheet = stylesheet;
    }

    /**
     * Wraps title and content in the page skeleton.
     *
     * @param title page title
     * @param content body HTML
     * @return complete page
     */
    public String render(String title, String content) {
        String link = stylesheet == null || stylesheet.isBlank()
            ? ""
            : "    <link rel=\"stylesheet\" href=\"" + stylesheet + "\" />\n";
        return PAGE.formatted(lang, title, link, content);
    }
}
