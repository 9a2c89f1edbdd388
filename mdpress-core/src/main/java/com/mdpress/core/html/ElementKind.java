package com.mdpress.core.html;

/**
 * Kinds of HTML elements the converter emits.
 *
 * <p>Each kind maps to one tag name and, per {@link StyleProfile}, to one
 * attribute string held in {@link HtmlStyles}.
 */
public enum ElementKind {
    HEADING_1("h1"),
    HEADING_2("h2"),
    HEADING_MINOR("h"),
    PARAGRAPH("p"),
    UNORDERED_LIST("ul"),
    ORDERED_LIST("ol"),
    LIST_ITEM("li"),
    STRONG("strong"),
    EMPHASIS("em"),
    LINK("a"),
    IMAGE("img"),
    INLINE_CODE("code"),
    CODE_BLOCK("pre"),
    CODE_BLOCK_BODY("code"),
    BYLINE("section"),
    BYLINE_DATES("section"),
    BYLINE_TEXT("p");

    private final String tagName;

    ElementKind(String tagName) {
        this.tagName = tagName;
    }

    /**
     * Returns the tag name; for {@link #HEADING_MINOR} this is the bare
     * {@code h} prefix and callers append the level.
     *
     * @return tag name
     */
    public String tagName() {
        return tagName;
    }

    /**
     * Maps a header level (1-6) to its element kind.
     *
     * @param level header level
     * @return element kind for the level
     */
    public static ElementKind forHeading(int level) {
        return switch (level) {
            case 1 -> HEADING_1;
            case 2 -> HEADING_2;
            default -> HEADING_MINOR;
        };
    }
}
