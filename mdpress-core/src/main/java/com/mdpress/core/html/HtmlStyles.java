package com.mdpress.core.html;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Static lookup table from {@link ElementKind} to the attribute string rendered
 * inside its opening tag.
 *
 * <p>Tables are assembled once at class loading time. Attribute strings carry
 * their own leading space, so {@code "<p" + attributes(PARAGRAPH) + ">"} is
 * always well formed, including for the {@link StyleProfile#PLAIN} profile
 * where every attribute string is empty.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * HtmlStyles styles = HtmlStyles.of(StyleProfile.TAILWIND);
 * String open = styles.openTag(ElementKind.PARAGRAPH);
 * // <p class="mb-5 text-justify">
 * }</pre>
 */
public final class HtmlStyles {

    private static final String HEADING_COMMON = "text-red-900 mb-5 font-black uppercase";
    private static final String BYLINE_TEXT_CLASSES = "text-xs text-slate-500";

    private static final Map<StyleProfile, HtmlStyles> PROFILES = buildProfiles();

    private final StyleProfile profile;
    private final Map<ElementKind, String> attributes;

    private HtmlStyles(StyleProfile profile, Map<ElementKind, String> attributes) {
        this.profile = profile;
        this.attributes = Collections.unmodifiableMap(attributes);
    }

    /**
     * Returns the shared lookup table for a profile.
     *
     * @param profile style profile
     * @return attribute table
     */
    public static HtmlStyles of(StyleProfile profile) {
        Objects.requireNonNull(profile, "profile must not be null");
        return PROFILES.get(profile);
    }

    public StyleProfile profile() {
        return profile;
    }

    /**
     * Returns the attribute string for an element kind, including its leading
     * space, or an empty string when the profile has none.
     *
     * @param kind element kind
     * @return attribute string
     */
    public String attributes(ElementKind kind) {
        return attributes.getOrDefault(kind, "");
    }

    /**
     * Renders the opening tag of an element kind.
     *
     * @param kind element kind (not a heading; use {@link #openHeading(int)})
     * @return opening tag
     */
    public String openTag(ElementKind kind) {
        return "<" + kind.tagName() + attributes(kind) + ">";
    }

    /**
     * Renders the closing tag of an element kind.
     *
     * @param kind element kind (not a heading; use {@link #closeHeading(int)})
     * @return closing tag
     */
    public String closeTag(ElementKind kind) {
        return "</" + kind.tagName() + ">";
    }

    public String openHeading(int level) {
        return "<h" + level + attributes(ElementKind.forHeading(level)) + ">";
    }

    public String closeHeading(int level) {
        return "</h" + level + ">";
    }

    /**
     * Renders the opening {@code code} tag of a fenced block. A non-empty
     * language adds a {@code language-<tag>} class.
     *
     * @param language fence language tag, possibly empty
     * @return opening tag
     */
    public String openCodeBody(String language) {
        String languageClass = language.isEmpty() ? "" : classes("language-" + language);
        return "<" + ElementKind.CODE_BLOCK_BODY.tagName() + attributes(ElementKind.CODE_BLOCK_BODY) + languageClass + ">";
    }

    /**
     * Returns true if this profile renders code blocks with nested indentation.
     *
     * @return true for the Tailwind profile
     */
    public boolean indentsCodeBlocks() {
        return profile == StyleProfile.TAILWIND;
    }

    private static Map<StyleProfile, HtmlStyles> buildProfiles() {
        Map<StyleProfile, HtmlStyles> profiles = new EnumMap<>(StyleProfile.class);
        profiles.put(StyleProfile.PLAIN, new HtmlStyles(StyleProfile.PLAIN, new EnumMap<>(ElementKind.class)));

        Map<ElementKind, String> tailwind = new EnumMap<>(ElementKind.class);
        tailwind.put(ElementKind.HEADING_1, classes("text-6xl " + HEADING_COMMON));
        tailwind.put(ElementKind.HEADING_2, classes("text-4xl " + HEADING_COMMON));
        tailwind.put(ElementKind.HEADING_MINOR, classes("text-2xl " + HEADING_COMMON));
        tailwind.put(ElementKind.PARAGRAPH, classes("mb-5 text-justify"));
        tailwind.put(ElementKind.UNORDERED_LIST, classes("list-disc list-inside"));
        tailwind.put(ElementKind.ORDERED_LIST, classes("list-decimal list-inside"));
        tailwind.put(ElementKind.STRONG, classes("font-bold"));
        tailwind.put(ElementKind.EMPHASIS, classes("italic"));
        tailwind.put(ElementKind.LINK, classes("underline"));
        tailwind.put(ElementKind.INLINE_CODE, classes("bg-slate-300"));
        tailwind.put(ElementKind.BYLINE, classes("flex flex-row justify-between mb-5"));
        tailwind.put(ElementKind.BYLINE_DATES, classes("flex flex-row gap-x-4"));
        tailwind.put(ElementKind.BYLINE_TEXT, classes(BYLINE_TEXT_CLASSES));
        profiles.put(StyleProfile.TAILWIND, new HtmlStyles(StyleProfile.TAILWIND, tailwind));

        return profiles;
    }

    private static String classes(String value) {
        return " class=\"" + value + "\"";
    }
}
