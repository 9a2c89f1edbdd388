package com.mdpress.core.inline;

import com.mdpress.core.html.ElementKind;
import com.mdpress.core.html.HtmlStyles;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Turns emphasis, image, link and code-span markers of a single line into
 * HTML fragments.
 *
 * <p>Rules run in a fixed order, each as one pass over the output of the
 * previous rule:
 * <ol>
 *   <li>bold {@code **text**}, before italic so single asterisks do not eat bold delimiters</li>
 *   <li>italic {@code *text*}</li>
 *   <li>image {@code ![alt](src)}, before link since it is link syntax prefixed with {@code !}</li>
 *   <li>link {@code [text](url)}</li>
 *   <li>inline code {@code `text`}</li>
 * </ol>
 *
 * <p>Every delimiter pair is matched shortest-first. Nested or overlapping
 * emphasis is not supported and user text is not escaped.
 */
public class InlineFormatter {

    public static final Pattern BOLD = Pattern.compile("\\*\\*(.+?)\\*\\*", Pattern.DOTALL);
    public static final Pattern ITALIC = Pattern.compile("\\*(.+?)\\*", Pattern.DOTALL);
    public static final Pattern IMAGE = Pattern.compile("!\\[(.+?)\\]\\((.+?)\\)", Pattern.DOTALL);
    public static final Pattern LINK = Pattern.compile("\\[(.+?)\\]\\((.+?)\\)", Pattern.DOTALL);
    public static final Pattern INLINE_CODE = Pattern.compile("`(.*?)`", Pattern.DOTALL);

    private final List<InlineRule> rules;

    public InlineFormatter(HtmlStyles styles) {
        Objects.requireNonNull(styles, "styles must not be null");
        this.rules = List.of(
            new InlineRule("bold", BOLD, wrap(styles, ElementKind.STRONG)),
            new InlineRule("italic", ITALIC, wrap(styles, ElementKind.EMPHASIS)),
            new InlineRule("image", IMAGE,
                "<img src=\"$2\" alt=\"$1\"" + styles.attributes(ElementKind.IMAGE) + " />"),
            new InlineRule("link", LINK,
                "<a href=\"$2\"" + styles.attributes(ElementKind.LINK) + ">$1</a>"),
            new InlineRule("inline-code", INLINE_CODE, wrap(styles, ElementKind.INLINE_CODE))
        );
    }

    /**
     * Formats one line.
     *
     * @param line raw line text
     * @return HTML fragment without block-level tags
     */
    public String format(String line) {
        String text = line;
        for (InlineRule rule : rules) {
            text = rule.apply(text);
        }
        return text;
    }

    /**
     * Returns the rules in application order.
     *
     * @return ordered rules
     */
    public List<InlineRule> rules() {
        return rules;
    }

    private static String wrap(HtmlStyles styles, ElementKind kind) {
        return styles.openTag(kind) + "$1" + styles.closeTag(kind);
    }
}
