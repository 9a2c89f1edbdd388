package com.mdpress.core.inline;

import com.mdpress.core.html.HtmlStyles;
import com.mdpress.core.html.StyleProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link InlineFormatter}.
 */
class InlineFormatterTest {

    private InlineFormatter formatter;

    @BeforeEach
    void setUp() {
        formatter = new InlineFormatter(HtmlStyles.of(StyleProfile.PLAIN));
    }

    @Test
    void rules_areAppliedInFixedOrder() {
        assertThat(formatter.rules())
            .extracting(InlineRule::name)
            .containsExactly("bold", "italic", "image", "link", "inline-code");
    }

    @Test
    void format_bold_wrapsInStrong() {
        assertThat(formatter.format("Hello **world**")).isEqualTo("Hello <strong>world</strong>");
    }

    @Test
    void format_italic_wrapsInEm() {
        assertThat(formatter.format("an *important* word")).isEqualTo("an <em>important</em> word");
    }

    @Test
    void format_boldAndItalic_boldDelimitersAreNotTakenByItalic() {
        assertThat(formatter.format("**bold** and *it*"))
            .isEqualTo("<strong>bold</strong> and <em>it</em>");
    }

    @Test
    void format_repeatedDelimiters_matchShortestPairs() {
        assertThat(formatter.format("**a** then **b**"))
            .isEqualTo("<strong>a</strong> then <strong>b</strong>");
    }

    @Test
    void format_image_rendersImgWithoutLeftoverBang() {
        assertThat(formatter.format("![logo](img/logo.png)"))
            .isEqualTo("<img src=\"img/logo.png\" alt=\"logo\" />");
    }

    @Test
    void format_link_rendersAnchor() {
        assertThat(formatter.format("see [docs](https://example.com/docs)"))
            .isEqualTo("see <a href=\"https://example.com/docs\">docs</a>");
    }

    @Test
    void format_imageAndLinkOnSameLine_bothRendered() {
        assertThat(formatter.format("![a](b.png) [c](d)"))
            .isEqualTo("<img src=\"b.png\" alt=\"a\" /> <a href=\"d\">c</a>");
    }

    @Test
    void format_inlineCode_wrapsInCode() {
        assertThat(formatter.format("run `mvn test` now")).isEqualTo("run <code>mvn test</code> now");
    }

    @Test
    void format_asterisksInsideCodeSpan_areFormattedBeforeCode() {
        assertThat(formatter.format("`a*b*c`")).isEqualTo("<code>a<em>b</em>c</code>");
    }

    @Test
    void format_unmatchedDelimiters_leftAsIs() {
        assertThat(formatter.format("2 * 3 = 6 and [broken](")).isEqualTo("2 * 3 = 6 and [broken](");
    }

    @Test
    void format_dollarSignsInText_arePreserved() {
        assertThat(formatter.format("costs $5 *now* or *$1*"))
            .isEqualTo("costs $5 <em>now</em> or <em>$1</em>");
    }

    @Test
    void format_htmlSpecialCharacters_passThroughUnescaped() {
        assertThat(formatter.format("<b>x</b> & y")).isEqualTo("<b>x</b> & y");
    }

    @Test
    void format_tailwindProfile_addsClasses() {
        InlineFormatter tailwind = new InlineFormatter(HtmlStyles.of(StyleProfile.TAILWIND));

        assertThat(tailwind.format("**w** *i* [t](u) `c`")).isEqualTo(
            "<strong class=\"font-bold\">w</strong> <em class=\"italic\">i</em> "
                + "<a href=\"u\" class=\"underline\">t</a> <code class=\"bg-slate-300\">c</code>");
    }

    @Test
    void format_spansContainingLineSeparators_stillFormatted() {
        assertThat(formatter.format("**a\u2028b** *c\rd* `e\u2029f`"))
            .isEqualTo("<strong>a\u2028b</strong> <em>c\rd</em> <code>e\u2029f</code>");
    }
}
