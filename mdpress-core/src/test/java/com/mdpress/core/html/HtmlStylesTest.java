package com.mdpress.core.html;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link HtmlStyles}.
 */
class HtmlStylesTest {

    @Test
    void of_plain_hasNoAttributes() {
        HtmlStyles styles = HtmlStyles.of(StyleProfile.PLAIN);

        for (ElementKind kind : ElementKind.values()) {
            assertThat(styles.attributes(kind)).as(kind.name()).isEmpty();
        }
        assertThat(styles.openTag(ElementKind.PARAGRAPH)).isEqualTo("<p>");
        assertThat(styles.closeTag(ElementKind.ORDERED_LIST)).isEqualTo("</ol>");
    }

    @Test
    void of_tailwind_rendersClassAttributes() {
        HtmlStyles styles = HtmlStyles.of(StyleProfile.TAILWIND);

        assertThat(styles.openTag(ElementKind.PARAGRAPH)).isEqualTo("<p class=\"mb-5 text-justify\">");
        assertThat(styles.openTag(ElementKind.UNORDERED_LIST)).isEqualTo("<ul class=\"list-disc list-inside\">");
        assertThat(styles.openTag(ElementKind.ORDERED_LIST)).isEqualTo("<ol class=\"list-decimal list-inside\">");
        assertThat(styles.openTag(ElementKind.LIST_ITEM)).isEqualTo("<li>");
    }

    @Test
    void openHeading_tailwind_sizesByLevel() {
        HtmlStyles styles = HtmlStyles.of(StyleProfile.TAILWIND);

        assertThat(styles.openHeading(1)).isEqualTo("<h1 class=\"text-6xl text-red-900 mb-5 font-black uppercase\">");
        assertThat(styles.openHeading(2)).isEqualTo("<h2 class=\"text-4xl text-red-900 mb-5 font-black uppercase\">");
        assertThat(styles.openHeading(5)).isEqualTo("<h5 class=\"text-2xl text-red-900 mb-5 font-black uppercase\">");
        assertThat(styles.closeHeading(5)).isEqualTo("</h5>");
    }

    @Test
    void of_returnsSharedInstance() {
        assertThat(HtmlStyles.of(StyleProfile.TAILWIND)).isSameAs(HtmlStyles.of(StyleProfile.TAILWIND));
        assertThat(HtmlStyles.of(StyleProfile.PLAIN).profile()).isEqualTo(StyleProfile.PLAIN);
    }

    @Test
    void of_nullProfile_throwsException() {
        assertThatThrownBy(() -> HtmlStyles.of(null))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void indentsCodeBlocks_onlyForTailwind() {
        assertThat(HtmlStyles.of(StyleProfile.TAILWIND).indentsCodeBlocks()).isTrue();
        assertThat(HtmlStyles.of(StyleProfile.PLAIN).indentsCodeBlocks()).isFalse();
    }

    @Test
    void openCodeBody_languageTag_addsLanguageClass() {
        HtmlStyles styles = HtmlStyles.of(StyleProfile.TAILWIND);

        assertThat(styles.openTag(ElementKind.CODE_BLOCK)).isEqualTo("<pre>");
        assertThat(styles.openCodeBody("java")).isEqualTo("<code class=\"language-java\">");
        assertThat(styles.openCodeBody("")).isEqualTo("<code>");
        assertThat(styles.closeTag(ElementKind.CODE_BLOCK_BODY)).isEqualTo("</code>");
    }
}
