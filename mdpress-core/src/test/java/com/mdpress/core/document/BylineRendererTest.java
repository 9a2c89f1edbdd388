package com.mdpress.core.document;

import com.mdpress.core.block.Block;
import com.mdpress.core.block.BlockKind;
import com.mdpress.core.html.HtmlStyles;
import com.mdpress.core.html.StyleProfile;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link BylineRenderer}.
 */
class BylineRendererTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

    private static BylineRenderer renderer(StyleProfile profile) {
        return new BylineRenderer(HtmlStyles.of(profile), CLOCK, ZoneOffset.ofHours(7),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"));
    }

    @Test
    void render_noMetadata_returnsEmpty() {
        assertThat(renderer(StyleProfile.PLAIN).render(Map.of())).isEmpty();
        assertThat(renderer(StyleProfile.PLAIN).render(null)).isEmpty();
    }

    @Test
    void render_authorWithoutDatetime_usesCurrentTimeAtOffset() {
        assertThat(renderer(StyleProfile.PLAIN).render(Map.of("author", "Bar")))
            .map(Block::html)
            .contains("<section><p>Written by Bar</p>\n"
                + "<section><p>at 2024-01-01 07:00:00</p></section></section>");
    }

    @Test
    void render_explicitDates_shownVerbatim() {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("author", "A");
        metadata.put("datetime", "2023-05-05");
        metadata.put("updatetime", "2023-06-06");

        assertThat(renderer(StyleProfile.PLAIN).render(metadata))
            .map(Block::html)
            .contains("<section><p>Written by A</p>\n"
                + "<section><p>at 2023-05-05</p>\n<p>edited at 2023-06-06</p></section></section>");
    }

    @Test
    void render_withoutAuthor_omitsWrittenBy() {
        assertThat(renderer(StyleProfile.PLAIN).render(Map.of("title", "T")))
            .map(Block::html)
            .contains("<section><section><p>at 2024-01-01 07:00:00</p></section></section>");
    }

    @Test
    void render_synthesizedTime_notAddedToMetadata() {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("title", "T");

        renderer(StyleProfile.PLAIN).render(metadata);

        assertThat(metadata).containsOnlyKeys("title");
    }

    @Test
    void render_tailwindProfile_usesBylineClasses() {
        assertThat(renderer(StyleProfile.TAILWIND).render(Map.of("author", "Bar")))
            .map(Block::kind)
            .contains(BlockKind.BYLINE);
        assertThat(renderer(StyleProfile.TAILWIND).render(Map.of("author", "Bar")))
            .map(Block::html)
            .contains("<section class=\"flex flex-row justify-between mb-5\">"
                + "<p class=\"text-xs text-slate-500\">Written by Bar</p>\n"
                + "<section class=\"flex flex-row gap-x-4\">"
                + "<p class=\"text-xs text-slate-500\">at 2024-01-01 07:00:00</p></section></section>");
    }
}
