package com.mdpress.core.document;

import com.mdpress.core.block.Block;
import com.mdpress.core.block.BlockKind;
import com.mdpress.core.html.ElementKind;
import com.mdpress.core.html.HtmlStyles;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Renders the author/date byline shown above documents that carry metadata.
 *
 * <p>Uses the {@code author}, {@code datetime} and {@code updatetime} keys.
 * When {@code datetime} is absent the current time at the configured offset
 * is shown instead; that synthesized value only appears in the byline and is
 * never added to the metadata map.
 */
public class BylineRenderer {

    public static final String AUTHOR_KEY = "author";
    public static final String DATETIME_KEY = "datetime";
    public static final String UPDATETIME_KEY = "updatetime";

    private final HtmlStyles styles;
    private final Clock clock;
    private final ZoneOffset zoneOffset;
    private final DateTimeFormatter formatter;

    public BylineRenderer(HtmlStyles styles, Clock clock, ZoneOffset zoneOffset, DateTimeFormatter formatter) {
        this.styles = Objects.requireNonNull(styles, "styles must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zoneOffset = Objects.requireNonNull(zoneOffset, "zoneOffset must not be null");
        this.formatter = Objects.requireNonNull(formatter, "formatter must not be null");
    }

    /**
     * Renders the byline block.
     *
     * @param metadata document metadata
     * @return byline block, or empty when there is no metadata
     */
    public Optional<Block> render(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Optional.empty();
        }

        String dates = text("at " + createdAt(metadata));
        String updated = metadata.get(UPDATETIME_KEY);
        if (isPresent(updated)) {
            dates += "\n" + text("edited at " + updated);
        }

        StringBuilder html = new StringBuilder(styles.openTag(ElementKind.BYLINE));
        String author = metadata.get(AUTHOR_KEY);
        if (isPresent(author)) {
            html.append(text("Written by " + author)).append("\n");
        }
        html.append(styles.openTag(ElementKind.BYLINE_DATES))
            .append(dates)
            .append(styles.closeTag(ElementKind.BYLINE_DATES))
            .append(styles.closeTag(ElementKind.BYLINE));

        return Optional.of(new Block(BlockKind.BYLINE, html.toString()));
    }

    private String createdAt(Map<String, String> metadata) {
        String explicit = metadata.get(DATETIME_KEY);
        if (isPresent(explicit)) {
            return explicit;
        }
        return OffsetDateTime.now(clock).withOffsetSameInstant(zoneOffset).format(formatter);
    }

    private String text(String value) {
        return styles.openTag(ElementKind.BYLINE_TEXT) + value + styles.closeTag(ElementKind.BYLINE_TEXT);
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isEmpty();
    }
}
