package com.mdpress.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mdpress.core.block.UnterminatedFencePolicy;
import com.mdpress.core.html.StyleProfile;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Root configuration for mdpress.
 *
 * <p>Loaded from {@code mdpress.yaml}. Every section is optional; missing
 * sections and values fall back to {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * style: tailwind
 *
 * html:
 *   lang: en
 *   stylesheet: ./styles/style.css
 *
 * byline:
 *   zoneOffset: "+07:00"
 *   dateTimePattern: "yyyy-MM-dd HH:mm:ss"
 *
 * fences:
 *   unterminated: discard
 * }</pre>
 *
 * @param style attribute profile for emitted elements
 * @param html default page settings
 * @param byline byline date settings
 * @param fences code fence settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConverterConfig(
    @JsonProperty("style") StyleProfile style,
    @JsonProperty("html") HtmlSettings html,
    @JsonProperty("byline") BylineSettings byline,
    @JsonProperty("fences") FenceSettings fences
) {
    public static final String DEFAULT_FILE_NAME = "mdpress.yaml";

    /**
     * Compact constructor filling absent sections with defaults.
     */
    public ConverterConfig {
        if (style == null) {
            style = StyleProfile.TAILWIND;
        }
        if (html == null) {
            html = HtmlSettings.defaults();
        }
        if (byline == null) {
            byline = BylineSettings.defaults();
        }
        if (fences == null) {
            fences = FenceSettings.defaults();
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static ConverterConfig defaults() {
        return new ConverterConfig(null, null, null, null);
    }

    /**
     * Returns a copy with another style profile.
     *
     * @param profile style profile
     * @return updated configuration
     */
    public ConverterConfig withStyle(StyleProfile profile) {
        return new ConverterConfig(profile, html, byline, fences);
    }

    /**
     * Settings for the default HTML page.
     *
     * @param lang page language
     * @param stylesheet stylesheet href; blank omits the link element
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record HtmlSettings(
        @JsonProperty("lang") String lang,
        @JsonProperty("stylesheet") String stylesheet
    ) {
        public HtmlSettings {
            if (lang == null || lang.isBlank()) {
                lang = "en";
            }
            if (stylesheet == null) {
                stylesheet = "./styles/style.css";
            }
        }

        public static HtmlSettings defaults() {
            return new HtmlSettings(null, null);
        }
    }

    /**
     * Settings for the synthesized byline datetime.
     *
     * @param zoneOffset fixed UTC offset, e.g. {@code +07:00}
     * @param dateTimePattern {@link DateTimeFormatter} pattern
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BylineSettings(
        @JsonProperty("zoneOffset") String zoneOffset,
        @JsonProperty("dateTimePattern") String dateTimePattern
    ) {
        public BylineSettings {
            if (zoneOffset == null || zoneOffset.isBlank()) {
                zoneOffset = "+07:00";
            }
            if (dateTimePattern == null || dateTimePattern.isBlank()) {
                dateTimePattern = "yyyy-MM-dd HH:mm:ss";
            }
        }

        public static BylineSettings defaults() {
            return new BylineSettings(null, null);
        }

        /**
         * Parses the configured offset.
         *
         * @return zone offset
         * @throws java.time.DateTimeException if the offset is malformed
         */
        public ZoneOffset offset() {
            return ZoneOffset.of(zoneOffset);
        }

        /**
         * Builds the configured formatter.
         *
         * @return date-time formatter
         * @throws IllegalArgumentException if the pattern is malformed
         */
        public DateTimeFormatter formatter() {
            return DateTimeFormatter.ofPattern(dateTimePattern);
        }
    }

    /**
     * Settings for fenced code blocks.
     *
     * @param unterminated handling of a fence left open at end of input
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FenceSettings(
        @JsonProperty("unterminated") UnterminatedFencePolicy unterminated
    ) {
        public FenceSettings {
            if (unterminated == null) {
                unterminated = UnterminatedFencePolicy.DISCARD;
            }
        }

        public static FenceSettings defaults() {
            return new FenceSettings(null);
        }
    }
}
