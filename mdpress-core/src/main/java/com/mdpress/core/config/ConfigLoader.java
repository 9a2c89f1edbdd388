package com.mdpress.core.config;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Loads {@link ConverterConfig} from YAML.
 *
 * <p>Never fails: a missing, unreadable, empty or malformed file logs a
 * warning and yields {@link ConverterConfig#defaults()}. A malformed byline
 * offset or date-time pattern is replaced by its default value.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ConverterConfig config = ConfigLoader.load(Paths.get("mdpress.yaml"));
 * StyleProfile style = config.style();
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = YAMLMapper.builder()
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .build();

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code mdpress.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static ConverterConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return ConverterConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ConverterConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            ConverterConfig config = YAML_MAPPER.readValue(configPath.toFile(), ConverterConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ConverterConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return withValidByline(config);
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ConverterConfig.defaults();
        }
    }

    private static ConverterConfig withValidByline(ConverterConfig config) {
        ConverterConfig.BylineSettings byline = config.byline();
        ConverterConfig.BylineSettings defaults = ConverterConfig.BylineSettings.defaults();

        String zoneOffset = byline.zoneOffset();
        try {
            ZoneOffset.of(zoneOffset);
        } catch (DateTimeException e) {
            log.warn("Invalid byline.zoneOffset '{}': {}. Using {}.", zoneOffset, e.getMessage(), defaults.zoneOffset());
            zoneOffset = defaults.zoneOffset();
        }

        String pattern = byline.dateTimePattern();
        try {
            DateTimeFormatter.ofPattern(pattern);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid byline.dateTimePattern '{}': {}. Using {}.", pattern, e.getMessage(), defaults.dateTimePattern());
            pattern = defaults.dateTimePattern();
        }

        if (zoneOffset.equals(byline.zoneOffset()) && pattern.equals(byline.dateTimePattern())) {
            return config;
        }
        return new ConverterConfig(config.style(), config.html(),
            new ConverterConfig.BylineSettings(zoneOffset, pattern), config.fences());
    }
}
