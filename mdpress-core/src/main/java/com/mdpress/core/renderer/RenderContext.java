package com.mdpress.core.renderer;

import java.util.Map;
import java.util.Objects;

/**
 * Context provided to renderers.
 *
 * @param target output destination (a file path for the filesystem renderer)
 * @param settings renderer-specific settings
 */
public record RenderContext(
    String target,
    Map<String, String> settings
) {
    /**
     * Compact constructor with validation.
     */
    public RenderContext {
        Objects.requireNonNull(target, "target must not be null");
        if (settings == null) {
            settings = Map.of();
        }
    }

    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }
}
