package com.mdpress.core.html;

/**
 * Attribute profile applied to emitted elements.
 */
public enum StyleProfile {
    /** Bare tags without any attributes. */
    PLAIN,
    /** Utility-class attributes for a Tailwind stylesheet. */
    TAILWIND
}
