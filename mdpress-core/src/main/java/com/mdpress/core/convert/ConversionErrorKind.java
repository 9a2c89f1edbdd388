package com.mdpress.core.convert;

/**
 * Categories of conversion failure.
 */
public enum ConversionErrorKind {
    /** Input file absent or unreadable. */
    MISSING_INPUT,
    /** Template path given but unreadable. */
    MISSING_TEMPLATE,
    /** Template lacks the content placeholder. */
    INVALID_TEMPLATE,
    /** Any other failure while reading, converting or writing. */
    GENERIC_FAILURE
}
