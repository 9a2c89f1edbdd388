package com.mdpress.core.convert;

import java.util.Objects;

/**
 * Exception thrown when a file conversion cannot complete.
 */
public class ConversionException extends RuntimeException {

    private final ConversionErrorKind kind;

    public ConversionException(ConversionErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public ConversionException(ConversionErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public ConversionErrorKind getKind() {
        return kind;
    }
}
