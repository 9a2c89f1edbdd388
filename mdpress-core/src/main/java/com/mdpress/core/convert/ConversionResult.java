package com.mdpress.core.convert;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Outcome of a file conversion.
 *
 * @param success whether the output was written
 * @param errorKind failure category, null on success
 * @param message failure detail, null on success
 * @param output output destination
 */
public record ConversionResult(
    boolean success,
    ConversionErrorKind errorKind,
    String message,
    Path output
) {
    /**
     * Compact constructor with validation.
     */
    public ConversionResult {
        if (!success) {
            Objects.requireNonNull(errorKind, "errorKind must not be null for a failed result");
        }
    }

    /**
     * Creates a successful result.
     *
     * @param output written destination
     * @return successful result
     */
    public static ConversionResult succeeded(Path output) {
        return new ConversionResult(true, null, null, output);
    }

    /**
     * Creates a failed result.
     *
     * @param output intended destination
     * @param errorKind failure category
     * @param message failure detail
     * @return failed result
     */
    public static ConversionResult failed(Path output, ConversionErrorKind errorKind, String message) {
        return new ConversionResult(false, errorKind, message, output);
    }
}
