package io.memcsv.core.converter;

/**
 * How a non-empty cell that does not parse as the requested type is handled.
 */
public enum ConversionPolicy {
    /**
     * Fail with {@link io.memcsv.core.ConversionException}.
     */
    STRICT,

    /**
     * Substitute the converter's empty value (zero for numeric types).
     */
    LENIENT
}
