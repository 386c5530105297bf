package io.memcsv.core.converter;

/**
 * Converts the textual content of a cell into a typed value.
 * Similar to JPA's AttributeConverter, this allows extensible type handling.
 *
 * @param <T> The Java type produced from a cell
 */
public interface TypeConverter<T> {

    /**
     * Get the Java type this converter produces.
     */
    Class<T> javaType();

    /**
     * Parse a non-empty cell.
     * <p>
     * Implementations signal unparseable input with an {@link IllegalArgumentException}
     * (including {@link NumberFormatException}) or a {@link java.time.DateTimeException}.
     */
    T fromCell(String cell);

    /**
     * Value produced for an empty cell, and for unparseable cells under
     * {@link ConversionPolicy#LENIENT}. Numeric converters return zero.
     */
    default T emptyValue() {
        return null;
    }
}
