package io.memcsv.core;

/**
 * A cell could not be converted to the requested type.
 */
public class ConversionException extends MemcsvException {

    private final String cell;
    private final Class<?> targetType;

    public ConversionException(String cell, Class<?> targetType, Throwable cause) {
        super("Cannot convert '" + cell + "' to " + targetType.getSimpleName(), cause);
        this.cell = cell;
        this.targetType = targetType;
    }

    public ConversionException(String message, Class<?> targetType) {
        super(message);
        this.cell = null;
        this.targetType = targetType;
    }

    public String cell() {
        return cell;
    }

    public Class<?> targetType() {
        return targetType;
    }
}
