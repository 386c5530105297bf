package io.memcsv.core;

/**
 * Raised when a loaded header is not usable, e.g. it names the same column twice.
 */
public class SchemaException extends MemcsvException {

    public SchemaException(String message) {
        super(message);
    }
}
