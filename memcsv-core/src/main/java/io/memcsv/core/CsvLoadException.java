package io.memcsv.core;

import java.io.IOException;

/**
 * Raised when a CSV source does not exist or cannot be read.
 */
public class CsvLoadException extends MemcsvException {

    public CsvLoadException(String message) {
        super(message);
    }

    public CsvLoadException(String message, IOException cause) {
        super(message, cause);
    }
}
