package io.memcsv.core;

public class MemcsvException extends RuntimeException {

    public MemcsvException(Throwable cause) {
        super(cause);
    }

    public MemcsvException(String message, Throwable cause) {
        super(message, cause);
    }

    public MemcsvException(String message) {
        super(message);
    }

}
