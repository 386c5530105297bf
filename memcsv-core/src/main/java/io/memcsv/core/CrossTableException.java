package io.memcsv.core;

/**
 * Two frames were combined although they are backed by different tables.
 */
public class CrossTableException extends MemcsvException {

    public CrossTableException(String operation) {
        super("Cannot " + operation + " frames backed by different tables");
    }
}
