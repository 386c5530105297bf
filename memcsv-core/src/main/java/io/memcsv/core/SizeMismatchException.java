package io.memcsv.core;

/**
 * A mask and the sequence it is applied to differ in length.
 */
public class SizeMismatchException extends MemcsvException {

    private final int expected;
    private final int actual;

    public SizeMismatchException(String what, int expected, int actual) {
        super(what + ": expected length " + expected + " but was " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
