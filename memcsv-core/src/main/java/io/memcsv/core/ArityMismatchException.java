package io.memcsv.core;

/**
 * The number of columns an operation works on does not match the active
 * (or pinned) column count of a frame.
 */
public class ArityMismatchException extends MemcsvException {

    private final int expected;
    private final int actual;

    public ArityMismatchException(String operation, int expected, int actual) {
        this(expected, actual, operation + ": expected " + expected + " column(s) but got " + actual);
    }

    private ArityMismatchException(int expected, int actual, String message) {
        super(message);
        this.expected = expected;
        this.actual = actual;
    }

    /**
     * Pinned column counts of two frames differ, where {@code -1} stands for a frame
     * whose count is not pinned.
     */
    public static ArityMismatchException pinned(String operation, int expected, int actual) {
        return new ArityMismatchException(expected, actual,
                operation + ": expected " + describe(expected) + " but got " + describe(actual));
    }

    private static String describe(int arity) {
        return arity < 0 ? "an unpinned column count" : "a column count pinned to " + arity;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
