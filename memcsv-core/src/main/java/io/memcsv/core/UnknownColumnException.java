package io.memcsv.core;

public class UnknownColumnException extends MemcsvException {

    private final String column;

    public UnknownColumnException(String column) {
        super("Unknown column: '" + column + "'");
        this.column = column;
    }

    public String column() {
        return column;
    }
}
