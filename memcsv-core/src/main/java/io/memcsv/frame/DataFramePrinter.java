package io.memcsv.frame;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Renders a frame as text: the active header names on the first line, then one
 * line per included row, cells separated by {@code separator}.
 */
public final class DataFramePrinter {
    private final String separator;

    public DataFramePrinter() {
        this("\t");
    }

    public DataFramePrinter(String separator) {
        if (separator == null) {
            throw new IllegalArgumentException("separator required");
        }
        this.separator = separator;
    }

    public void print(DataFrame frame, Appendable out) {
        try {
            appendLine(out, frame.colIterable(frame.header()));
            for (List<String> row : frame.rowIterable()) {
                appendLine(out, frame.colIterable(row));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to print frame", e);
        }
    }

    public String render(DataFrame frame) {
        StringBuilder sb = new StringBuilder();
        print(frame, sb);
        return sb.toString();
    }

    private void appendLine(Appendable out, Iterable<String> cells) throws IOException {
        boolean first = true;
        for (String cell : cells) {
            if (!first) {
                out.append(separator);
            }
            out.append(cell);
            first = false;
        }
        out.append('\n');
    }
}
