package io.memcsv.kernel;

import io.memcsv.core.MemcsvConfiguration;
import io.memcsv.core.SchemaException;
import io.memcsv.core.SizeMismatchException;
import io.memcsv.core.UnknownColumnException;

import java.io.Reader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable in-memory table: a header and row-major string cells.
 * <p>
 * Every row holds exactly {@code header().size()} cells. A table is built once and
 * then shared by reference between all frames derived from it; frames compare
 * tables by identity.
 */
public final class CsvTable {
    private final String source;
    private final List<String> header;
    private final Map<String, Integer> headerIndex;
    private final List<List<String>> rows;

    private CsvTable(String source, List<String> header, Map<String, Integer> headerIndex,
            List<List<String>> rows) {
        this.source = source;
        this.header = header;
        this.headerIndex = headerIndex;
        this.rows = rows;
    }

    public static CsvTable load(Path path) {
        return load(path, MemcsvConfiguration.defaults());
    }

    public static CsvTable load(Path path, MemcsvConfiguration configuration) {
        return new CsvTableLoader(configuration).load(path);
    }

    public static CsvTable load(Reader reader, MemcsvConfiguration configuration) {
        return new CsvTableLoader(configuration).load(reader, "<reader>");
    }

    /**
     * Build a table from already split cells.
     *
     * @throws SchemaException if the header names a column twice
     * @throws SizeMismatchException if a row is not exactly as wide as the header
     */
    public static CsvTable of(String source, List<String> header, List<List<String>> rows) {
        if (header == null) {
            throw new IllegalArgumentException("header required");
        }
        if (rows == null) {
            throw new IllegalArgumentException("rows required");
        }
        var index = indexHeader(header);
        var width = header.size();
        var copiedRows = new ArrayList<List<String>>(rows.size());
        for (var row : rows) {
            if (row.size() != width) {
                throw new SizeMismatchException("row " + copiedRows.size(), width, row.size());
            }
            copiedRows.add(List.copyOf(row));
        }
        return new CsvTable(source == null ? "<memory>" : source, List.copyOf(header),
                Collections.unmodifiableMap(index), Collections.unmodifiableList(copiedRows));
    }

    private static Map<String, Integer> indexHeader(List<String> header) {
        var index = new LinkedHashMap<String, Integer>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (int i = 0; i < header.size(); i++) {
            var name = header.get(i);
            if (name == null) {
                throw new SchemaException("header column " + i + " has no name");
            }
            if (index.putIfAbsent(name, i) != null) {
                duplicates.add(name);
            }
        }
        if (!duplicates.isEmpty()) {
            throw new SchemaException("csv header contains multiple columns with the same name: " + duplicates);
        }
        return index;
    }

    /**
     * Where the table was loaded from.
     */
    public String source() {
        return source;
    }

    public List<String> header() {
        return header;
    }

    public Map<String, Integer> headerIndex() {
        return headerIndex;
    }

    public List<List<String>> rows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return header.size();
    }

    public int columnIndex(String name) {
        Integer index = headerIndex.get(name);
        if (index == null) {
            throw new UnknownColumnException(name);
        }
        return index;
    }

    /**
     * Access a single cell.
     *
     * @throws IndexOutOfBoundsException if {@code row} or {@code col} exceed the loaded extents
     */
    public String cell(int row, int col) {
        if (row < 0 || row >= rows.size()) {
            throw new IndexOutOfBoundsException(
                    "csv table has " + rows.size() + " rows, but row " + row + " has been requested");
        }
        if (col < 0 || col >= header.size()) {
            throw new IndexOutOfBoundsException(
                    "csv table has " + header.size() + " columns, but column " + col + " has been requested");
        }
        return rows.get(row).get(col);
    }

    @Override
    public String toString() {
        return "CsvTable[" + source + ", " + rows.size() + "x" + header.size() + "]";
    }
}
