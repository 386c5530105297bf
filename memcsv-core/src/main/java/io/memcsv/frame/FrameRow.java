package io.memcsv.frame;

import io.memcsv.core.UnknownColumnException;
import io.memcsv.core.converter.CellConverter;

import java.util.List;

/**
 * One included row of a frame, restricted to the frame's active columns.
 * <p>
 * Provides dedicated accessor methods for common types, similar to JDBC ResultSet.
 * Positions refer to active columns, not to columns of the underlying table.
 */
public final class FrameRow {
    private final int rowIndex;
    private final List<String> names;
    private final List<String> cells;
    private final CellConverter converter;

    FrameRow(int rowIndex, List<String> names, List<String> cells, CellConverter converter) {
        this.rowIndex = rowIndex;
        this.names = names;
        this.cells = cells;
        this.converter = converter;
    }

    /**
     * Index of this row in the underlying table.
     */
    public int rowIndex() {
        return rowIndex;
    }

    public int size() {
        return cells.size();
    }

    public String columnName(int index) {
        return names.get(index);
    }

    public String getString(int index) {
        return cells.get(index);
    }

    public <T> T get(int index, Class<T> type) {
        return converter.convert(cells.get(index), type);
    }

    public int getInt(int index) {
        return get(index, Integer.class);
    }

    public long getLong(int index) {
        return get(index, Long.class);
    }

    public double getDouble(int index) {
        return get(index, Double.class);
    }

    public boolean getBoolean(int index) {
        return get(index, Boolean.class);
    }

    public String getString(String name) {
        return cells.get(indexOf(name));
    }

    public <T> T get(String name, Class<T> type) {
        return get(indexOf(name), type);
    }

    public int getInt(String name) {
        return getInt(indexOf(name));
    }

    public long getLong(String name) {
        return getLong(indexOf(name));
    }

    public double getDouble(String name) {
        return getDouble(indexOf(name));
    }

    private int indexOf(String name) {
        int index = names.indexOf(name);
        if (index < 0) {
            throw new UnknownColumnException(name);
        }
        return index;
    }

    @Override
    public String toString() {
        return "FrameRow[" + rowIndex + "]" + cells;
    }
}
