package io.memcsv.frame;

import io.memcsv.core.UnknownColumnException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Columns extracted from a frame, each converted to the type requested for it.
 * All columns hold the same number of values, in row order.
 */
public final class TypedColumns {
    private final List<String> names;
    private final List<Class<?>> types;
    private final List<List<?>> columns;

    TypedColumns(List<String> names, List<Class<?>> types, List<List<?>> columns) {
        this.names = List.copyOf(names);
        this.types = List.copyOf(types);
        var wrapped = new ArrayList<List<?>>(columns.size());
        for (List<?> column : columns) {
            wrapped.add(Collections.unmodifiableList(column));
        }
        this.columns = Collections.unmodifiableList(wrapped);
    }

    /**
     * Number of columns.
     */
    public int size() {
        return columns.size();
    }

    /**
     * Number of values in every column.
     */
    public int rowCount() {
        return columns.isEmpty() ? 0 : columns.get(0).size();
    }

    public List<String> names() {
        return names;
    }

    public List<?> get(int index) {
        return columns.get(index);
    }

    /**
     * Typed access to one column.
     *
     * @throws IllegalArgumentException if {@code type} is not the type the column was extracted as
     */
    @SuppressWarnings("unchecked")
    public <T> List<T> get(int index, Class<T> type) {
        Class<?> declared = types.get(index);
        if (box(declared) != box(type)) {
            throw new IllegalArgumentException("column " + index + " was extracted as "
                    + declared.getSimpleName() + ", not " + type.getSimpleName());
        }
        return (List<T>) columns.get(index);
    }

    public <T> List<T> get(String name, Class<T> type) {
        int index = names.indexOf(name);
        if (index < 0) {
            throw new UnknownColumnException(name);
        }
        return get(index, type);
    }

    private static Class<?> box(Class<?> type) {
        if (!type.isPrimitive()) {
            return type;
        }
        if (type == int.class) {
            return Integer.class;
        }
        if (type == long.class) {
            return Long.class;
        }
        if (type == double.class) {
            return Double.class;
        }
        if (type == float.class) {
            return Float.class;
        }
        if (type == boolean.class) {
            return Boolean.class;
        }
        if (type == short.class) {
            return Short.class;
        }
        if (type == byte.class) {
            return Byte.class;
        }
        if (type == char.class) {
            return Character.class;
        }
        return type;
    }

    @Override
    public String toString() {
        return "TypedColumns" + names + " x " + rowCount();
    }
}
