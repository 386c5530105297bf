package io.memcsv.frame;

import io.memcsv.core.ArityMismatchException;
import io.memcsv.core.CrossTableException;
import io.memcsv.core.MemcsvConfiguration;
import io.memcsv.core.SizeMismatchException;
import io.memcsv.core.converter.CellConverter;
import io.memcsv.core.converter.TypeConverter;
import io.memcsv.kernel.CsvTable;
import io.memcsv.kernel.Mask;
import io.memcsv.kernel.MaskedIterable;
import io.memcsv.kernel.Predicate;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalInt;

/**
 * Immutable, masked view over a {@link CsvTable}.
 * <p>
 * A frame holds a reference to its table plus a row mask and a column mask. Every
 * manipulating operation returns a new frame that shares the same table and carries
 * new masks; cells are never copied and the receiver is never changed.
 * <p>
 * A frame may carry an <em>arity</em>: the number of active columns it is expected
 * to have. When set, it is checked every time a frame is constructed, so typed
 * extraction and comparison fail as early as possible.
 *
 * <pre>{@code
 * DataFrame df = DataFrame.read(path);
 * List<Integer> a = df.select("a")
 *         .selectRows(df.select("b").lt(25))
 *         .colToList(Integer.class);
 * }</pre>
 */
public final class DataFrame {
    private static final int UNSET = -1;

    private final CsvTable table;
    private final Mask rowMask;
    private final Mask colMask;
    private final int arity;
    private final CellConverter converter;

    private DataFrame(CsvTable table, Mask rowMask, Mask colMask, int arity, CellConverter converter) {
        if (rowMask.length() != table.rowCount()) {
            throw new SizeMismatchException("row mask", table.rowCount(), rowMask.length());
        }
        if (colMask.length() != table.columnCount()) {
            throw new SizeMismatchException("column mask", table.columnCount(), colMask.length());
        }
        if (arity != UNSET && colMask.cardinality() != arity) {
            throw new ArityMismatchException("frame construction", arity, colMask.cardinality());
        }
        this.table = table;
        this.rowMask = rowMask;
        this.colMask = colMask;
        this.arity = arity;
        this.converter = converter;
    }

    // ===== CONSTRUCTION =====

    public static DataFrame read(Path path) {
        return read(path, MemcsvConfiguration.defaults());
    }

    public static DataFrame read(Path path, MemcsvConfiguration configuration) {
        return of(CsvTable.load(path, configuration), configuration);
    }

    /**
     * Load a file and pin the frame to {@code expectedCols} columns.
     */
    public static DataFrame read(Path path, int expectedCols) {
        return read(path).expectCols(expectedCols);
    }

    public static DataFrame of(CsvTable table) {
        return of(table, MemcsvConfiguration.defaults());
    }

    /**
     * Frame over every row and column of {@code table}.
     */
    public static DataFrame of(CsvTable table, MemcsvConfiguration configuration) {
        if (table == null) {
            throw new IllegalArgumentException("table required");
        }
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        return new DataFrame(table, Mask.allSet(table.rowCount()), Mask.allSet(table.columnCount()),
                UNSET, CellConverter.from(configuration));
    }

    private DataFrame derive(Mask newRowMask, Mask newColMask, int newArity) {
        return new DataFrame(table, newRowMask, newColMask, newArity, converter);
    }

    // ===== INSPECTION =====

    public CsvTable table() {
        return table;
    }

    /**
     * The full header of the underlying table, regardless of the column mask.
     */
    public List<String> header() {
        return table.header();
    }

    /**
     * Names of the active columns, in table order.
     */
    public List<String> columnNames() {
        List<String> names = new ArrayList<>(cols());
        for (String name : colIterable(table.header())) {
            names.add(name);
        }
        return names;
    }

    /**
     * Number of active rows.
     */
    public int rows() {
        return rowMask.cardinality();
    }

    /**
     * Number of active columns.
     */
    public int cols() {
        return colMask.cardinality();
    }

    public OptionalInt arity() {
        return arity == UNSET ? OptionalInt.empty() : OptionalInt.of(arity);
    }

    public Mask rowMask() {
        return rowMask;
    }

    public Mask colMask() {
        return colMask;
    }

    /**
     * Included rows of the table, each as the full row.
     */
    public MaskedIterable<List<String>> rowIterable() {
        return MaskedIterable.of(table.rows(), rowMask);
    }

    /**
     * Active cells of {@code row}; {@code row} must be as wide as the table.
     */
    public MaskedIterable<String> colIterable(List<String> row) {
        return MaskedIterable.of(row, colMask);
    }

    // ===== COLUMN SELECTION =====

    /**
     * Restrict the frame to the named columns. Duplicate names select one column.
     *
     * @throws io.memcsv.core.UnknownColumnException if a name is not in the header
     */
    public DataFrame select(String... names) {
        if (names == null) {
            throw new IllegalArgumentException("names required");
        }
        return select(Arrays.asList(names));
    }

    public DataFrame select(List<String> names) {
        if (names == null) {
            throw new IllegalArgumentException("names required");
        }
        BitSet bits = new BitSet(table.columnCount());
        for (String name : new LinkedHashSet<>(names)) {
            bits.set(table.columnIndex(name));
        }
        Mask newColMask = Mask.fromBits(bits, table.columnCount());
        return derive(rowMask, newColMask, newColMask.cardinality());
    }

    /**
     * Same selection, pinned to {@code expectedCols} active columns.
     */
    public DataFrame expectCols(int expectedCols) {
        if (expectedCols < 0) {
            throw new IllegalArgumentException("expectedCols must be non-negative");
        }
        return derive(rowMask, colMask, expectedCols);
    }

    // ===== COMPARISONS =====

    public DataFrame eq(Object... references) {
        return compare(Predicate.Operator.EQ, references);
    }

    /**
     * Rows for which {@link #eq} does not hold, i.e. at least one column differs.
     */
    public DataFrame neq(Object... references) {
        return compare(Predicate.Operator.NEQ, references);
    }

    public DataFrame lt(Object... references) {
        return compare(Predicate.Operator.LT, references);
    }

    public DataFrame le(Object... references) {
        return compare(Predicate.Operator.LTE, references);
    }

    public DataFrame gt(Object... references) {
        return compare(Predicate.Operator.GT, references);
    }

    public DataFrame ge(Object... references) {
        return compare(Predicate.Operator.GTE, references);
    }

    /**
     * Compare each included row with {@code references}, one reference per active column.
     * Cells are converted to the runtime type of their reference.
     *
     * @throws ArityMismatchException if the number of references differs from the
     *         active or pinned column count
     */
    public DataFrame compare(Predicate.Operator operator, Object... references) {
        return filter(Predicate.Comparison.of(operator, references));
    }

    /**
     * Keep rows whose single active column holds one of {@code values}.
     * <p>
     * Floating-point members match the way {@link #eq} does: {@code -0.0} and
     * {@code 0.0} are the same member and NaN matches nothing.
     */
    public DataFrame isIn(Collection<?> values) {
        return filter(new Predicate.In(values));
    }

    public DataFrame filter(Predicate predicate) {
        if (predicate == null) {
            throw new IllegalArgumentException("predicate required");
        }
        int required;
        String operation;
        if (predicate instanceof Predicate.Comparison) {
            Predicate.Comparison comparison = (Predicate.Comparison) predicate;
            required = comparison.arity();
            operation = "row-wise comparison " + comparison.operator().symbol();
        } else {
            required = 1;
            operation = "membership filter";
        }
        checkArity(operation, required);
        Mask newRowMask = new RowPredicateEngine(converter).evaluate(table, rowMask, colMask, predicate);
        return derive(newRowMask, colMask, required);
    }

    // ===== LOGICAL COMBINATION =====

    /**
     * Rows included in both frames; columns of this frame. When either frame has a
     * pinned column count, both must be pinned to the same count.
     */
    public DataFrame and(DataFrame other) {
        checkCombinable("logically combine", other);
        return derive(rowMask.and(other.rowMask), colMask, arity);
    }

    /**
     * Rows included in either frame; columns of this frame.
     */
    public DataFrame or(DataFrame other) {
        checkCombinable("logically combine", other);
        return derive(rowMask.or(other.rowMask), colMask, arity);
    }

    // ===== CROSS-FRAME SELECTION =====

    /**
     * Rows of {@code other} with the columns of this frame.
     */
    public DataFrame selectRows(DataFrame other) {
        checkSameTable("select rows across", other);
        return derive(other.rowMask, colMask, arity);
    }

    /**
     * Columns of {@code other} with the rows of this frame.
     */
    public DataFrame selectCols(DataFrame other) {
        checkSameTable("select columns across", other);
        return derive(rowMask, other.colMask, arity);
    }

    // ===== EXTRACTION =====

    /**
     * Convert every active column to the type given at the same position.
     *
     * @throws ArityMismatchException if the number of types differs from the column count
     */
    public TypedColumns colsToLists(Class<?>... types) {
        if (types == null || types.length == 0) {
            throw new IllegalArgumentException("types required");
        }
        checkArity("column extraction", types.length);

        TypeConverter<?>[] converters = new TypeConverter<?>[types.length];
        List<List<Object>> columns = new ArrayList<>(types.length);
        for (int i = 0; i < types.length; i++) {
            converters[i] = converter.converterFor(types[i]);
            columns.add(new ArrayList<>(rows()));
        }

        for (List<String> row : rowIterable()) {
            int position = 0;
            for (String cell : colIterable(row)) {
                columns.get(position).add(converter.convert(cell, converters[position]));
                position++;
            }
        }
        return new TypedColumns(columnNames(), Arrays.asList(types), new ArrayList<>(columns));
    }

    /**
     * Convert the single active column to {@code type}.
     */
    public <T> List<T> colToList(Class<T> type) {
        return colsToLists(type).get(0, type);
    }

    /**
     * Convert every active cell of every included row to {@code type}.
     */
    public <T> List<List<T>> rowsToLists(Class<T> type) {
        List<List<T>> result = new ArrayList<>(rows());
        for (List<String> row : rowIterable()) {
            List<String> cells = new ArrayList<>(cols());
            for (String cell : colIterable(row)) {
                cells.add(cell);
            }
            result.add(converter.convertAll(cells, type));
        }
        return result;
    }

    /**
     * Map each included row, restricted to the active columns, with {@code mapper}.
     */
    public <R> List<R> rowsToRecords(RowMapper<R> mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper required");
        }
        List<String> names = List.copyOf(columnNames());
        List<List<String>> rows = table.rows();
        List<R> result = new ArrayList<>(rows());
        var included = rowMask.enumerator();
        while (included.hasNext()) {
            int rowIndex = included.nextInt();
            List<String> cells = new ArrayList<>(cols());
            for (String cell : colIterable(rows.get(rowIndex))) {
                cells.add(cell);
            }
            result.add(mapper.map(new FrameRow(rowIndex, names, cells, converter)));
        }
        return result;
    }

    // ===== NUMERIC EXPORT =====

    public <E extends Number, S> S exportTo(MatrixSink<E, S> sink) {
        return exportTo(sink, UNSET, UNSET);
    }

    /**
     * Write every active cell to {@code sink} in row-major order.
     *
     * @param expectedRows required row count, or -1 for any
     * @param expectedCols required column count, or -1 for any
     * @throws ArityMismatchException if a required extent does not match the frame
     */
    public <E extends Number, S> S exportTo(MatrixSink<E, S> sink, int expectedRows, int expectedCols) {
        if (sink == null) {
            throw new IllegalArgumentException("sink required");
        }
        if (expectedRows != UNSET && expectedRows != rows()) {
            throw new ArityMismatchException("matrix export rows", expectedRows, rows());
        }
        if (expectedCols != UNSET && expectedCols != cols()) {
            throw new ArityMismatchException("matrix export columns", expectedCols, cols());
        }
        TypeConverter<E> elementConverter = converter.converterFor(sink.elementType());

        sink.begin(rows(), cols());
        int r = 0;
        for (List<String> row : rowIterable()) {
            int c = 0;
            for (String cell : colIterable(row)) {
                sink.set(r, c, converter.convert(cell, elementConverter));
                c++;
            }
            r++;
        }
        return sink.finish();
    }

    public double[][] toDoubleArray() {
        return exportTo(MatrixSinks.doubleArray());
    }

    // ===== CHECKS =====

    private void checkArity(String operation, int required) {
        if (arity != UNSET && arity != required) {
            throw new ArityMismatchException(operation, arity, required);
        }
        if (cols() != required) {
            throw new ArityMismatchException(operation, cols(), required);
        }
    }

    private void checkCombinable(String operation, DataFrame other) {
        checkSameTable(operation, other);
        if (arity != other.arity) {
            throw ArityMismatchException.pinned(operation, arity, other.arity);
        }
    }

    private void checkSameTable(String operation, DataFrame other) {
        if (other == null) {
            throw new IllegalArgumentException("frame required");
        }
        if (other.table != table) {
            throw new CrossTableException(operation);
        }
    }

    @Override
    public String toString() {
        return new DataFramePrinter().render(this);
    }
}
