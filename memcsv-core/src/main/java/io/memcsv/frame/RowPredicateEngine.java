package io.memcsv.frame;

import io.memcsv.core.converter.CellConverter;
import io.memcsv.core.converter.TypeConverter;
import io.memcsv.kernel.CsvTable;
import io.memcsv.kernel.IntEnumerator;
import io.memcsv.kernel.Mask;
import io.memcsv.kernel.MaskedIterable;
import io.memcsv.kernel.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.BitSet;
import java.util.Collection;
import java.util.List;

/**
 * Evaluates a {@link Predicate} row by row and produces the surviving row mask.
 * <p>
 * Only rows set in the input row mask are visited; cells are read through the
 * column mask in column order and converted to the type of the reference they are
 * compared with. A row survives a comparison only if every column passes.
 */
final class RowPredicateEngine {
    private static final Logger log = LoggerFactory.getLogger(RowPredicateEngine.class);

    private final CellConverter converter;

    RowPredicateEngine(CellConverter converter) {
        this.converter = converter;
    }

    Mask evaluate(CsvTable table, Mask rowMask, Mask colMask, Predicate predicate) {
        if (predicate instanceof Predicate.Comparison) {
            return evaluateComparison(table, rowMask, colMask, (Predicate.Comparison) predicate);
        }
        if (predicate instanceof Predicate.In) {
            return evaluateIn(table, rowMask, colMask, (Predicate.In) predicate);
        }
        throw new IllegalArgumentException("Unsupported predicate: " + predicate);
    }

    private Mask evaluateComparison(CsvTable table, Mask rowMask, Mask colMask, Predicate.Comparison comparison) {
        List<Object> references = comparison.references();
        TypeConverter<?>[] converters = new TypeConverter<?>[references.size()];
        for (int i = 0; i < converters.length; i++) {
            converters[i] = converter.converterFor(references.get(i).getClass());
        }

        // NEQ negates the whole-row EQ result
        boolean negate = comparison.operator() == Predicate.Operator.NEQ;
        Predicate.Operator operator = negate ? Predicate.Operator.EQ : comparison.operator();

        List<List<String>> rows = table.rows();
        BitSet matched = new BitSet(rows.size());
        IntEnumerator included = rowMask.enumerator();
        while (included.hasNext()) {
            int rowIndex = included.nextInt();
            if (rowMatches(rows.get(rowIndex), colMask, operator, references, converters)) {
                matched.set(rowIndex);
            }
        }

        Mask matchedMask = Mask.fromBits(matched, rows.size());
        Mask result = negate ? rowMask.andNot(matchedMask) : matchedMask;
        if (log.isTraceEnabled()) {
            log.trace("{} {} kept {} of {} rows", comparison.operator().symbol(), references,
                    result.cardinality(), rowMask.cardinality());
        }
        return result;
    }

    private boolean rowMatches(List<String> row, Mask colMask, Predicate.Operator operator,
            List<Object> references, TypeConverter<?>[] converters) {
        int position = 0;
        for (String cell : MaskedIterable.of(row, colMask)) {
            Object value = converter.convert(cell, converters[position]);
            if (!operator.test(value, references.get(position))) {
                return false;
            }
            position++;
        }
        return true;
    }

    private Mask evaluateIn(CsvTable table, Mask rowMask, Mask colMask, Predicate.In in) {
        Collection<?> values = in.values();
        int rowCount = table.rowCount();
        if (values.isEmpty()) {
            return Mask.noneSet(rowCount);
        }
        Class<?> elementType = elementType(values);
        TypeConverter<?> elementConverter = converter.converterFor(elementType);
        boolean floatingPoint = elementType == Double.class || elementType == Float.class;
        int column = colMask.enumerator().nextInt();

        List<List<String>> rows = table.rows();
        BitSet matched = new BitSet(rowCount);
        IntEnumerator included = rowMask.enumerator();
        while (included.hasNext()) {
            int rowIndex = included.nextInt();
            Object value = converter.convert(rows.get(rowIndex).get(column), elementConverter);
            if (value != null && isMember(value, values, floatingPoint)) {
                matched.set(rowIndex);
            }
        }
        return Mask.fromBits(matched, rowCount);
    }

    // equals() tells -0.0 from 0.0 and matches NaN, so floating-point members go through EQ
    private static boolean isMember(Object value, Collection<?> values, boolean floatingPoint) {
        if (!floatingPoint) {
            return values.contains(value);
        }
        for (Object member : values) {
            if (Predicate.Operator.EQ.test(value, member)) {
                return true;
            }
        }
        return false;
    }

    private static Class<?> elementType(Collection<?> values) {
        Class<?> type = null;
        for (Object value : values) {
            if (value == null) {
                throw new IllegalArgumentException("membership values must not be null");
            }
            if (type == null) {
                type = value.getClass();
            } else if (type != value.getClass()) {
                throw new IllegalArgumentException("membership values must share one type, found "
                        + type.getSimpleName() + " and " + value.getClass().getSimpleName());
            }
        }
        return type;
    }
}
