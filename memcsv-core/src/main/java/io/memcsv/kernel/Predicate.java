package io.memcsv.kernel;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Row filter evaluated against the active columns of a frame.
 */
public sealed interface Predicate permits Predicate.Comparison, Predicate.In {

    enum Operator {
        EQ("=="),
        NEQ("!="),
        LT("<"),
        LTE("<="),
        GT(">"),
        GTE(">=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        /**
         * Whether this operator needs {@link Comparable} reference values.
         */
        public boolean isOrdering() {
            return this != EQ && this != NEQ;
        }

        /**
         * Test one converted cell against its reference value.
         * <p>
         * {@code NEQ} is never evaluated per cell: it negates the whole-row {@code EQ}
         * result, so callers evaluate {@code EQ} instead.
         */
        @SuppressWarnings({"unchecked", "rawtypes"})
        public boolean test(Object cell, Object reference) {
            if (this == NEQ) {
                throw new IllegalStateException("NEQ is evaluated as the negation of EQ per row");
            }
            if (cell == null) {
                return false;
            }
            // floating point keeps primitive semantics: -0.0 == 0.0, NaN matches nothing
            if ((cell instanceof Double || cell instanceof Float) && cell.getClass() == reference.getClass()) {
                double a = ((Number) cell).doubleValue();
                double b = ((Number) reference).doubleValue();
                switch (this) {
                    case EQ:
                        return a == b;
                    case LT:
                        return a < b;
                    case LTE:
                        return a <= b;
                    case GT:
                        return a > b;
                    default:
                        return a >= b;
                }
            }
            if (this == EQ) {
                if (cell instanceof Comparable && cell.getClass() == reference.getClass()) {
                    return ((Comparable) cell).compareTo(reference) == 0;
                }
                return cell.equals(reference);
            }
            int cmp = ((Comparable) cell).compareTo(reference);
            switch (this) {
                case LT:
                    return cmp < 0;
                case LTE:
                    return cmp <= 0;
                case GT:
                    return cmp > 0;
                default:
                    return cmp >= 0;
            }
        }
    }

    /**
     * Compare every active column with the reference at the same position.
     */
    record Comparison(Operator operator, List<Object> references) implements Predicate {
        public Comparison {
            if (operator == null) {
                throw new IllegalArgumentException("operator required");
            }
            if (references == null) {
                throw new IllegalArgumentException("references required");
            }
            for (Object reference : references) {
                if (reference == null) {
                    throw new IllegalArgumentException("reference values must not be null");
                }
                if (operator.isOrdering() && !(reference instanceof Comparable)) {
                    throw new IllegalArgumentException(
                            "operator " + operator.symbol() + " requires comparable references, got "
                                    + reference.getClass().getName());
                }
            }
            references = List.copyOf(references);
        }

        public static Comparison of(Operator operator, Object... references) {
            if (references == null) {
                throw new IllegalArgumentException("references required");
            }
            return new Comparison(operator, Arrays.asList(references));
        }

        public int arity() {
            return references.size();
        }
    }

    /**
     * Keep rows whose single active column converts to a member of {@code values}.
     */
    record In(Collection<?> values) implements Predicate {
        public In {
            if (values == null) {
                throw new IllegalArgumentException("values required");
            }
        }
    }
}
