package io.memcsv.kernel;

import io.memcsv.core.SizeMismatchException;

import java.util.BitSet;
import java.util.NoSuchElementException;

/**
 * Immutable, fixed-length boolean mask.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>{@code length()} never changes; positions outside {@code [0, length)} are rejected.</li>
 *   <li>Combinators ({@link #and}, {@link #or}, {@link #andNot}) return new masks and
 *       require equal lengths.</li>
 *   <li>{@code enumerator()} yields set positions in ascending order.</li>
 * </ul>
 */
public final class Mask {
    private final BitSet bits;
    private final int length;
    private final int cardinality;

    private Mask(BitSet bits, int length) {
        this.bits = bits;
        this.length = length;
        this.cardinality = bits.cardinality();
    }

    public static Mask allSet(int length) {
        checkLength(length);
        BitSet bits = new BitSet(length);
        bits.set(0, length);
        return new Mask(bits, length);
    }

    public static Mask noneSet(int length) {
        checkLength(length);
        return new Mask(new BitSet(length), length);
    }

    /**
     * Mask of the given length with exactly the given positions set.
     */
    public static Mask of(int length, int... positions) {
        checkLength(length);
        BitSet bits = new BitSet(length);
        for (int position : positions) {
            if (position < 0 || position >= length) {
                throw new IndexOutOfBoundsException("position " + position + " outside mask of length " + length);
            }
            bits.set(position);
        }
        return new Mask(bits, length);
    }

    /**
     * Mask backed by a copy of {@code bits}; bits at or beyond {@code length} must be clear.
     */
    public static Mask fromBits(BitSet bits, int length) {
        checkLength(length);
        if (bits.length() > length) {
            throw new SizeMismatchException("mask bits", length, bits.length());
        }
        return new Mask((BitSet) bits.clone(), length);
    }

    public int length() {
        return length;
    }

    public int cardinality() {
        return cardinality;
    }

    public boolean get(int position) {
        if (position < 0 || position >= length) {
            throw new IndexOutOfBoundsException("position " + position + " outside mask of length " + length);
        }
        return bits.get(position);
    }

    public Mask and(Mask other) {
        BitSet result = copyFor(other);
        result.and(other.bits);
        return new Mask(result, length);
    }

    public Mask or(Mask other) {
        BitSet result = copyFor(other);
        result.or(other.bits);
        return new Mask(result, length);
    }

    public Mask andNot(Mask other) {
        BitSet result = copyFor(other);
        result.andNot(other.bits);
        return new Mask(result, length);
    }

    public int[] toIntArray() {
        int[] values = new int[cardinality];
        int index = 0;
        for (int bit = bits.nextSetBit(0); bit >= 0; bit = bits.nextSetBit(bit + 1)) {
            values[index++] = bit;
        }
        return values;
    }

    public IntEnumerator enumerator() {
        return new IntEnumerator() {
            private int current = bits.nextSetBit(0);

            @Override
            public boolean hasNext() {
                return current >= 0;
            }

            @Override
            public int nextInt() {
                if (current < 0) {
                    throw new NoSuchElementException();
                }
                int value = current;
                current = bits.nextSetBit(current + 1);
                return value;
            }
        };
    }

    /**
     * Index of the first set position at or after {@code from}, or -1.
     */
    int nextSet(int from) {
        return from >= length ? -1 : bits.nextSetBit(from);
    }

    private BitSet copyFor(Mask other) {
        if (other == null) {
            throw new IllegalArgumentException("mask required");
        }
        if (other.length != length) {
            throw new SizeMismatchException("mask combination", length, other.length);
        }
        return (BitSet) bits.clone();
    }

    private static void checkLength(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Mask)) {
            return false;
        }
        Mask other = (Mask) o;
        return length == other.length && bits.equals(other.bits);
    }

    @Override
    public int hashCode() {
        return 31 * bits.hashCode() + length;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(length + 2);
        sb.append('[');
        for (int i = 0; i < length; i++) {
            sb.append(bits.get(i) ? '1' : '0');
        }
        return sb.append(']').toString();
    }
}
