package io.memcsv.kernel;

import io.memcsv.core.SizeMismatchException;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy view over the elements of a list whose mask position is set.
 * <p>
 * Each call to {@link #iterator()} starts from the beginning. Leading masked-out
 * elements are skipped before the first element is produced, and iteration never
 * reads past the end of the list. Used both for rows of a table and for cells of a row.
 *
 * @param <T> element type
 */
public final class MaskedIterable<T> implements Iterable<T> {
    private final List<T> container;
    private final Mask mask;

    private MaskedIterable(List<T> container, Mask mask) {
        this.container = container;
        this.mask = mask;
    }

    /**
     * @throws SizeMismatchException if the list and the mask differ in length
     */
    public static <T> MaskedIterable<T> of(List<T> container, Mask mask) {
        if (container == null) {
            throw new IllegalArgumentException("container required");
        }
        if (mask == null) {
            throw new IllegalArgumentException("mask required");
        }
        if (container.size() != mask.length()) {
            throw new SizeMismatchException("masked iterable", mask.length(), container.size());
        }
        return new MaskedIterable<>(container, mask);
    }

    /**
     * Number of elements this iterable yields.
     */
    public int size() {
        return mask.cardinality();
    }

    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            private int position = mask.nextSet(0);

            @Override
            public boolean hasNext() {
                return position >= 0 && position < container.size();
            }

            @Override
            public T next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                T value = container.get(position);
                position = mask.nextSet(position + 1);
                return value;
            }
        };
    }
}
