package io.memcsv.frame;

/**
 * Target of a numeric export. The frame calls {@link #begin} once with its extent,
 * then {@link #set} for every cell in row-major order, then {@link #finish}.
 *
 * @param <E> numeric element type the cells are converted to
 * @param <S> the structure produced
 */
public interface MatrixSink<E extends Number, S> {

    Class<E> elementType();

    void begin(int rows, int cols);

    void set(int row, int col, E value);

    S finish();
}
