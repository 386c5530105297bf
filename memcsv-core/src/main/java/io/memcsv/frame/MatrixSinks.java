package io.memcsv.frame;

/**
 * Built-in {@link MatrixSink} implementations backed by plain Java arrays.
 */
public final class MatrixSinks {

    private MatrixSinks() {
    }

    public static MatrixSink<Double, double[][]> doubleArray() {
        return new DoubleArraySink();
    }

    public static MatrixSink<Long, long[][]> longArray() {
        return new LongArraySink();
    }

    private static final class DoubleArraySink implements MatrixSink<Double, double[][]> {
        private double[][] values;

        @Override
        public Class<Double> elementType() {
            return Double.class;
        }

        @Override
        public void begin(int rows, int cols) {
            values = new double[rows][cols];
        }

        @Override
        public void set(int row, int col, Double value) {
            values[row][col] = value;
        }

        @Override
        public double[][] finish() {
            return values;
        }
    }

    private static final class LongArraySink implements MatrixSink<Long, long[][]> {
        private long[][] values;

        @Override
        public Class<Long> elementType() {
            return Long.class;
        }

        @Override
        public void begin(int rows, int cols) {
            values = new long[rows][cols];
        }

        @Override
        public void set(int row, int col, Long value) {
            values[row][col] = value;
        }

        @Override
        public long[][] finish() {
            return values;
        }
    }
}
