package io.memcsv.frame;

@FunctionalInterface
public interface RowMapper<R> {
    R map(FrameRow row);
}
