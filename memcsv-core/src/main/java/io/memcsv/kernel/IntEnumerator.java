package io.memcsv.kernel;

public interface IntEnumerator {
    boolean hasNext();

    int nextInt();
}
