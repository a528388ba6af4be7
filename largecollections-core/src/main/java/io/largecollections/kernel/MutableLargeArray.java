package io.largecollections.kernel;

import java.util.Comparator;

/**
 * Large array whose slots can be written and reordered in place.
 *
 * @param <T> element type
 */
public interface MutableLargeArray<T> extends LargeArray<T> {

    /**
     * Stores an element at a logical index.
     * @param index 0-based index
     * @param item element (may be null)
     */
    void set(long index, T item);

    void swap(long leftIndex, long rightIndex);

    /**
     * Sorts {@code [offset, offset + count)} ascending. Heap sort: in place, not stable.
     */
    void sort(long offset, long count, Comparator<? super T> comparator);

    default void sort(Comparator<? super T> comparator) {
        sort(0L, count(), comparator);
    }

    default void sort() {
        sort(0L, count(), LargeArray.naturalOrder());
    }

    default void copyFrom(LargeArray<T> source, long sourceOffset, long targetOffset, long count) {
        if (source == null) {
            throw new IllegalArgumentException("source required");
        }
        source.copyTo(this, sourceOffset, targetOffset, count);
    }

    /**
     * Copy {@code count} elements of a flat buffer into this array.
     */
    void copyFrom(T[] source, int sourceOffset, long targetOffset, int count);
}
