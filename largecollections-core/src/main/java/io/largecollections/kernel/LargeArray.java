package io.largecollections.kernel;

import java.util.Comparator;
import java.util.Iterator;
import java.util.function.Consumer;

/**
 * Read-only, index-addressable large collection.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>Valid indices are {@code [0, count())}; anything else raises {@link IndexOutOfBoundsException}.</li>
 *   <li>Every range argument is {@code (offset, count)} and is checked, never clamped.</li>
 *   <li>binarySearch() requires the searched range to be sorted ascending by the same
 *       comparator. On an unsorted range the result is undefined.</li>
 * </ul>
 *
 * @param <T> element type
 */
public interface LargeArray<T> extends LargeCollection<T> {

    /**
     * Returns the element at a logical index.
     * @param index 0-based index
     * @return element (may be null)
     */
    T get(long index);

    boolean contains(T item, long offset, long count);

    @Override
    default boolean contains(T item) {
        return contains(item, 0L, count());
    }

    void forEach(long offset, long count, Consumer<? super T> action);

    @Override
    default void forEach(Consumer<? super T> action) {
        forEach(0L, count(), action);
    }

    /**
     * Lazy iterator over {@code [offset, offset + count)}.
     */
    Iterator<T> iterator(long offset, long count);

    @Override
    default Iterator<T> iterator() {
        return iterator(0L, count());
    }

    /**
     * Binary search over {@code [offset, offset + count)}.
     *
     * @return index of a matching element, or {@code -(insertionPoint + 1)} when absent
     */
    long binarySearch(T item, long offset, long count, Comparator<? super T> comparator);

    default long binarySearch(T item, Comparator<? super T> comparator) {
        return binarySearch(item, 0L, count(), comparator);
    }

    /**
     * Binary search using the natural ordering of the elements.
     */
    default long binarySearch(T item) {
        return binarySearch(item, 0L, count(), naturalOrder());
    }

    /**
     * Copy {@code count} elements starting at {@code sourceOffset} into {@code target}
     * starting at {@code targetOffset}.
     */
    void copyTo(MutableLargeArray<T> target, long sourceOffset, long targetOffset, long count);

    /**
     * Copy {@code count} elements starting at {@code sourceOffset} into a flat buffer.
     */
    void copyTo(T[] target, long sourceOffset, int targetOffset, int count);

    @SuppressWarnings("unchecked")
    static <T> Comparator<? super T> naturalOrder() {
        return (Comparator<? super T>) Comparator.naturalOrder();
    }
}
