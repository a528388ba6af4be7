package io.largecollections.kernel;

import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Read-only view of a collection that may hold more than {@code Integer.MAX_VALUE} elements.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>count() is the number of live elements, never the allocated capacity.</li>
 *   <li>iterator() starts a fresh, lazy traversal on every call.</li>
 *   <li>Several iterators may traverse an unmodified collection independently.</li>
 *   <li>Implementations are not synchronized.</li>
 * </ul>
 *
 * @param <T> element type
 */
public interface LargeCollection<T> extends Iterable<T> {

    /**
     * Returns the number of live elements.
     * @return element count (always non-negative)
     */
    long count();

    /**
     * Tests if an equivalent element is present.
     * @param item the element to look for
     * @return true if present
     */
    boolean contains(T item);

    default boolean isEmpty() {
        return count() == 0L;
    }

    /**
     * Sequential stream over the elements, in iteration order.
     */
    default Stream<T> stream() {
        return StreamSupport.stream(
                Spliterators.spliterator(iterator(), count(), Spliterator.ORDERED), false);
    }
}
