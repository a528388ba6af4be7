package io.largecollections.kernel;

/**
 * Large collection that supports insertion and removal.
 *
 * @param <T> element type
 */
public interface MutableLargeCollection<T> extends LargeCollection<T> {

    /**
     * Adds an element. Set-like implementations replace an equivalent element in place.
     * @param item the element to add
     * @throws io.largecollections.core.CapacityExceededException if the collection is full
     */
    void add(T item);

    default void addAll(Iterable<? extends T> items) {
        if (items == null) {
            throw new IllegalArgumentException("items required");
        }
        for (T item : items) {
            add(item);
        }
    }

    /**
     * Removes the first equivalent element.
     * @param item the element to remove
     * @return true if an element was removed
     */
    boolean remove(T item);

    default void removeAll(Iterable<? extends T> items) {
        if (items == null) {
            throw new IllegalArgumentException("items required");
        }
        for (T item : items) {
            remove(item);
        }
    }

    /**
     * Removes all elements. Capacity is left unchanged.
     */
    void clear();
}
