package io.largecollections.kernel;

/**
 * Growable large array with a logical count separate from its capacity.
 *
 * @param <T> element type
 */
public interface LargeList<T> extends MutableLargeArray<T>, MutableLargeCollection<T> {

    /**
     * Removes the element at {@code index}, shifting later elements left by one.
     */
    void removeAt(long index);

    long capacity();

    /**
     * Ensures the capacity is at least {@code capacity}, growing by the configured policy.
     */
    void ensureCapacity(long capacity);

    /**
     * Reduces the capacity to the current count.
     */
    void shrink();
}
