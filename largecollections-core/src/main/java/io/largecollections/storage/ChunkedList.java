package io.largecollections.storage;

import io.largecollections.core.CapacityExceededException;
import io.largecollections.core.GrowthPolicy;
import io.largecollections.core.LargeCollectionsConfiguration;
import io.largecollections.kernel.Equivalence;
import io.largecollections.kernel.LargeArray;
import io.largecollections.kernel.LargeList;
import io.largecollections.kernel.MutableLargeArray;
import io.largecollections.kernel.Ranges;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.Iterator;
import java.util.function.Consumer;

/**
 * Growable list addressed by {@code long} indices.
 * <p>
 * Backed by one {@link ChunkedArray} plus a logical count. When an append finds the list
 * full, the capacity grows by the configured {@link GrowthPolicy}: multiplicatively below
 * the fixed grow limit, additively above it.
 * <p>
 * <b>Thread-safety:</b> none. Callers serialize access.
 *
 * @param <T> element type
 */
public final class ChunkedList<T> implements LargeList<T>, ChunkBacked<T> {

    private static final Logger log = LoggerFactory.getLogger(ChunkedList.class);

    private static final long DEFAULT_CAPACITY = 1L;

    private final ChunkedArray<T> elements;
    private final Equivalence<? super T> equivalence;
    private final GrowthPolicy growthPolicy;
    private final long maxCapacity;
    private long count;

    public ChunkedList() {
        this(DEFAULT_CAPACITY, LargeCollectionsConfiguration.defaults());
    }

    public ChunkedList(LargeCollectionsConfiguration configuration) {
        this(DEFAULT_CAPACITY, configuration);
    }

    public ChunkedList(long capacity, LargeCollectionsConfiguration configuration) {
        this(capacity, configuration, Equivalence.natural());
    }

    /**
     * Create an empty list.
     *
     * @param capacity      initial capacity, in {@code [0, configuration.maxCapacity()]}
     * @param configuration chunk layout and growth policy
     * @param equivalence   equality used by {@code contains} and {@code remove}
     */
    public ChunkedList(long capacity, LargeCollectionsConfiguration configuration, Equivalence<? super T> equivalence) {
        this.elements = new ChunkedArray<>(capacity, configuration, equivalence);
        this.equivalence = equivalence;
        this.growthPolicy = configuration.growthPolicy();
        this.maxCapacity = configuration.maxCapacity();
        this.count = 0L;
    }

    /**
     * Create a list holding {@code items} in iteration order.
     */
    public static <T> ChunkedList<T> of(Iterable<? extends T> items) {
        return of(items, LargeCollectionsConfiguration.defaults());
    }

    public static <T> ChunkedList<T> of(Iterable<? extends T> items, LargeCollectionsConfiguration configuration) {
        ChunkedList<T> list = new ChunkedList<>(configuration);
        list.addAll(items);
        return list;
    }

    @Override
    public long count() {
        return count;
    }

    @Override
    public long capacity() {
        return elements.count();
    }

    @Override
    public T get(long index) {
        Ranges.checkIndex(index, count);
        return elements.get(index);
    }

    @Override
    public void set(long index, T item) {
        Ranges.checkIndex(index, count);
        elements.set(index, item);
    }

    @Override
    public void swap(long leftIndex, long rightIndex) {
        Ranges.checkIndex(leftIndex, count);
        Ranges.checkIndex(rightIndex, count);
        elements.swap(leftIndex, rightIndex);
    }

    /**
     * Append an element, growing the capacity first when the list is full.
     *
     * @throws CapacityExceededException if the list already holds the maximum count
     */
    @Override
    public void add(T item) {
        if (count >= maxCapacity) {
            throw new CapacityExceededException(count + 1L, maxCapacity);
        }
        if (count == elements.count()) {
            ensureCapacity(count + 1L);
        }
        elements.set(count, item);
        count++;
    }

    /**
     * Append {@code count} elements of a flat buffer.
     */
    public void addAll(T[] source, int sourceOffset, int count) {
        if (source == null) {
            throw new IllegalArgumentException("source required");
        }
        Ranges.checkRange(sourceOffset, count, source.length);
        ensureRemainingCapacity(count);
        elements.copyFrom(source, sourceOffset, this.count, count);
        this.count += count;
    }

    /**
     * Append a range of another large array. Chunk-backed sources are batch-copied.
     */
    @SuppressWarnings("unchecked")
    public void addAll(LargeArray<T> source, long sourceOffset, long count) {
        if (source == null) {
            throw new IllegalArgumentException("source required");
        }
        Ranges.checkRange(sourceOffset, count, source.count());
        ensureRemainingCapacity(count);
        if (source instanceof ChunkBacked) {
            ((ChunkBacked<T>) source).storage().copyTo(elements.storage(), sourceOffset, this.count, count);
        } else {
            for (long i = 0L; i < count; i++) {
                elements.set(this.count + i, source.get(sourceOffset + i));
            }
        }
        this.count += count;
    }

    /**
     * Remove the element at {@code index}, shifting later elements left and clearing the
     * vacated tail slot. O(n).
     */
    @Override
    public void removeAt(long index) {
        Ranges.checkIndex(index, count);
        long tail = count - index - 1L;
        if (tail > 0L) {
            elements.storage().copyTo(elements.storage(), index + 1L, index, tail);
        }
        elements.set(count - 1L, null);
        count--;
    }

    @Override
    public boolean remove(T item) {
        long index = indexOf(item);
        if (index < 0L) {
            return false;
        }
        removeAt(index);
        return true;
    }

    /**
     * Index of the first element equivalent to {@code item}, or -1.
     */
    public long indexOf(T item) {
        return elements.storage().indexOf(item, 0L, count, equivalence);
    }

    /**
     * Null out every live slot and reset the count. Capacity is unchanged.
     */
    @Override
    public void clear() {
        elements.storage().fill(0L, count, null);
        count = 0L;
    }

    @Override
    public void shrink() {
        resize(count);
    }

    @Override
    public void ensureCapacity(long capacity) {
        Ranges.checkCapacity(capacity, maxCapacity);
        long current = elements.count();
        if (current >= capacity) {
            return;
        }
        long grown = current;
        while (grown < capacity) {
            grown = growthPolicy.grow(grown, maxCapacity);
        }
        resize(grown);
    }

    public void ensureRemainingCapacity(long remaining) {
        if (remaining < 0L) {
            throw new IllegalArgumentException("remaining must be non-negative: " + remaining);
        }
        if (remaining > maxCapacity - count) {
            throw new CapacityExceededException(count + remaining, maxCapacity);
        }
        ensureCapacity(count + remaining);
    }

    @Override
    public boolean contains(T item, long offset, long count) {
        Ranges.checkRange(offset, count, this.count);
        return elements.contains(item, offset, count);
    }

    @Override
    public void forEach(long offset, long count, Consumer<? super T> action) {
        Ranges.checkRange(offset, count, this.count);
        elements.forEach(offset, count, action);
    }

    @Override
    public Iterator<T> iterator(long offset, long count) {
        Ranges.checkRange(offset, count, this.count);
        return elements.iterator(offset, count);
    }

    @Override
    public void sort(long offset, long count, Comparator<? super T> comparator) {
        Ranges.checkRange(offset, count, this.count);
        elements.sort(offset, count, comparator);
    }

    @Override
    public long binarySearch(T item, long offset, long count, Comparator<? super T> comparator) {
        Ranges.checkRange(offset, count, this.count);
        return elements.binarySearch(item, offset, count, comparator);
    }

    @Override
    public void copyTo(MutableLargeArray<T> target, long sourceOffset, long targetOffset, long count) {
        ChunkedArray.copyRange(elements.storage(), this.count, target, sourceOffset, targetOffset, count);
    }

    @Override
    public void copyTo(T[] target, long sourceOffset, int targetOffset, int count) {
        Ranges.checkRange(sourceOffset, count, this.count);
        elements.copyTo(target, sourceOffset, targetOffset, count);
    }

    @Override
    public void copyFrom(T[] source, int sourceOffset, long targetOffset, int count) {
        Ranges.checkRange(targetOffset, count, this.count);
        elements.copyFrom(source, sourceOffset, targetOffset, count);
    }

    @Override
    public ChunkedStorage<T> storage() {
        return elements.storage();
    }

    @Override
    public String toString() {
        return "ChunkedList{count=" + count + ", capacity=" + capacity() + '}';
    }

    private void resize(long capacity) {
        long previous = elements.count();
        if (previous == capacity) {
            return;
        }
        elements.resize(capacity);
        if (log.isDebugEnabled()) {
            log.debug("Resized list capacity {} -> {} (count {})", previous, capacity, count);
        }
    }
}
