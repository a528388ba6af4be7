package io.largecollections.storage;

import io.largecollections.core.LargeCollectionsConfiguration;
import io.largecollections.kernel.Equivalence;
import io.largecollections.kernel.MutableLargeArray;
import io.largecollections.kernel.Ranges;

import java.util.Comparator;
import java.util.Iterator;
import java.util.function.Consumer;

/**
 * Fixed-size array addressed by {@code long} indices.
 * <p>
 * The count always equals the capacity; {@link #resize(long)} changes both. Slots that have
 * never been written hold {@code null}.
 * <p>
 * <b>Thread-safety:</b> none. Callers serialize access.
 *
 * @param <T> element type
 */
public final class ChunkedArray<T> implements MutableLargeArray<T>, ChunkBacked<T> {

    private final LargeCollectionsConfiguration configuration;
    private final Equivalence<? super T> equivalence;
    private final ChunkedStorage<T> storage;

    public ChunkedArray(long capacity) {
        this(capacity, LargeCollectionsConfiguration.defaults());
    }

    public ChunkedArray(long capacity, LargeCollectionsConfiguration configuration) {
        this(capacity, configuration, Equivalence.natural());
    }

    /**
     * Create an array.
     *
     * @param capacity      number of slots, in {@code [0, configuration.maxCapacity()]}
     * @param configuration chunk layout
     * @param equivalence   equality used by {@code contains}
     */
    public ChunkedArray(long capacity, LargeCollectionsConfiguration configuration, Equivalence<? super T> equivalence) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        if (equivalence == null) {
            throw new IllegalArgumentException("equivalence required");
        }
        this.configuration = configuration;
        this.equivalence = equivalence;
        this.storage = new ChunkedStorage<>(capacity, configuration);
    }

    @Override
    public long count() {
        return storage.capacity();
    }

    public LargeCollectionsConfiguration configuration() {
        return configuration;
    }

    /**
     * Change the size, preserving elements below {@code min(count, capacity)}.
     *
     * @param capacity new size, in {@code [0, maxCapacity]}
     */
    public void resize(long capacity) {
        storage.resize(capacity);
    }

    @Override
    public T get(long index) {
        return storage.get(index);
    }

    @Override
    public void set(long index, T item) {
        storage.set(index, item);
    }

    @Override
    public void swap(long leftIndex, long rightIndex) {
        storage.swap(leftIndex, rightIndex);
    }

    @Override
    public boolean contains(T item, long offset, long count) {
        return storage.contains(item, offset, count, equivalence);
    }

    @Override
    public void forEach(long offset, long count, Consumer<? super T> action) {
        storage.forEach(offset, count, action);
    }

    @Override
    public Iterator<T> iterator(long offset, long count) {
        return storage.iterator(offset, count);
    }

    @Override
    public void sort(long offset, long count, Comparator<? super T> comparator) {
        storage.sort(offset, count, comparator);
    }

    @Override
    public long binarySearch(T item, long offset, long count, Comparator<? super T> comparator) {
        return storage.binarySearch(item, offset, count, comparator);
    }

    @Override
    public void copyTo(MutableLargeArray<T> target, long sourceOffset, long targetOffset, long count) {
        copyRange(storage, storage.capacity(), target, sourceOffset, targetOffset, count);
    }

    @Override
    public void copyTo(T[] target, long sourceOffset, int targetOffset, int count) {
        storage.copyTo(target, sourceOffset, targetOffset, count);
    }

    @Override
    public void copyFrom(T[] source, int sourceOffset, long targetOffset, int count) {
        storage.copyFrom(source, sourceOffset, targetOffset, count);
    }

    @Override
    public ChunkedStorage<T> storage() {
        return storage;
    }

    @Override
    public String toString() {
        return "ChunkedArray{count=" + count() + ", chunks=" + storage.chunkCount() + '}';
    }

    /**
     * Copy from chunked storage into any mutable large array, batch-copying when the target is
     * itself chunk-backed.
     */
    @SuppressWarnings("unchecked")
    static <T> void copyRange(ChunkedStorage<T> source, long sourceCount, MutableLargeArray<T> target,
                              long sourceOffset, long targetOffset, long count) {
        if (target == null) {
            throw new IllegalArgumentException("target required");
        }
        Ranges.checkRange(sourceOffset, count, sourceCount);
        Ranges.checkRange(targetOffset, count, target.count());
        if (target instanceof ChunkBacked) {
            source.copyTo(((ChunkBacked<T>) target).storage(), sourceOffset, targetOffset, count);
            return;
        }
        // element-wise; overlapping ranges through a span over the same storage are not supported
        for (long i = 0L; i < count; i++) {
            target.set(targetOffset + i, source.get(sourceOffset + i));
        }
    }
}
