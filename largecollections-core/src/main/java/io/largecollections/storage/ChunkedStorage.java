package io.largecollections.storage;

import io.largecollections.core.InvalidConfigurationException;
import io.largecollections.core.LargeCollectionsConfiguration;
import io.largecollections.kernel.Equivalence;
import io.largecollections.kernel.Ranges;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Consumer;

/**
 * Element storage split over an ordered sequence of bounded Java arrays ("chunks").
 * <p>
 * Every chunk but the last holds exactly {@code chunkSize} elements; the last holds the
 * remainder ({@code chunkSize} when the capacity divides evenly). A capacity of zero has no
 * chunks. A logical index maps to {@code (index / chunkSize, index % chunkSize)}.
 * <p>
 * Range operations walk chunk by chunk, so their loop overhead is bounded by the number of
 * chunk boundaries crossed rather than by the element count.
 * <p>
 * <b>Thread-safety:</b> none. Callers serialize access.
 *
 * @param <T> element type
 */
public final class ChunkedStorage<T> {

    private static final Object[][] NO_CHUNKS = new Object[0][];

    private final int chunkSize;
    private final long maxCapacity;
    private Object[][] chunks;
    private long capacity;

    /**
     * Create storage with the chunk size of the given configuration.
     *
     * @param capacity      number of slots, in {@code [0, maxCapacity]}
     * @param configuration source of the chunk size
     */
    public ChunkedStorage(long capacity, LargeCollectionsConfiguration configuration) {
        this(capacity, configuration.chunkSize());
    }

    /**
     * Create storage.
     *
     * @param capacity  number of slots, in {@code [0, chunkSize²]}
     * @param chunkSize maximum chunk length
     */
    public ChunkedStorage(long capacity, int chunkSize) {
        if (chunkSize < 1 || chunkSize > LargeCollectionsConfiguration.MAX_CHUNK_SIZE) {
            throw new InvalidConfigurationException("chunkSize out of range: " + chunkSize);
        }
        this.chunkSize = chunkSize;
        this.maxCapacity = (long) chunkSize * (long) chunkSize;
        Ranges.checkCapacity(capacity, maxCapacity);
        this.chunks = allocate(capacity, null);
        this.capacity = capacity;
    }

    public long capacity() {
        return capacity;
    }

    public int chunkSize() {
        return chunkSize;
    }

    public long maxCapacity() {
        return maxCapacity;
    }

    public int chunkCount() {
        return chunks.length;
    }

    public int chunkLength(int chunkIndex) {
        if (chunkIndex < 0 || chunkIndex >= chunks.length) {
            throw new IndexOutOfBoundsException("chunkIndex out of range: " + chunkIndex);
        }
        return chunks[chunkIndex].length;
    }

    /**
     * Chunk holding {@code index}.
     *
     * @throws IndexOutOfBoundsException if {@code index} is outside {@code [0, capacity)}
     */
    public int chunkIndex(long index) {
        Ranges.checkIndex(index, capacity);
        return (int) (index / chunkSize);
    }

    /**
     * Position of {@code index} inside its chunk.
     *
     * @throws IndexOutOfBoundsException if {@code index} is outside {@code [0, capacity)}
     */
    public int offsetInChunk(long index) {
        Ranges.checkIndex(index, capacity);
        return (int) (index % chunkSize);
    }

    @SuppressWarnings("unchecked")
    public T get(long index) {
        Ranges.checkIndex(index, capacity);
        return (T) chunks[(int) (index / chunkSize)][(int) (index % chunkSize)];
    }

    public void set(long index, T value) {
        Ranges.checkIndex(index, capacity);
        chunks[(int) (index / chunkSize)][(int) (index % chunkSize)] = value;
    }

    public void swap(long leftIndex, long rightIndex) {
        Ranges.checkIndex(leftIndex, capacity);
        Ranges.checkIndex(rightIndex, capacity);
        swapUnchecked(leftIndex, rightIndex);
    }

    /**
     * Change the capacity, preserving every element below {@code min(old, new)} at its
     * logical index. Slots added by growing hold {@code null}.
     *
     * @param newCapacity new capacity, in {@code [0, maxCapacity]}
     */
    public void resize(long newCapacity) {
        Ranges.checkCapacity(newCapacity, maxCapacity);
        if (newCapacity == capacity) {
            return;
        }
        chunks = allocate(newCapacity, chunks);
        capacity = newCapacity;
    }

    /**
     * Copy a range into another chunked storage, batch by batch.
     * <p>
     * Each batch is bounded by the end of the current source chunk, the end of the current
     * target chunk and the remaining count. Overlapping ranges within the same storage are
     * handled in either direction.
     */
    public void copyTo(ChunkedStorage<? super T> target, long sourceOffset, long targetOffset, long count) {
        if (target == null) {
            throw new IllegalArgumentException("target required");
        }
        Ranges.checkRange(sourceOffset, count, capacity);
        Ranges.checkRange(targetOffset, count, target.capacity);
        if (count == 0L) {
            return;
        }
        if (target == this && targetOffset > sourceOffset && targetOffset < sourceOffset + count) {
            copyBackward(sourceOffset, targetOffset, count);
            return;
        }
        long copied = 0L;
        while (copied < count) {
            long sourceIndex = sourceOffset + copied;
            long targetIndex = targetOffset + copied;
            Object[] sourceChunk = chunks[(int) (sourceIndex / chunkSize)];
            int sourcePosition = (int) (sourceIndex % chunkSize);
            Object[] targetChunk = target.chunks[(int) (targetIndex / target.chunkSize)];
            int targetPosition = (int) (targetIndex % target.chunkSize);

            int batch = Math.min(sourceChunk.length - sourcePosition, targetChunk.length - targetPosition);
            batch = (int) Math.min(batch, count - copied);

            System.arraycopy(sourceChunk, sourcePosition, targetChunk, targetPosition, batch);
            copied += batch;
        }
    }

    /**
     * Copy a range into a flat buffer.
     */
    public void copyTo(T[] target, long sourceOffset, int targetOffset, int count) {
        if (target == null) {
            throw new IllegalArgumentException("target required");
        }
        Ranges.checkRange(sourceOffset, count, capacity);
        Ranges.checkRange(targetOffset, count, target.length);
        int copied = 0;
        while (copied < count) {
            long sourceIndex = sourceOffset + copied;
            Object[] sourceChunk = chunks[(int) (sourceIndex / chunkSize)];
            int sourcePosition = (int) (sourceIndex % chunkSize);
            int batch = Math.min(sourceChunk.length - sourcePosition, count - copied);
            System.arraycopy(sourceChunk, sourcePosition, target, targetOffset + copied, batch);
            copied += batch;
        }
    }

    /**
     * Copy a range of a flat buffer into this storage.
     */
    public void copyFrom(T[] source, int sourceOffset, long targetOffset, int count) {
        if (source == null) {
            throw new IllegalArgumentException("source required");
        }
        Ranges.checkRange(sourceOffset, count, source.length);
        Ranges.checkRange(targetOffset, count, capacity);
        int copied = 0;
        while (copied < count) {
            long targetIndex = targetOffset + copied;
            Object[] targetChunk = chunks[(int) (targetIndex / chunkSize)];
            int targetPosition = (int) (targetIndex % chunkSize);
            int batch = Math.min(targetChunk.length - targetPosition, count - copied);
            System.arraycopy(source, sourceOffset + copied, targetChunk, targetPosition, batch);
            copied += batch;
        }
    }

    /**
     * Visit {@code [offset, offset + count)} in index order.
     */
    @SuppressWarnings("unchecked")
    public void forEach(long offset, long count, Consumer<? super T> action) {
        if (action == null) {
            throw new IllegalArgumentException("action required");
        }
        Ranges.checkRange(offset, count, capacity);
        long visited = 0L;
        while (visited < count) {
            long index = offset + visited;
            Object[] chunk = chunks[(int) (index / chunkSize)];
            int start = (int) (index % chunkSize);
            int end = (int) Math.min(chunk.length, start + (count - visited));
            for (int i = start; i < end; i++) {
                action.accept((T) chunk[i]);
            }
            visited += end - start;
        }
    }

    /**
     * Store {@code value} in every slot of {@code [offset, offset + count)}.
     */
    public void fill(long offset, long count, T value) {
        Ranges.checkRange(offset, count, capacity);
        long filled = 0L;
        while (filled < count) {
            long index = offset + filled;
            Object[] chunk = chunks[(int) (index / chunkSize)];
            int start = (int) (index % chunkSize);
            int end = (int) Math.min(chunk.length, start + (count - filled));
            Arrays.fill(chunk, start, end, value);
            filled += end - start;
        }
    }

    /**
     * Lazy iterator over {@code [offset, offset + count)}. Each call starts a new traversal.
     */
    public Iterator<T> iterator(long offset, long count) {
        Ranges.checkRange(offset, count, capacity);
        return new ChunkIterator(offset, count);
    }

    /**
     * Linear scan of {@code [offset, offset + count)} in chunk order.
     */
    public boolean contains(T item, long offset, long count, Equivalence<? super T> equivalence) {
        return indexOf(item, offset, count, equivalence) >= 0L;
    }

    /**
     * Index of the first element in {@code [offset, offset + count)} equivalent to {@code item}.
     *
     * @return absolute index, or -1 when absent
     */
    @SuppressWarnings("unchecked")
    public long indexOf(T item, long offset, long count, Equivalence<? super T> equivalence) {
        if (equivalence == null) {
            throw new IllegalArgumentException("equivalence required");
        }
        Ranges.checkRange(offset, count, capacity);
        long scanned = 0L;
        while (scanned < count) {
            long index = offset + scanned;
            Object[] chunk = chunks[(int) (index / chunkSize)];
            int start = (int) (index % chunkSize);
            int end = (int) Math.min(chunk.length, start + (count - scanned));
            for (int i = start; i < end; i++) {
                if (equivalence.equivalent(item, (T) chunk[i])) {
                    return index + (i - start);
                }
            }
            scanned += end - start;
        }
        return -1L;
    }

    /**
     * In-place heap sort of {@code [offset, offset + count)}.
     * <p>
     * Builds a max-heap by sifting down from the midpoint to the range start, then
     * repeatedly swaps the root with the shrinking right boundary and re-sifts.
     * O(n log n) comparisons, no extra allocation, not stable.
     */
    public void sort(long offset, long count, Comparator<? super T> comparator) {
        if (comparator == null) {
            throw new IllegalArgumentException("comparator required");
        }
        Ranges.checkRange(offset, count, capacity);
        if (count < 2L) {
            return;
        }
        for (long root = count / 2L - 1L; root >= 0L; root--) {
            siftDown(offset, root, count, comparator);
        }
        for (long end = count - 1L; end > 0L; end--) {
            swapUnchecked(offset, offset + end);
            siftDown(offset, 0L, end, comparator);
        }
    }

    /**
     * Binary search of a range sorted ascending by {@code comparator}.
     *
     * @return absolute index of a matching element, or {@code -(insertionPoint + 1)}
     */
    @SuppressWarnings("unchecked")
    public long binarySearch(T item, long offset, long count, Comparator<? super T> comparator) {
        if (comparator == null) {
            throw new IllegalArgumentException("comparator required");
        }
        Ranges.checkRange(offset, count, capacity);
        long low = offset;
        long high = offset + count - 1L;
        while (low <= high) {
            long mid = low + ((high - low) >>> 1);
            T midItem = (T) chunks[(int) (mid / chunkSize)][(int) (mid % chunkSize)];
            int result = comparator.compare(item, midItem);
            if (result == 0) {
                return mid;
            }
            if (result < 0) {
                high = mid - 1L;
            } else {
                low = mid + 1L;
            }
        }
        return -(low + 1L);
    }

    @SuppressWarnings("unchecked")
    private void siftDown(long base, long root, long size, Comparator<? super T> comparator) {
        long current = root;
        while (true) {
            long left = 2L * current + 1L;
            if (left >= size) {
                return;
            }
            long largest = current;
            T largestItem = (T) slot(base + current);
            T leftItem = (T) slot(base + left);
            if (comparator.compare(largestItem, leftItem) < 0) {
                largest = left;
                largestItem = leftItem;
            }
            long right = left + 1L;
            if (right < size && comparator.compare(largestItem, (T) slot(base + right)) < 0) {
                largest = right;
            }
            if (largest == current) {
                return;
            }
            swapUnchecked(base + current, base + largest);
            current = largest;
        }
    }

    private Object slot(long index) {
        return chunks[(int) (index / chunkSize)][(int) (index % chunkSize)];
    }

    private void swapUnchecked(long leftIndex, long rightIndex) {
        Object[] leftChunk = chunks[(int) (leftIndex / chunkSize)];
        int leftPosition = (int) (leftIndex % chunkSize);
        Object[] rightChunk = chunks[(int) (rightIndex / chunkSize)];
        int rightPosition = (int) (rightIndex % chunkSize);
        Object swap = leftChunk[leftPosition];
        leftChunk[leftPosition] = rightChunk[rightPosition];
        rightChunk[rightPosition] = swap;
    }

    private void copyBackward(long sourceOffset, long targetOffset, long count) {
        long remaining = count;
        while (remaining > 0L) {
            // last index of the batch, walking from the end of both ranges
            long sourceLast = sourceOffset + remaining - 1L;
            long targetLast = targetOffset + remaining - 1L;
            int sourcePosition = (int) (sourceLast % chunkSize);
            int targetPosition = (int) (targetLast % chunkSize);
            int batch = (int) Math.min(Math.min(sourcePosition, targetPosition) + 1L, remaining);
            System.arraycopy(
                    chunks[(int) (sourceLast / chunkSize)], sourcePosition - batch + 1,
                    chunks[(int) (targetLast / chunkSize)], targetPosition - batch + 1,
                    batch);
            remaining -= batch;
        }
    }

    private Object[][] allocate(long newCapacity, Object[][] previous) {
        if (newCapacity == 0L) {
            return NO_CHUNKS;
        }
        int chunkCount = (int) ((newCapacity + chunkSize - 1L) / chunkSize);
        int lastLength = (int) (newCapacity - (long) (chunkCount - 1) * chunkSize);
        Object[][] result = new Object[chunkCount][];
        for (int i = 0; i < chunkCount; i++) {
            int length = i == chunkCount - 1 ? lastLength : chunkSize;
            if (previous == null || i >= previous.length) {
                result[i] = new Object[length];
            } else if (previous[i].length == length) {
                result[i] = previous[i];
            } else {
                result[i] = Arrays.copyOf(previous[i], length);
            }
        }
        return result;
    }

    private final class ChunkIterator implements Iterator<T> {
        private final long end;
        private long next;
        private Object[] chunk;
        private int position;

        private ChunkIterator(long offset, long count) {
            this.next = offset;
            this.end = offset + count;
            if (count > 0L) {
                this.chunk = chunks[(int) (offset / chunkSize)];
                this.position = (int) (offset % chunkSize);
            }
        }

        @Override
        public boolean hasNext() {
            return next < end;
        }

        @Override
        @SuppressWarnings("unchecked")
        public T next() {
            if (next >= end) {
                throw new NoSuchElementException();
            }
            if (position == chunk.length) {
                chunk = chunks[(int) (next / chunkSize)];
                position = 0;
            }
            next++;
            return (T) chunk[position++];
        }
    }
}
