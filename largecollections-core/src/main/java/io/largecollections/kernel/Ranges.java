package io.largecollections.kernel;

import io.largecollections.core.CapacityExceededException;

/**
 * Argument checks shared by every range-taking operation.
 * <p>
 * Ranges are {@code (offset, count)} pairs and must satisfy
 * {@code offset >= 0 && count >= 0 && offset + count <= size}. Violations are contract
 * errors; nothing is clamped.
 */
public final class Ranges {

    private Ranges() {
    }

    public static void checkRange(long offset, long count, long size) {
        // offset > size - count avoids overflow of offset + count
        if (offset < 0L || count < 0L || offset > size - count) {
            throw new IndexOutOfBoundsException(
                    "range out of bounds: offset=" + offset + ", count=" + count + ", size=" + size);
        }
    }

    public static void checkIndex(long index, long size) {
        if (index < 0L || index >= size) {
            throw new IndexOutOfBoundsException("index out of range: " + index + " (size " + size + ")");
        }
    }

    public static void checkCapacity(long capacity, long maxCapacity) {
        if (capacity < 0L || capacity > maxCapacity) {
            throw new CapacityExceededException(capacity, maxCapacity);
        }
    }
}
