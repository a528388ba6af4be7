package io.largecollections.span;

import io.largecollections.kernel.LargeArray;
import io.largecollections.kernel.MutableLargeArray;
import io.largecollections.kernel.Ranges;

import java.util.Comparator;
import java.util.Iterator;
import java.util.function.Consumer;

/**
 * Read-only window {@code [offset, offset + count)} over a {@link LargeArray}.
 * <p>
 * Indices passed to a span are relative to its start and translated with one addition.
 * A span built over another span refers to the underlying array directly.
 * <p>
 * The window is validated against the source count at construction only; shrinking the
 * source afterwards surfaces as an {@link IndexOutOfBoundsException} from the source.
 *
 * @param <T> element type
 */
public class LargeSpan<T> implements LargeArray<T> {

    private final LargeArray<T> source;
    private final long offset;
    private final long count;

    LargeSpan(LargeArray<T> source, long offset, long count) {
        this.source = source;
        this.offset = offset;
        this.count = count;
    }

    /**
     * Window over {@code [offset, offset + count)} of {@code source}.
     *
     * @throws IndexOutOfBoundsException if the window does not fit in the source
     */
    public static <T> LargeSpan<T> of(LargeArray<T> source, long offset, long count) {
        if (source == null) {
            throw new IllegalArgumentException("source required");
        }
        Ranges.checkRange(offset, count, source.count());
        if (source instanceof LargeSpan<T> span) {
            return new LargeSpan<>(span.source, span.offset + offset, count);
        }
        return new LargeSpan<>(source, offset, count);
    }

    public static <T> LargeSpan<T> of(LargeArray<T> source) {
        if (source == null) {
            throw new IllegalArgumentException("source required");
        }
        return of(source, 0L, source.count());
    }

    /**
     * Sub-window of this span, relative to its start.
     */
    public LargeSpan<T> slice(long offset, long count) {
        return of(this, offset, count);
    }

    /**
     * The array this span reads from. Never another span.
     */
    public LargeArray<T> source() {
        return source;
    }

    /**
     * Start of the window in source coordinates.
     */
    public long offset() {
        return offset;
    }

    @Override
    public long count() {
        return count;
    }

    @Override
    public T get(long index) {
        Ranges.checkIndex(index, count);
        return source.get(offset + index);
    }

    @Override
    public boolean contains(T item, long offset, long count) {
        Ranges.checkRange(offset, count, this.count);
        return source.contains(item, this.offset + offset, count);
    }

    @Override
    public void forEach(long offset, long count, Consumer<? super T> action) {
        Ranges.checkRange(offset, count, this.count);
        source.forEach(this.offset + offset, count, action);
    }

    @Override
    public Iterator<T> iterator(long offset, long count) {
        Ranges.checkRange(offset, count, this.count);
        return source.iterator(this.offset + offset, count);
    }

    /**
     * Search a sorted range of this span. Results, including the encoded insertion point of a
     * miss, are relative to the span.
     */
    @Override
    public long binarySearch(T item, long offset, long count, Comparator<? super T> comparator) {
        Ranges.checkRange(offset, count, this.count);
        long result = source.binarySearch(item, this.offset + offset, count, comparator);
        if (result >= 0L) {
            return result - this.offset;
        }
        long insertionPoint = -(result + 1L);
        return -((insertionPoint - this.offset) + 1L);
    }

    @Override
    public void copyTo(MutableLargeArray<T> target, long sourceOffset, long targetOffset, long count) {
        Ranges.checkRange(sourceOffset, count, this.count);
        source.copyTo(target, offset + sourceOffset, targetOffset, count);
    }

    @Override
    public void copyTo(T[] target, long sourceOffset, int targetOffset, int count) {
        Ranges.checkRange(sourceOffset, count, this.count);
        source.copyTo(target, offset + sourceOffset, targetOffset, count);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{offset=" + offset + ", count=" + count + ", source=" + source + '}';
    }
}
