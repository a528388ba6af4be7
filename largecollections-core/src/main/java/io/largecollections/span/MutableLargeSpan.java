package io.largecollections.span;

import io.largecollections.kernel.MutableLargeArray;
import io.largecollections.kernel.Ranges;

import java.util.Comparator;

/**
 * Writable window over a {@link MutableLargeArray}. Writes go straight to the source.
 *
 * @param <T> element type
 */
public class MutableLargeSpan<T> extends LargeSpan<T> implements MutableLargeArray<T> {

    private final MutableLargeArray<T> target;

    MutableLargeSpan(MutableLargeArray<T> source, long offset, long count) {
        super(source, offset, count);
        this.target = source;
    }

    public static <T> MutableLargeSpan<T> of(MutableLargeArray<T> source, long offset, long count) {
        if (source == null) {
            throw new IllegalArgumentException("source required");
        }
        Ranges.checkRange(offset, count, source.count());
        if (source instanceof MutableLargeSpan<T> span) {
            return new MutableLargeSpan<>(span.target, span.offset() + offset, count);
        }
        return new MutableLargeSpan<>(source, offset, count);
    }

    public static <T> MutableLargeSpan<T> of(MutableLargeArray<T> source) {
        if (source == null) {
            throw new IllegalArgumentException("source required");
        }
        return of(source, 0L, source.count());
    }

    @Override
    public MutableLargeSpan<T> slice(long offset, long count) {
        return of(this, offset, count);
    }

    @Override
    public MutableLargeArray<T> source() {
        return target;
    }

    @Override
    public void set(long index, T item) {
        Ranges.checkIndex(index, count());
        target.set(offset() + index, item);
    }

    @Override
    public void swap(long leftIndex, long rightIndex) {
        Ranges.checkIndex(leftIndex, count());
        Ranges.checkIndex(rightIndex, count());
        target.swap(offset() + leftIndex, offset() + rightIndex);
    }

    @Override
    public void sort(long offset, long count, Comparator<? super T> comparator) {
        Ranges.checkRange(offset, count, count());
        target.sort(offset() + offset, count, comparator);
    }

    @Override
    public void copyFrom(T[] source, int sourceOffset, long targetOffset, int count) {
        Ranges.checkRange(targetOffset, count, count());
        target.copyFrom(source, sourceOffset, offset() + targetOffset, count);
    }
}
