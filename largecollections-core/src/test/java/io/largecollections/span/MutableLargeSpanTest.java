package io.largecollections.span;

import io.largecollections.core.LargeCollectionsConfiguration;
import io.largecollections.storage.ChunkedArray;
import org.junit.jupiter.api.Test;

import java.util.Comparator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MutableLargeSpanTest {

    private static final LargeCollectionsConfiguration CONFIG = LargeCollectionsConfiguration.builder()
            .chunkSize(10)
            .build();

    @Test
    void writesGoToSource() {
        ChunkedArray<Integer> array = sequence(30);
        MutableLargeSpan<Integer> span = MutableLargeSpan.of(array, 20L, 5L);

        span.set(1L, -1);

        assertThat(array.get(21L)).isEqualTo(-1);
        assertThatThrownBy(() -> span.set(5L, 0)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void sortsOnlyTheWindow() {
        ChunkedArray<Integer> array = new ChunkedArray<>(20L, CONFIG);
        for (int i = 0; i < 20; i++) {
            array.set(i, 20 - i);
        }
        MutableLargeSpan<Integer> span = MutableLargeSpan.of(array, 5L, 10L);

        span.sort();

        assertThat(array.get(4L)).isEqualTo(16);
        assertThat(array.get(5L)).isEqualTo(6);
        assertThat(array.get(14L)).isEqualTo(15);
        assertThat(array.get(15L)).isEqualTo(5);
        assertThat(span.binarySearch(10, Comparator.naturalOrder())).isEqualTo(4L);
    }

    @Test
    void nestedMutableSpanFoldsAndStaysWritable() {
        ChunkedArray<Integer> array = sequence(40);
        MutableLargeSpan<Integer> outer = MutableLargeSpan.of(array, 10L, 20L);

        MutableLargeSpan<Integer> inner = outer.slice(5L, 10L);
        inner.swap(0L, 9L);

        assertThat(inner.source()).isSameAs(array);
        assertThat(inner.offset()).isEqualTo(15L);
        assertThat(array.get(15L)).isEqualTo(24);
        assertThat(array.get(24L)).isEqualTo(15);
    }

    @Test
    void readOnlySpanOverMutableSpanFolds() {
        ChunkedArray<Integer> array = sequence(40);
        MutableLargeSpan<Integer> mutable = MutableLargeSpan.of(array, 10L, 20L);

        LargeSpan<Integer> view = LargeSpan.of(mutable, 2L, 3L);

        assertThat(view).isNotInstanceOf(MutableLargeSpan.class);
        assertThat(view.source()).isSameAs(array);
        assertThat(view.get(0L)).isEqualTo(12);
    }

    @Test
    void copyFromBufferWritesThroughWindow() {
        ChunkedArray<Integer> array = sequence(30);
        MutableLargeSpan<Integer> span = MutableLargeSpan.of(array, 8L, 6L);
        Integer[] buffer = {100, 101, 102};

        span.copyFrom(buffer, 0, 1L, 3);

        assertThat(array.get(8L)).isEqualTo(8);
        assertThat(array.get(9L)).isEqualTo(100);
        assertThat(array.get(11L)).isEqualTo(102);
        assertThatThrownBy(() -> span.copyFrom(buffer, 0, 4L, 3)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void copyFromLargeArrayWritesThroughWindow() {
        ChunkedArray<Integer> array = new ChunkedArray<>(30L, CONFIG);
        MutableLargeSpan<Integer> span = MutableLargeSpan.of(array, 12L, 10L);

        span.copyFrom(sequence(5), 0L, 2L, 5L);

        assertThat(array.get(13L)).isNull();
        assertThat(array.get(14L)).isEqualTo(0);
        assertThat(array.get(18L)).isEqualTo(4);
    }

    private static ChunkedArray<Integer> sequence(int count) {
        ChunkedArray<Integer> array = new ChunkedArray<>(count, CONFIG);
        for (int i = 0; i < count; i++) {
            array.set(i, i);
        }
        return array;
    }
}
