package io.largecollections.index;

import io.largecollections.core.CapacityExceededException;
import io.largecollections.core.LargeCollectionsConfiguration;
import io.largecollections.kernel.Equivalence;
import io.largecollections.logging.LogEvents;
import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;

import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkedHashSetTest {

    private static final LargeCollectionsConfiguration CONFIG = LargeCollectionsConfiguration.builder()
            .chunkSize(10)
            .build();

    @Test
    void addIsIdempotentForEqualElements() {
        ChunkedHashSet<String> set = new ChunkedHashSet<>(CONFIG);

        set.add("alpha");
        set.add("alpha");

        assertThat(set.count()).isEqualTo(1L);
        assertThat(set.contains("alpha")).isTrue();
    }

    @Test
    void addReplacesStoredElementInPlace() {
        Equivalence<Version> byName = Equivalence.of((a, b) -> a.name().equals(b.name()), v -> v.name().hashCode());
        ChunkedHashSet<Version> set = new ChunkedHashSet<>(byName, CONFIG);

        set.add(new Version("lib", 1));
        set.add(new Version("lib", 2));

        assertThat(set.count()).isEqualTo(1L);
        assertThat(set.lookup(new Version("lib", 0))).contains(new Version("lib", 2));
        assertThat(set.lookup(new Version("other", 0))).isEmpty();
    }

    @Test
    void removeThenContainsReturnsFalse() {
        ChunkedHashSet<Integer> set = ChunkedHashSet.of(List.of(1, 2, 3), CONFIG);

        assertThat(set.remove(2)).isTrue();
        assertThat(set.remove(2)).isFalse();

        assertThat(set.contains(2)).isFalse();
        assertThat(set.count()).isEqualTo(2L);
    }

    @Test
    void growsWhenLoadFactorExceedsMaximum() {
        ChunkedHashSet<Integer> set = new ChunkedHashSet<>(CONFIG);

        for (int i = 0; i < 30; i++) {
            set.add(i);
            assertThat(set.loadFactor()).isLessThanOrEqualTo(1.0);
        }

        assertThat(set.capacity()).isGreaterThanOrEqualTo(30L);
        assertThat(set.count()).isEqualTo(30L);
    }

    @Test
    void bulkInsertThenBulkRemovePreservesLiveElements() {
        ChunkedHashSet<Integer> set = new ChunkedHashSet<>(CONFIG);
        List<Integer> all = IntStream.range(0, 90).boxed().collect(Collectors.toList());
        set.addAll(all);
        long grown = set.capacity();

        set.removeAll(all.subList(0, 88));

        assertThat(set.count()).isEqualTo(2L);
        assertThat(set.capacity()).isLessThan(grown);
        assertThat(set.contains(88)).isTrue();
        assertThat(set.contains(89)).isTrue();
        assertThat(set.stream().collect(Collectors.toSet())).containsExactlyInAnyOrder(88, 89);
    }

    @Test
    void shrinkTargetsMinimumLoadFactor() {
        LargeCollectionsConfiguration config = LargeCollectionsConfiguration.builder()
                .chunkSize(10)
                .minLoadFactorTolerance(1.0)
                .build();
        ChunkedHashSet<Integer> set = new ChunkedHashSet<>(40L, Equivalence.natural(), config);
        set.addAll(List.of(1, 2, 3, 4, 5));

        assertThat(set.capacity()).isEqualTo(40L);
        assertThat(set.shrink()).isTrue();
        assertThat(set.capacity()).isEqualTo(10L);
        assertThat(set.shrink()).isFalse();
        assertThat(set.stream().collect(Collectors.toSet())).containsExactlyInAnyOrder(1, 2, 3, 4, 5);
    }

    @Test
    void collidingHashesShareBucketChain() {
        Equivalence<String> constantHash = Equivalence.of(String::equals, s -> 7);
        ChunkedHashSet<String> set = new ChunkedHashSet<>(100L, constantHash, CONFIG);

        set.addAll(List.of("a", "b", "c", "d"));
        set.remove("b");

        assertThat(set.count()).isEqualTo(3L);
        assertThat(set.contains("a")).isTrue();
        assertThat(set.contains("b")).isFalse();
        assertThat(set.contains("d")).isTrue();
        assertThat(set.stream().collect(Collectors.toList())).containsExactly("a", "c", "d");
    }

    @Test
    void negativeHashesMapToValidBuckets() {
        Equivalence<Integer> negative = Equivalence.of(Integer::equals, i -> -i - 1);
        ChunkedHashSet<Integer> set = new ChunkedHashSet<>(negative, CONFIG);

        for (int i = 0; i < 50; i++) {
            set.add(i);
        }

        assertThat(set.count()).isEqualTo(50L);
        for (int i = 0; i < 50; i++) {
            assertThat(set.contains(i)).isTrue();
        }
    }

    @Test
    void bucketCapacityIsCappedAtCeiling() {
        LargeCollectionsConfiguration tiny = LargeCollectionsConfiguration.builder().chunkSize(4).build();
        ChunkedHashSet<Integer> set = new ChunkedHashSet<>(tiny);

        for (int i = 0; i < 16; i++) {
            set.add(i);
        }

        assertThat(set.bucketCeiling()).isEqualTo(16L);
        assertThat(set.capacity()).isEqualTo(16L);
        assertThatThrownBy(() -> set.add(16)).isInstanceOf(CapacityExceededException.class);
        set.add(3);
        assertThat(set.count()).isEqualTo(16L);
    }

    @Test
    void rejectsNewElementAtMaximumCountButAcceptsUpsert() {
        ChunkedHashSet<Integer> set = new ChunkedHashSet<>(CONFIG);
        for (int i = 0; i < 100; i++) {
            set.add(i);
        }

        assertThatThrownBy(() -> set.add(100)).isInstanceOf(CapacityExceededException.class);
        assertThat(set.count()).isEqualTo(100L);
        assertThat(set.contains(100)).isFalse();

        set.add(5);
        assertThat(set.count()).isEqualTo(100L);
        assertThat(set.contains(5)).isTrue();
    }

    @Test
    void rehashOnFinalInsertDoesNotHitCountLimit() {
        LargeCollectionsConfiguration dense = LargeCollectionsConfiguration.builder()
                .chunkSize(10)
                .maxLoadFactor(4.15)
                .build();
        ChunkedHashSet<Integer> set = new ChunkedHashSet<>(dense);
        for (int i = 0; i < 99; i++) {
            set.add(i);
        }
        long before = set.capacity();

        set.add(99);

        assertThat(set.count()).isEqualTo(100L);
        assertThat(set.capacity()).isGreaterThan(before);
        assertThat(set.loadFactor()).isLessThanOrEqualTo(4.15);
        for (int i = 0; i < 100; i++) {
            assertThat(set.contains(i)).isTrue();
        }
        assertThatThrownBy(() -> set.add(100)).isInstanceOf(CapacityExceededException.class);
        assertThat(set.count()).isEqualTo(100L);
    }

    @Test
    void rejectsInitialCapacityOutsideBucketRange() {
        assertThatThrownBy(() -> new ChunkedHashSet<Integer>(0L, Equivalence.natural(), CONFIG))
                .isInstanceOf(CapacityExceededException.class);
        assertThatThrownBy(() -> new ChunkedHashSet<Integer>(101L, Equivalence.natural(), CONFIG))
                .isInstanceOf(CapacityExceededException.class);
    }

    @Test
    void rejectsNullElements() {
        ChunkedHashSet<String> set = new ChunkedHashSet<>(CONFIG);

        assertThatThrownBy(() -> set.add(null)).isInstanceOf(IllegalArgumentException.class);
        assertThat(set.contains(null)).isFalse();
    }

    @Test
    void clearKeepsCapacity() {
        ChunkedHashSet<Integer> set = new ChunkedHashSet<>(CONFIG);
        set.addAll(List.of(1, 2, 3, 4, 5, 6, 7));
        long capacity = set.capacity();

        set.clear();

        assertThat(set.count()).isZero();
        assertThat(set.capacity()).isEqualTo(capacity);
        assertThat(set.iterator().hasNext()).isFalse();
        set.add(9);
        assertThat(set.contains(9)).isTrue();
    }

    @Test
    void iterationIsRestartableAndComplete() {
        ChunkedHashSet<Integer> set = new ChunkedHashSet<>(CONFIG);
        set.addAll(IntStream.range(0, 40).boxed().collect(Collectors.toList()));

        Set<Integer> first = new HashSet<>();
        set.forEach(first::add);
        Set<Integer> second = new HashSet<>();
        for (Integer item : set) {
            second.add(item);
        }

        assertThat(first).hasSize(40).isEqualTo(second);
        Iterator<Integer> iterator = new ChunkedHashSet<Integer>(CONFIG).iterator();
        assertThatThrownBy(iterator::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void rehashIsLoggedAtDebug() {
        LogEvents.clear();
        ChunkedHashSet<Integer> set = new ChunkedHashSet<>(CONFIG);

        set.add(1);
        set.add(2);

        assertThat(LogEvents.forLogger(ChunkedHashSet.class))
                .singleElement()
                .satisfies(event -> {
                    assertThat(event.level()).isEqualTo(Level.DEBUG);
                    assertThat(event.message()).isEqualTo("Rehashed ChunkedHashSet buckets 1 -> 2 (count 2)");
                });
    }

    private record Version(String name, int number) {
    }
}
