package io.largecollections;

import io.largecollections.core.LargeCollectionsConfiguration;
import io.largecollections.index.ChunkedHashDictionary;
import io.largecollections.index.ChunkedHashSet;
import io.largecollections.storage.ChunkedList;

import java.util.function.Function;
import java.util.stream.Collector;

/**
 * {@link Collector}s that gather a stream into chunked containers.
 * <pre>
 * ChunkedList&lt;String&gt; names = people.stream()
 *     .map(Person::name)
 *     .collect(LargeCollectors.toList());
 * </pre>
 */
public final class LargeCollectors {

    private LargeCollectors() {
    }

    public static <T> Collector<T, ?, ChunkedList<T>> toList() {
        return toList(LargeCollectionsConfiguration.defaults());
    }

    public static <T> Collector<T, ?, ChunkedList<T>> toList(LargeCollectionsConfiguration configuration) {
        requireConfiguration(configuration);
        return Collector.of(
                () -> new ChunkedList<T>(configuration),
                ChunkedList::add,
                (left, right) -> {
                    left.addAll(right, 0L, right.count());
                    return left;
                });
    }

    /**
     * Collect distinct elements; a later equal element replaces an earlier one.
     */
    public static <T> Collector<T, ?, ChunkedHashSet<T>> toSet() {
        return toSet(LargeCollectionsConfiguration.defaults());
    }

    public static <T> Collector<T, ?, ChunkedHashSet<T>> toSet(LargeCollectionsConfiguration configuration) {
        requireConfiguration(configuration);
        return Collector.of(
                () -> new ChunkedHashSet<T>(configuration),
                ChunkedHashSet::add,
                (left, right) -> {
                    left.addAll(right);
                    return left;
                },
                Collector.Characteristics.UNORDERED);
    }

    /**
     * Collect into a dictionary. Duplicate keys keep the last value seen.
     */
    public static <T, K, V> Collector<T, ?, ChunkedHashDictionary<K, V>> toDictionary(
            Function<? super T, ? extends K> keyMapper,
            Function<? super T, ? extends V> valueMapper) {
        return toDictionary(keyMapper, valueMapper, LargeCollectionsConfiguration.defaults());
    }

    public static <T, K, V> Collector<T, ?, ChunkedHashDictionary<K, V>> toDictionary(
            Function<? super T, ? extends K> keyMapper,
            Function<? super T, ? extends V> valueMapper,
            LargeCollectionsConfiguration configuration) {
        if (keyMapper == null) {
            throw new IllegalArgumentException("keyMapper required");
        }
        if (valueMapper == null) {
            throw new IllegalArgumentException("valueMapper required");
        }
        requireConfiguration(configuration);
        return Collector.of(
                () -> new ChunkedHashDictionary<K, V>(configuration),
                (dictionary, element) -> dictionary.put(keyMapper.apply(element), valueMapper.apply(element)),
                (left, right) -> {
                    left.addAll(right);
                    return left;
                });
    }

    private static void requireConfiguration(LargeCollectionsConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
    }
}
