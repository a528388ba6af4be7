package io.largecollections.kernel;

import java.util.Optional;

/**
 * Read-only key/value view over a large hash table.
 *
 * @param <K> key type
 * @param <V> value type
 */
public interface LargeDictionary<K, V> extends LargeCollection<KeyValue<K, V>> {

    /**
     * Returns the value mapped to {@code key}.
     * @throws io.largecollections.core.KeyNotFoundException if the key is absent
     */
    V get(K key);

    /**
     * Returns the value mapped to {@code key}. A stored {@code null} is reported as empty;
     * use {@link #containsKey} to tell it apart from a missing key.
     */
    Optional<V> tryGetValue(K key);

    boolean containsKey(K key);

    Iterable<K> keys();

    Iterable<V> values();
}
