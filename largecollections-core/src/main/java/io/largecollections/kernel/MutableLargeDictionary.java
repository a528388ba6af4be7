package io.largecollections.kernel;

/**
 * Large dictionary supporting upserts and key removal.
 *
 * @param <K> key type
 * @param <V> value type
 */
public interface MutableLargeDictionary<K, V> extends LargeDictionary<K, V>, MutableLargeCollection<KeyValue<K, V>> {

    /**
     * Associates {@code value} with {@code key}, replacing any existing mapping.
     */
    void put(K key, V value);

    /**
     * Removes the mapping for {@code key}.
     * @return true if a mapping was removed
     */
    boolean removeKey(K key);
}
