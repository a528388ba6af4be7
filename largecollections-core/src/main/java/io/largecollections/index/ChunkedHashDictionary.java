package io.largecollections.index;

import io.largecollections.core.KeyNotFoundException;
import io.largecollections.core.LargeCollectionsConfiguration;
import io.largecollections.kernel.Equivalence;
import io.largecollections.kernel.KeyValue;
import io.largecollections.kernel.MutableLargeDictionary;

import java.util.Objects;
import java.util.Optional;

/**
 * Hash dictionary stored as a {@link ChunkedHashSet} of {@link KeyValue} pairs whose equality
 * and hash only look at the key.
 * <p>
 * Keys must be non-null; values may be {@code null}.
 *
 * @param <K> key type
 * @param <V> value type
 */
public class ChunkedHashDictionary<K, V> extends ChunkedHashSet<KeyValue<K, V>>
        implements MutableLargeDictionary<K, V> {

    public ChunkedHashDictionary(LargeCollectionsConfiguration configuration) {
        this(Equivalence.natural(), configuration);
    }

    public ChunkedHashDictionary(Equivalence<? super K> keyEquivalence, LargeCollectionsConfiguration configuration) {
        this(1L, keyEquivalence, configuration);
    }

    public ChunkedHashDictionary(long capacity, Equivalence<? super K> keyEquivalence,
                                 LargeCollectionsConfiguration configuration) {
        super(capacity, Equivalence.<K, V>onKey(keyEquivalence), configuration);
    }

    @Override
    public V get(K key) {
        Node<KeyValue<K, V>> node = find(probe(key));
        if (node == null) {
            throw new KeyNotFoundException(key);
        }
        return node.item.value();
    }

    @Override
    public Optional<V> tryGetValue(K key) {
        Node<KeyValue<K, V>> node = find(probe(key));
        return node == null ? Optional.empty() : Optional.ofNullable(node.item.value());
    }

    @Override
    public boolean containsKey(K key) {
        return find(probe(key)) != null;
    }

    @Override
    public void put(K key, V value) {
        add(KeyValue.of(requireKey(key), value));
    }

    @Override
    public boolean removeKey(K key) {
        return super.remove(probe(key));
    }

    /**
     * True when the key is present and mapped to an equal value.
     */
    @Override
    public boolean contains(KeyValue<K, V> entry) {
        if (entry == null || entry.key() == null) {
            return false;
        }
        Node<KeyValue<K, V>> node = find(entry);
        return node != null && Objects.equals(node.item.value(), entry.value());
    }

    /**
     * Remove the mapping only when the key is mapped to an equal value.
     */
    @Override
    public boolean remove(KeyValue<K, V> entry) {
        return contains(entry) && super.remove(entry);
    }

    @Override
    public void add(KeyValue<K, V> entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry required");
        }
        requireKey(entry.key());
        super.add(entry);
    }

    @Override
    public Iterable<K> keys() {
        return () -> stream().map(KeyValue::key).iterator();
    }

    @Override
    public Iterable<V> values() {
        return () -> stream().map(KeyValue::value).iterator();
    }

    private KeyValue<K, V> probe(K key) {
        return KeyValue.of(requireKey(key), null);
    }

    private static <K> K requireKey(K key) {
        if (key == null) {
            throw new IllegalArgumentException("key required");
        }
        return key;
    }
}
