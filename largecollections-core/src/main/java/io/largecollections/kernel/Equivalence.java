package io.largecollections.kernel;

import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.function.ToIntFunction;

/**
 * Equality and hashing strategy for container elements.
 * <p>
 * <b>Contract:</b> elements that are {@link #equivalent} must produce the same {@link #hash}.
 * Hashes are treated as unsigned 32-bit values.
 *
 * @param <T> element type
 */
public interface Equivalence<T> {

    boolean equivalent(T left, T right);

    int hash(T item);

    /**
     * Strategy backed by {@link Object#equals} and {@link Object#hashCode}.
     */
    @SuppressWarnings("unchecked")
    static <T> Equivalence<T> natural() {
        return (Equivalence<T>) Natural.INSTANCE;
    }

    static <T> Equivalence<T> of(BiPredicate<? super T, ? super T> equality, ToIntFunction<? super T> hash) {
        if (equality == null) {
            throw new IllegalArgumentException("equality required");
        }
        if (hash == null) {
            throw new IllegalArgumentException("hash required");
        }
        return new Equivalence<>() {
            @Override
            public boolean equivalent(T left, T right) {
                return equality.test(left, right);
            }

            @Override
            public int hash(T item) {
                return hash.applyAsInt(item);
            }
        };
    }

    /**
     * Strategy over key/value pairs that only looks at the key.
     */
    static <K, V> Equivalence<KeyValue<K, V>> onKey(Equivalence<? super K> keyEquivalence) {
        if (keyEquivalence == null) {
            throw new IllegalArgumentException("keyEquivalence required");
        }
        return new Equivalence<>() {
            @Override
            public boolean equivalent(KeyValue<K, V> left, KeyValue<K, V> right) {
                return keyEquivalence.equivalent(left.key(), right.key());
            }

            @Override
            public int hash(KeyValue<K, V> item) {
                return keyEquivalence.hash(item.key());
            }
        };
    }

    final class Natural implements Equivalence<Object> {
        private static final Natural INSTANCE = new Natural();

        private Natural() {
        }

        @Override
        public boolean equivalent(Object left, Object right) {
            return Objects.equals(left, right);
        }

        @Override
        public int hash(Object item) {
            return Objects.hashCode(item);
        }
    }
}
