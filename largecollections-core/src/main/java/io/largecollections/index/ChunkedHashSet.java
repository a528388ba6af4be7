package io.largecollections.index;

import io.largecollections.core.CapacityExceededException;
import io.largecollections.core.GrowthPolicy;
import io.largecollections.core.LargeCollectionsConfiguration;
import io.largecollections.core.LoadFactorPolicy;
import io.largecollections.kernel.Equivalence;
import io.largecollections.kernel.MutableLargeCollection;
import io.largecollections.storage.ChunkedArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Separate-chaining hash set whose bucket table is a {@link ChunkedArray} of chain heads.
 * <p>
 * The bucket of an element is {@code unsigned(hash) % capacity}. The table is rehashed in full
 * when the load factor rises above the configured maximum or falls to
 * {@code minLoadFactor * minLoadFactorTolerance}. Bucket capacity never exceeds
 * {@link #bucketCeiling}.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>{@code null} elements are rejected.</li>
 *   <li>add() replaces an equivalent element in place; the count is unchanged.</li>
 *   <li>Iteration visits buckets in index order, chains head first.</li>
 *   <li>Not synchronized.</li>
 * </ul>
 *
 * @param <T> element type
 */
public class ChunkedHashSet<T> implements MutableLargeCollection<T> {

    private static final Logger log = LoggerFactory.getLogger(ChunkedHashSet.class);

    /**
     * Largest bucket count a 32-bit hash can usefully address.
     */
    public static final long HASH_DOMAIN_CEILING = 0xFFFF_FFFFL;

    private static final long DEFAULT_CAPACITY = 1L;

    private final LargeCollectionsConfiguration configuration;
    private final Equivalence<? super T> equivalence;
    private final GrowthPolicy growthPolicy;
    private final LoadFactorPolicy loadFactorPolicy;
    private final long bucketCeiling;
    private final long maxCount;
    private ChunkedArray<Node<T>> buckets;
    private long count;

    public ChunkedHashSet(LargeCollectionsConfiguration configuration) {
        this(DEFAULT_CAPACITY, Equivalence.natural(), configuration);
    }

    public ChunkedHashSet(Equivalence<? super T> equivalence, LargeCollectionsConfiguration configuration) {
        this(DEFAULT_CAPACITY, equivalence, configuration);
    }

    /**
     * Create an empty set.
     *
     * @param capacity      initial bucket count, in {@code [1, bucketCeiling]}
     * @param equivalence   element equality and hash
     * @param configuration chunk layout and load-factor policy
     */
    public ChunkedHashSet(long capacity, Equivalence<? super T> equivalence, LargeCollectionsConfiguration configuration) {
        if (equivalence == null) {
            throw new IllegalArgumentException("equivalence required");
        }
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        this.configuration = configuration;
        this.equivalence = equivalence;
        this.growthPolicy = configuration.growthPolicy();
        this.loadFactorPolicy = configuration.loadFactorPolicy();
        this.bucketCeiling = Math.min(HASH_DOMAIN_CEILING, configuration.maxCapacity());
        this.maxCount = configuration.maxCapacity();
        if (capacity < 1L || capacity > bucketCeiling) {
            throw new CapacityExceededException(capacity, bucketCeiling);
        }
        this.buckets = new ChunkedArray<>(capacity, configuration);
        this.count = 0L;
    }

    public static <T> ChunkedHashSet<T> of(Iterable<? extends T> items) {
        return of(items, LargeCollectionsConfiguration.defaults());
    }

    public static <T> ChunkedHashSet<T> of(Iterable<? extends T> items, LargeCollectionsConfiguration configuration) {
        ChunkedHashSet<T> set = new ChunkedHashSet<>(configuration);
        set.addAll(items);
        return set;
    }

    @Override
    public long count() {
        return count;
    }

    /**
     * Current number of buckets.
     */
    public long capacity() {
        return buckets.count();
    }

    public double loadFactor() {
        return (double) count / (double) buckets.count();
    }

    /**
     * Largest bucket count this set may reach: {@code min(2^32 - 1, chunkSize²)}.
     */
    public long bucketCeiling() {
        return bucketCeiling;
    }

    protected LargeCollectionsConfiguration configuration() {
        return configuration;
    }

    /**
     * Insert {@code item}, or replace the stored element equivalent to it.
     *
     * @throws CapacityExceededException if the set already holds the maximum count
     */
    @Override
    public void add(T item) {
        requireItem(item);
        if (addToStorage(buckets, item, true)) {
            count++;
            if (loadFactorPolicy.shouldGrow(count, buckets.count()) && buckets.count() < bucketCeiling) {
                rehash(Math.min(growthPolicy.grow(buckets.count(), bucketCeiling), bucketCeiling));
            }
        }
    }

    @Override
    public boolean remove(T item) {
        requireItem(item);
        long bucket = bucketIndex(item, buckets.count());
        Node<T> previous = null;
        for (Node<T> node = buckets.get(bucket); node != null; node = node.next) {
            if (equivalence.equivalent(node.item, item)) {
                if (previous == null) {
                    buckets.set(bucket, node.next);
                } else {
                    previous.next = node.next;
                }
                node.next = null;
                count--;
                shrink();
                return true;
            }
            previous = node;
        }
        return false;
    }

    @Override
    public boolean contains(T item) {
        return item != null && find(item) != null;
    }

    /**
     * Stored element equivalent to {@code item}.
     */
    public Optional<T> lookup(T item) {
        if (item == null) {
            return Optional.empty();
        }
        Node<T> node = find(item);
        return node == null ? Optional.empty() : Optional.of(node.item);
    }

    /**
     * Unlink every chain and reset the count. Bucket capacity is unchanged.
     */
    @Override
    public void clear() {
        long capacity = buckets.count();
        for (long i = 0L; i < capacity; i++) {
            unlink(buckets.get(i));
            buckets.set(i, null);
        }
        count = 0L;
    }

    /**
     * Rehash into a smaller table when the load factor is at or below
     * {@code minLoadFactor * minLoadFactorTolerance}.
     *
     * @return true if the table was rehashed
     */
    public boolean shrink() {
        long capacity = buckets.count();
        if (!loadFactorPolicy.shouldShrink(count, capacity)) {
            return false;
        }
        long target = Math.min(loadFactorPolicy.shrinkTarget(count), bucketCeiling);
        if (target >= capacity) {
            return false;
        }
        rehash(target);
        return true;
    }

    @Override
    public Iterator<T> iterator() {
        return new ChainIterator();
    }

    @Override
    public void forEach(Consumer<? super T> action) {
        if (action == null) {
            throw new IllegalArgumentException("action required");
        }
        long capacity = buckets.count();
        for (long i = 0L; i < capacity; i++) {
            for (Node<T> node = buckets.get(i); node != null; node = node.next) {
                action.accept(node.item);
            }
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{count=" + count + ", capacity=" + buckets.count() + '}';
    }

    /**
     * Node holding the element equivalent to {@code item}, or {@code null}.
     */
    protected final Node<T> find(T item) {
        long bucket = bucketIndex(item, buckets.count());
        for (Node<T> node = buckets.get(bucket); node != null; node = node.next) {
            if (equivalence.equivalent(node.item, item)) {
                return node;
            }
        }
        return null;
    }

    /**
     * Link {@code item} into {@code table}, replacing an equivalent element.
     * Rehash passes {@code checkLimit = false}: it only moves elements already counted.
     *
     * @return true if a new node was created
     */
    private boolean addToStorage(ChunkedArray<Node<T>> table, T item, boolean checkLimit) {
        long bucket = bucketIndex(item, table.count());
        Node<T> node = table.get(bucket);
        if (node == null) {
            if (checkLimit) {
                checkCount();
            }
            table.set(bucket, new Node<>(item));
            return true;
        }
        while (true) {
            if (equivalence.equivalent(node.item, item)) {
                node.item = item;
                return false;
            }
            if (node.next == null) {
                if (checkLimit) {
                    checkCount();
                }
                node.next = new Node<>(item);
                return true;
            }
            node = node.next;
        }
    }

    private void checkCount() {
        if (count >= maxCount) {
            throw new CapacityExceededException(count + 1L, maxCount);
        }
    }

    private void rehash(long capacity) {
        ChunkedArray<Node<T>> previous = buckets;
        ChunkedArray<Node<T>> table = new ChunkedArray<>(capacity, configuration);
        long previousCapacity = previous.count();
        for (long i = 0L; i < previousCapacity; i++) {
            Node<T> node = previous.get(i);
            while (node != null) {
                addToStorage(table, node.item, false);
                Node<T> next = node.next;
                node.next = null;
                node = next;
            }
            previous.set(i, null);
        }
        buckets = table;
        if (log.isDebugEnabled()) {
            log.debug("Rehashed {} buckets {} -> {} (count {})",
                    getClass().getSimpleName(), previousCapacity, capacity, count);
        }
    }

    private long bucketIndex(T item, long capacity) {
        return Integer.toUnsignedLong(equivalence.hash(item)) % capacity;
    }

    private static void requireItem(Object item) {
        if (item == null) {
            throw new IllegalArgumentException("item required");
        }
    }

    private static <T> void unlink(Node<T> head) {
        Node<T> node = head;
        while (node != null) {
            Node<T> next = node.next;
            node.next = null;
            node = next;
        }
    }

    /**
     * Chain link. The element is replaced in place on upsert.
     */
    protected static final class Node<T> {
        T item;
        Node<T> next;

        Node(T item) {
            this.item = item;
        }
    }

    private final class ChainIterator implements Iterator<T> {
        private final ChunkedArray<Node<T>> table = buckets;
        private long bucket = -1L;
        private Node<T> next;

        ChainIterator() {
            advanceBucket();
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public T next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            T item = next.item;
            next = next.next;
            if (next == null) {
                advanceBucket();
            }
            return item;
        }

        private void advanceBucket() {
            long capacity = table.count();
            while (++bucket < capacity) {
                Node<T> head = table.get(bucket);
                if (head != null) {
                    next = head;
                    return;
                }
            }
            next = null;
        }
    }
}
