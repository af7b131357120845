package comiam.chaining;


import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.AbstractCollection;
import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;


/**
 * ChainedHashTable is a hash table that resolves collisions by separate chaining.
 *
 * <p>Every key is placed in bucket {@code hash(key) mod capacity}, where {@code hash} is supplied by
 * a {@link KeyHasher}. A bucket holds a singly linked chain of nodes; new keys are appended to the
 * tail and lookups take the first node whose key is equivalent, walking from the head.
 *
 * <p>The table grows but never shrinks. Before a new key is linked, the table checks whether
 * {@code (size + 1) / capacity} would exceed the load factor threshold; if so, the bucket array is
 * replaced by one at least twice as large and every node is relinked into its new bucket. Once an
 * insert returns, {@code size / capacity <= loadFactorThreshold} holds (up to
 * {@link #MAXIMUM_CAPACITY}).
 *
 * <p>Two access styles are offered:
 * <ul>
 *   <li>{@link #insert}, {@link #search}, {@link #contains} and {@link #delete}, where a missing key is
 *       reported by {@link KeyNotFoundException};</li>
 *   <li>the {@link Map} methods, where a missing key yields {@code null}.</li>
 * </ul>
 *
 * <p>Keys must not be null; values may be. This class is not thread-safe.
 *
 * @param <K> the type of keys maintained by this table
 * @param <V> the type of mapped values
 */
public class ChainedHashTable<K, V> implements Map<K, V> {

    private static final Logger log = LoggerFactory.getLogger(ChainedHashTable.class);

    /** Bucket count used by the no-argument constructor. */
    public static final int DEFAULT_INITIAL_CAPACITY = 7;

    /** Load factor threshold used when none is given. */
    public static final double DEFAULT_LOAD_FACTOR_THRESHOLD = 0.75;

    /** Largest bucket array the table will allocate. */
    public static final int MAXIMUM_CAPACITY = 1 << 30;

    private final KeyHasher<? super K> hasher;

    private final double loadFactorThreshold;

    // Chain heads; null marks an empty bucket.
    private ChainNode<K, V>[] buckets;

    private int size;

    // Bumped on every structural change, checked by iterators.
    private int modCount;

    // Set once growth is refused at MAXIMUM_CAPACITY, so the warning is logged once.
    private boolean saturated;

    /**
     * Constructs an empty table with the default capacity, threshold and natural hasher.
     */
    public ChainedHashTable() {
        this(DEFAULT_INITIAL_CAPACITY);
    }

    /**
     * Constructs an empty table with the default threshold and natural hasher.
     *
     * @param initialCapacity the initial number of buckets
     */
    public ChainedHashTable(final int initialCapacity) {
        this(initialCapacity, DEFAULT_LOAD_FACTOR_THRESHOLD);
    }

    /**
     * Constructs an empty table with the natural hasher.
     *
     * @param initialCapacity     the initial number of buckets
     * @param loadFactorThreshold the highest allowed {@code size / capacity} after an insert
     */
    public ChainedHashTable(final int initialCapacity, final double loadFactorThreshold) {
        this(initialCapacity, loadFactorThreshold, KeyHasher.natural());
    }

    /**
     * Constructs an empty table.
     *
     * @param initialCapacity     the initial number of buckets
     * @param loadFactorThreshold the highest allowed {@code size / capacity} after an insert
     * @param hasher              hash capability and key equality
     */
    public ChainedHashTable(final int initialCapacity, final double loadFactorThreshold,
                            final KeyHasher<? super K> hasher) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be positive");
        }
        if (initialCapacity > MAXIMUM_CAPACITY) {
            throw new IllegalArgumentException("initialCapacity must not exceed " + MAXIMUM_CAPACITY);
        }
        if (!(loadFactorThreshold > 0) || Double.isInfinite(loadFactorThreshold)) {
            throw new IllegalArgumentException("loadFactorThreshold must be positive and finite");
        }
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.loadFactorThreshold = loadFactorThreshold;
        this.buckets = newBuckets(initialCapacity);
    }

    @SuppressWarnings("unchecked")
    private static <K, V> ChainNode<K, V>[] newBuckets(final int capacity) {
        return (ChainNode<K, V>[]) new ChainNode[capacity];
    }

    // ---------------------- Bucket Primitives ----------------------

    private int indexFor(final K key, final int capacity) {
        return Integer.remainderUnsigned(hasher.hash(key), capacity);
    }

    /**
     * Walks the chain of the key's bucket and returns the first node holding an equivalent key.
     *
     * @param key the key.
     * @return matching node or null.
     */
    private ChainNode<K, V> findNode(final K key) {
        for (ChainNode<K, V> node = buckets[indexFor(key, buckets.length)]; node != null; node = node.next) {
            if (hasher.equivalent(node.key, key)) {
                return node;
            }
        }
        return null;
    }

    /**
     * Links a node at the tail of the chain in the given bucket.
     *
     * @param index bucket index.
     * @param node  the new node.
     */
    private void linkLast(final int index, final ChainNode<K, V> node) {
        ChainNode<K, V> tail = buckets[index];
        if (tail == null) {
            buckets[index] = node;
            return;
        }
        while (tail.next != null) {
            tail = tail.next;
        }
        tail.next = node;
    }

    /**
     * Unlinks the node holding an equivalent key, rewiring its predecessor (or the bucket head) to its
     * successor.
     *
     * @param key the key.
     * @return the removed node, or null if absent.
     */
    private ChainNode<K, V> unlink(final K key) {
        final int index = indexFor(key, buckets.length);
        ChainNode<K, V> prev = null;
        for (ChainNode<K, V> node = buckets[index]; node != null; prev = node, node = node.next) {
            if (hasher.equivalent(node.key, key)) {
                if (prev == null) {
                    buckets[index] = node.next;
                } else {
                    prev.next = node.next;
                }
                node.next = null;
                size--;
                modCount++;
                return node;
            }
        }
        return null;
    }

    // ---------------------- Table Operations ----------------------

    /**
     * Associates {@code value} with {@code key}. An existing entry has its value replaced in place; a
     * new key is appended to its chain, growing the table first if the entry would push the load
     * factor above the threshold.
     *
     * @param key   the key.
     * @param value the value.
     * @return previous value, or null if the key was absent.
     */
    public V insert(final K key, final V value) {
        Objects.requireNonNull(key, "Key cannot be null");
        final ChainNode<K, V> existing = findNode(key);
        if (existing != null) {
            return existing.replace(value);
        }
        ensureCapacity(size + 1);
        linkLast(indexFor(key, buckets.length), new ChainNode<>(key, value));
        size++;
        modCount++;
        return null;
    }

    /**
     * Returns the value mapped to {@code key}.
     *
     * @param key the key.
     * @return the mapped value.
     * @throws KeyNotFoundException if the table holds no entry for {@code key}.
     */
    public V search(final K key) {
        Objects.requireNonNull(key, "Key cannot be null");
        final ChainNode<K, V> node = findNode(key);
        if (node == null) {
            throw new KeyNotFoundException(key);
        }
        return node.value;
    }

    /**
     * Returns true if the table holds an entry for {@code key}.
     *
     * @param key the key.
     * @return true if present.
     */
    public boolean contains(final K key) {
        Objects.requireNonNull(key, "Key cannot be null");
        return findNode(key) != null;
    }

    /**
     * Removes the entry for {@code key}. The table never shrinks.
     *
     * @param key the key.
     * @return the removed value.
     * @throws KeyNotFoundException if the table holds no entry for {@code key}.
     */
    public V delete(final K key) {
        Objects.requireNonNull(key, "Key cannot be null");
        final ChainNode<K, V> node = unlink(key);
        if (node == null) {
            throw new KeyNotFoundException(key);
        }
        return node.value;
    }

    /**
     * Returns a snapshot of all keys, in bucket order and then chain order.
     *
     * @return list of keys.
     */
    public List<K> getAllKeys() {
        final List<K> keys = new ArrayList<>(size);
        for (final ChainNode<K, V> head : buckets) {
            for (ChainNode<K, V> node = head; node != null; node = node.next) {
                keys.add(node.key);
            }
        }
        return keys;
    }

    /**
     * Returns a snapshot of all values, in the same order as {@link #getAllKeys()}.
     *
     * @return list of values.
     */
    public List<V> getAllValues() {
        final List<V> values = new ArrayList<>(size);
        for (final ChainNode<K, V> head : buckets) {
            for (ChainNode<K, V> node = head; node != null; node = node.next) {
                values.add(node.value);
            }
        }
        return values;
    }

    /**
     * Returns the length of every chain, indexed by bucket.
     *
     * @return chain lengths.
     */
    public int[] chainLengths() {
        final int[] lengths = new int[buckets.length];
        for (int i = 0; i < buckets.length; i++) {
            for (ChainNode<K, V> node = buckets[i]; node != null; node = node.next) {
                lengths[i]++;
            }
        }
        return lengths;
    }

    /**
     * Returns the current number of buckets.
     *
     * @return capacity.
     */
    public int capacity() {
        return buckets.length;
    }

    /**
     * Returns {@code size / capacity}.
     *
     * @return current load factor.
     */
    public double loadFactor() {
        return (double) size / buckets.length;
    }

    public double loadFactorThreshold() {
        return loadFactorThreshold;
    }

    // ---------------------- Resizing ----------------------

    /**
     * Grows the table, if needed, so that it can hold {@code minSize} entries without exceeding the
     * load factor threshold.
     *
     * @param minSize number of entries the table must accommodate.
     */
    private void ensureCapacity(final int minSize) {
        final int capacity = buckets.length;
        if (minSize <= loadFactorThreshold * capacity) {
            return;
        }
        int newCapacity = capacity;
        while (minSize > loadFactorThreshold * newCapacity && newCapacity < MAXIMUM_CAPACITY) {
            newCapacity = newCapacity >= MAXIMUM_CAPACITY / 2 ? MAXIMUM_CAPACITY : newCapacity << 1;
        }
        if (newCapacity == capacity) {
            if (!saturated) {
                saturated = true;
                log.warn("Table reached maximum capacity {}, chains will grow past load factor {}",
                        MAXIMUM_CAPACITY, loadFactorThreshold);
            }
            return;
        }
        resize(newCapacity);
    }

    /**
     * Relinks every node into a new bucket array of the given capacity.
     *
     * <p>The new array and all new bucket indexes are computed before any node is touched, so a failure
     * there leaves the table as it was.
     *
     * @param newCapacity the new capacity.
     * @throws IllegalStateException if relinking loses or duplicates a node.
     */
    private void resize(final int newCapacity) {
        final ChainNode<K, V>[] oldBuckets = buckets;
        final ChainNode<K, V>[] newBuckets = newBuckets(newCapacity);
        final int[] targets = new int[size];
        int n = 0;
        for (final ChainNode<K, V> head : oldBuckets) {
            for (ChainNode<K, V> node = head; node != null; node = node.next) {
                targets[n++] = indexFor(node.key, newCapacity);
            }
        }

        int moved = 0;
        for (final ChainNode<K, V> head : oldBuckets) {
            ChainNode<K, V> node = head;
            while (node != null) {
                final ChainNode<K, V> next = node.next;
                final int index = targets[moved++];
                node.next = newBuckets[index];
                newBuckets[index] = node;
                node = next;
            }
        }
        if (moved != size) {
            throw new IllegalStateException("Rehashing error: inconsistent size after resize");
        }
        buckets = newBuckets;
        modCount++;
        log.debug("Resized table from {} to {} buckets ({} entries)", oldBuckets.length, newCapacity, size);
    }

    // ---------------------- Map Methods ----------------------

    /**
     * Same as {@link #insert(Object, Object)}.
     *
     * @param key   the key.
     * @param value the value.
     * @return previous value or null.
     */
    @Override
    public V put(final K key, final V value) {
        return insert(key, value);
    }

    /**
     * Returns the value associated with the specified key, or null if not found.
     *
     * @param key the key.
     * @return associated value or null.
     */
    @Override
    @SuppressWarnings("unchecked")
    public V get(final Object key) {
        Objects.requireNonNull(key, "Key cannot be null");
        final ChainNode<K, V> node = findNode((K) key);
        return node == null ? null : node.value;
    }

    @Override
    @SuppressWarnings("unchecked")
    public boolean containsKey(final Object key) {
        return contains((K) key);
    }

    /**
     * Removes the mapping for the specified key, if present.
     *
     * @param key the key.
     * @return previous value or null.
     */
    @Override
    @SuppressWarnings("unchecked")
    public V remove(final Object key) {
        Objects.requireNonNull(key, "Key cannot be null");
        final ChainNode<K, V> node = unlink((K) key);
        return node == null ? null : node.value;
    }

    /**
     * Returns true if this table maps one or more keys to the specified value.
     *
     * @param value the value.
     * @return true if value is present.
     */
    @Override
    public boolean containsValue(final Object value) {
        for (final ChainNode<K, V> head : buckets) {
            for (ChainNode<K, V> node = head; node != null; node = node.next) {
                if (Objects.equals(node.value, value)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Copies all mappings from the specified map, growing the table at most once up front.
     *
     * @param m the map.
     */
    @Override
    public void putAll(final Map<? extends K, ? extends V> m) {
        ensureCapacity(size + m.size());
        for (final Map.Entry<? extends K, ? extends V> e : m.entrySet()) {
            insert(e.getKey(), e.getValue());
        }
    }

    /**
     * Removes all mappings. The capacity is kept.
     */
    @Override
    public void clear() {
        Arrays.fill(buckets, null);
        size = 0;
        modCount++;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public boolean isEmpty() {
        return size == 0;
    }

    // ---------------------- View Collections ----------------------

    private Set<Map.Entry<K, V>> entrySet;

    /**
     * Returns a Set view of the mappings, iterated in bucket order and then chain order. Entries are
     * immutable snapshots; removal through the iterator is supported.
     *
     * @return set of entries.
     */
    @Override
    public Set<Map.Entry<K, V>> entrySet() {
        if (entrySet == null) {
            entrySet = new AbstractSet<>() {
                @Override
                public Iterator<Map.Entry<K, V>> iterator() {
                    return new EntryIterator();
                }

                @Override
                public int size() {
                    return ChainedHashTable.this.size;
                }

                @Override
                public void clear() {
                    ChainedHashTable.this.clear();
                }
            };
        }
        return entrySet;
    }

    /**
     * Returns a Set view of the keys, backed by this table.
     *
     * @return set of keys.
     */
    @Override
    public Set<K> keySet() {
        return new AbstractSet<>() {
            @Override
            public Iterator<K> iterator() {
                final Iterator<Map.Entry<K, V>> entries = new EntryIterator();
                return new Iterator<>() {
                    @Override
                    public boolean hasNext() {
                        return entries.hasNext();
                    }

                    @Override
                    public K next() {
                        return entries.next().getKey();
                    }

                    @Override
                    public void remove() {
                        entries.remove();
                    }
                };
            }

            @Override
            public boolean contains(final Object o) {
                return o != null && containsKey(o);
            }

            @Override
            public int size() {
                return ChainedHashTable.this.size;
            }
        };
    }

    /**
     * Returns a Collection view of the values, backed by this table.
     *
     * @return collection of values.
     */
    @Override
    public Collection<V> values() {
        return new AbstractCollection<>() {
            @Override
            public Iterator<V> iterator() {
                final Iterator<Map.Entry<K, V>> entries = new EntryIterator();
                return new Iterator<>() {
                    @Override
                    public boolean hasNext() {
                        return entries.hasNext();
                    }

                    @Override
                    public V next() {
                        return entries.next().getValue();
                    }

                    @Override
                    public void remove() {
                        entries.remove();
                    }
                };
            }

            @Override
            public boolean contains(final Object o) {
                return containsValue(o);
            }

            @Override
            public int size() {
                return ChainedHashTable.this.size;
            }
        };
    }

    /**
     * Walks buckets in index order and each chain from head to tail. Fails fast if the table is
     * structurally modified other than through {@link #remove()}.
     */
    private final class EntryIterator implements Iterator<Map.Entry<K, V>> {

        int bucket = 0;
        ChainNode<K, V> nextNode;
        ChainNode<K, V> lastReturned;
        int expectedModCount = modCount;

        EntryIterator() {
            nextNode = advance(null);
        }

        // Returns the node after current, moving on to later buckets when the chain ends.
        private ChainNode<K, V> advance(final ChainNode<K, V> current) {
            if (current != null && current.next != null) {
                return current.next;
            }
            while (bucket < buckets.length) {
                final ChainNode<K, V> head = buckets[bucket++];
                if (head != null) {
                    return head;
                }
            }
            return null;
        }

        @Override
        public boolean hasNext() {
            return nextNode != null;
        }

        @Override
        public Map.Entry<K, V> next() {
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
            if (nextNode == null) {
                throw new NoSuchElementException();
            }
            lastReturned = nextNode;
            nextNode = advance(nextNode);
            return new AbstractMap.SimpleImmutableEntry<>(lastReturned.key, lastReturned.value);
        }

        @Override
        public void remove() {
            if (lastReturned == null) {
                throw new IllegalStateException();
            }
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
            unlink(lastReturned.key);
            lastReturned = null;
            expectedModCount = modCount;
        }
    }

    // ---------------------- Object Methods ----------------------

    /**
     * Compares the specified object with this table for equality, following the {@link Map} contract.
     *
     * @param o the object.
     * @return true if equal.
     */
    @Override
    public boolean equals(final Object o) {
        if (o == this) {
            return true;
        }
        if (!(o instanceof Map<?, ?> m)) {
            return false;
        }
        if (m.size() != size) {
            return false;
        }
        try {
            for (final ChainNode<K, V> head : buckets) {
                for (ChainNode<K, V> node = head; node != null; node = node.next) {
                    if (node.value == null) {
                        if (m.get(node.key) != null || !m.containsKey(node.key)) {
                            return false;
                        }
                    } else if (!node.value.equals(m.get(node.key))) {
                        return false;
                    }
                }
            }
        } catch (final ClassCastException | NullPointerException unused) {
            return false;
        }
        return true;
    }

    /**
     * Returns the hash code value for this table: the sum of its entries' hash codes.
     *
     * @return hash code.
     */
    @Override
    public int hashCode() {
        int h = 0;
        for (final ChainNode<K, V> head : buckets) {
            for (ChainNode<K, V> node = head; node != null; node = node.next) {
                h += Objects.hashCode(node.key) ^ Objects.hashCode(node.value);
            }
        }
        return h;
    }

    /**
     * Returns a string representation of this table.
     *
     * @return string representation.
     */
    @Override
    public String toString() {
        final Iterator<Map.Entry<K, V>> i = entrySet().iterator();
        if (!i.hasNext()) {
            return "{}";
        }
        final StringBuilder sb = new StringBuilder();
        sb.append('{');
        while (true) {
            final Map.Entry<K, V> e = i.next();
            sb.append(e.getKey()).append('=').append(e.getValue());
            if (!i.hasNext()) {
                return sb.append('}').toString();
            }
            sb.append(", ");
        }
    }
}
