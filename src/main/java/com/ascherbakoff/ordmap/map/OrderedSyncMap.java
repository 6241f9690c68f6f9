package com.ascherbakoff.ordmap.map;

import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiPredicate;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.TestOnly;

/**
 * Ordered map built of a hash map for lookups and a sorted key array for ordered traversal.
 *
 * <p>Lookups are O(1). Inserting or removing a key shifts the tail of the key array, which is O(n), so this
 * implementation suits small to moderate maps with rare structural changes. See {@link TreeOrderedSyncMap} for
 * larger ones.
 *
 * <p>Keys are identified by the comparator. The hash map is keyed by the key instance held in the index, so a
 * key which compares equal to a live one but is not {@code equals} to it still resolves to the same entry.
 *
 * @param <K> Key type.
 * @param <V> Value type.
 */
public class OrderedSyncMap<K, V> extends AbstractOrderedSyncMap<K, V> {
    private static System.Logger LOGGER = System.getLogger(OrderedSyncMap.class.getName());

    private static final int DEFAULT_CAPACITY = 16;

    /** Entries. */
    final Map<K, V> data;

    /** Live keys, ascending, no duplicates. */
    final ArrayList<K> keys;

    public OrderedSyncMap(Class<K> keyType, Comparator<? super K> comparator) {
        this(keyType, comparator, DEFAULT_CAPACITY, false);
    }

    public OrderedSyncMap(Class<K> keyType, Comparator<? super K> comparator, int initialCapacity, boolean fair) {
        super(keyType, comparator, fair);

        if (initialCapacity < 0)
            throw new IllegalArgumentException("Negative capacity: " + initialCapacity);

        this.data = new HashMap<>(initialCapacity);
        this.keys = new ArrayList<>(initialCapacity);

        LOGGER.log(Level.DEBUG, "Created ordered map keyType={0} capacity={1} fair={2}", keyType.getName(),
                initialCapacity, fair);
    }

    public static <K extends Comparable<? super K>, V> OrderedSyncMap<K, V> natural(Class<K> keyType) {
        return new OrderedSyncMap<>(keyType, Comparator.naturalOrder());
    }

    /**
     * @return Index of the key if it is live, otherwise {@code -(insertion point) - 1}.
     */
    private int search(K key) {
        return Collections.binarySearch(keys, key, comparator);
    }

    @Override
    protected @Nullable V doLoad(K key) {
        V v = data.get(key);

        if (v != null)
            return v;

        int pos = search(key);

        return pos >= 0 ? data.get(keys.get(pos)) : null;
    }

    @Override
    protected @Nullable V doStore(K key, V value) {
        int pos = search(key);

        if (pos >= 0)
            return data.put(keys.get(pos), value); // Index is unchanged.

        V prev = data.put(key, value);

        assert prev == null : "Key has a value but is not indexed: " + key;

        keys.add(-pos - 1, key);

        return prev;
    }

    @Override
    protected @Nullable V doDelete(K key) {
        int pos = search(key);

        if (pos < 0)
            return null;

        K indexed = keys.remove(pos);

        V removed = data.remove(indexed);

        assert removed != null : "Key is indexed but has no value: " + indexed;

        return removed;
    }

    @Override
    protected int doSize() {
        return data.size();
    }

    @Override
    protected List<K> doKeys() {
        return new ArrayList<>(keys);
    }

    @Override
    protected @Nullable K doFirstKey() {
        return keys.isEmpty() ? null : keys.get(0);
    }

    @Override
    protected @Nullable K doLastKey() {
        return keys.isEmpty() ? null : keys.get(keys.size() - 1);
    }

    @Override
    protected void doRange(@Nullable K lower, boolean lowerInclusive, @Nullable K upper, boolean upperInclusive,
            BiPredicate<? super K, ? super V> visitor) {
        int from = 0;

        if (lower != null) {
            int pos = search(lower);

            from = pos >= 0 ? (lowerInclusive ? pos : pos + 1) : -pos - 1;
        }

        for (int i = from; i < keys.size(); i++) {
            K k = keys.get(i);

            if (upper != null) {
                int cmp = comparator.compare(k, upper);

                if (cmp > 0 || cmp == 0 && !upperInclusive)
                    break;
            }

            V v = data.get(k);

            if (v == null) {
                LOGGER.log(Level.WARNING, "Skipping indexed key without a value: {0}", k);

                assert false : "Key is indexed but has no value: " + k;

                continue;
            }

            if (!visitor.test(k, v))
                return;
        }
    }

    /**
     * Checks the structural invariants. Must not be called concurrently with mutations.
     *
     * @throws IllegalStateException If an invariant is broken.
     */
    @TestOnly
    void validate() {
        if (keys.size() != data.size())
            throw new IllegalStateException("Index size " + keys.size() + " != entries " + data.size());

        for (int i = 0; i < keys.size(); i++) {
            K k = keys.get(i);

            if (i > 0 && comparator.compare(keys.get(i - 1), k) >= 0)
                throw new IllegalStateException("Index is not strictly ascending at " + i + ": " + keys);

            if (!data.containsKey(k))
                throw new IllegalStateException("Indexed key has no value: " + k);

            if (search(k) != i)
                throw new IllegalStateException("Binary search doesn't locate key " + k + " at " + i);
        }
    }
}
