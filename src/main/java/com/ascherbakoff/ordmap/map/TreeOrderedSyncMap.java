package com.ascherbakoff.ordmap.map;

import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map.Entry;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.function.BiPredicate;
import org.jetbrains.annotations.Nullable;

/**
 * Ordered map on top of a red-black tree. Inserts and removals are O(log n).
 *
 * @param <K> Key type.
 * @param <V> Value type.
 */
public class TreeOrderedSyncMap<K, V> extends AbstractOrderedSyncMap<K, V> {
    private static System.Logger LOGGER = System.getLogger(TreeOrderedSyncMap.class.getName());

    final TreeMap<K, V> data;

    public TreeOrderedSyncMap(Class<K> keyType, Comparator<? super K> comparator) {
        this(keyType, comparator, false);
    }

    public TreeOrderedSyncMap(Class<K> keyType, Comparator<? super K> comparator, boolean fair) {
        super(keyType, comparator, fair);

        this.data = new TreeMap<>(comparator);

        LOGGER.log(Level.DEBUG, "Created tree ordered map keyType={0} fair={1}", keyType.getName(), fair);
    }

    public static <K extends Comparable<? super K>, V> TreeOrderedSyncMap<K, V> natural(Class<K> keyType) {
        return new TreeOrderedSyncMap<>(keyType, Comparator.naturalOrder());
    }

    @Override
    protected @Nullable V doLoad(K key) {
        return data.get(key);
    }

    @Override
    protected @Nullable V doStore(K key, V value) {
        return data.put(key, value);
    }

    @Override
    protected @Nullable V doDelete(K key) {
        return data.remove(key);
    }

    @Override
    protected int doSize() {
        return data.size();
    }

    @Override
    protected List<K> doKeys() {
        return new ArrayList<>(data.keySet());
    }

    @Override
    protected @Nullable K doFirstKey() {
        return data.isEmpty() ? null : data.firstKey();
    }

    @Override
    protected @Nullable K doLastKey() {
        return data.isEmpty() ? null : data.lastKey();
    }

    @Override
    protected void doRange(@Nullable K lower, boolean lowerInclusive, @Nullable K upper, boolean upperInclusive,
            BiPredicate<? super K, ? super V> visitor) {
        NavigableMap<K, V> subMap;

        if (lower == null && upper == null) {
            subMap = data;
        } else if (lower == null) {
            subMap = data.headMap(upper, upperInclusive);
        } else if (upper == null) {
            subMap = data.tailMap(lower, lowerInclusive);
        } else {
            subMap = data.subMap(lower, lowerInclusive, upper, upperInclusive);
        }

        for (Entry<K, V> e : subMap.entrySet()) {
            if (!visitor.test(e.getKey(), e.getValue()))
                return;
        }
    }
}
