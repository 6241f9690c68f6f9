package com.ascherbakoff.ordmap.map;

import java.util.List;
import java.util.Map;
import java.util.function.BiPredicate;
import org.jetbrains.annotations.Nullable;

/**
 * A thread-safe map which keeps its keys in ascending order.
 *
 * <p>Every operation is atomic. Read operations may run in parallel with each other, mutations are exclusive.
 * Values are never {@code null}, so a {@code null} result of {@link #load} means the key is absent.
 *
 * @param <K> Key type.
 * @param <V> Value type.
 */
public interface OrderedMap<K, V> {
    /**
     * Inserts the entry or replaces the value of a live key.
     */
    void store(K key, V value);

    /**
     * @return The value or {@code null} if the key is absent.
     */
    @Nullable V load(K key);

    /**
     * Removes the key. Does nothing if the key is absent.
     */
    void delete(K key);

    /**
     * Returns the current value if the key is live, otherwise stores the given value.
     *
     * @return {@code (current, true)} if the key was live, {@code (value, false)} if the value was stored.
     */
    LoadResult<V> loadOrStore(K key, V value);

    /**
     * Removes the key and returns its value.
     *
     * @return {@code (removed, true)} or {@code (null, false)} if the key was absent.
     */
    LoadResult<V> loadAndDelete(K key);

    boolean containsKey(K key);

    int size();

    boolean isEmpty();

    /**
     * @return A copy of the live keys in ascending order.
     */
    List<K> keys();

    @Nullable K firstKey();

    @Nullable K lastKey();

    /**
     * Visits all entries in ascending key order until the visitor returns {@code false}.
     *
     * <p>Writers are blocked while the traversal runs. The visitor must not mutate this map.
     */
    void range(BiPredicate<? super K, ? super V> visitor);

    /**
     * Visits the entries between the bounds in ascending key order until the visitor returns {@code false}.
     *
     * @param lower Lower bound or {@code null} for none.
     * @param lowerInclusive Include lower bound.
     * @param upper Upper bound or {@code null} for none.
     * @param upperInclusive Include upper bound.
     * @param visitor The visitor.
     */
    void range(@Nullable K lower, boolean lowerInclusive, @Nullable K upper, boolean upperInclusive,
            BiPredicate<? super K, ? super V> visitor);

    /**
     * Copies the entries between the bounds in ascending key order. The copy is not affected by later updates.
     */
    List<Map.Entry<K, V>> scan(@Nullable K lower, boolean lowerInclusive, @Nullable K upper, boolean upperInclusive);
}
