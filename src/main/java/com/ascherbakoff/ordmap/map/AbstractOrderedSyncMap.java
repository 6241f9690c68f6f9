package com.ascherbakoff.ordmap.map;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BiPredicate;
import org.jetbrains.annotations.Nullable;

/**
 * Guards an unsynchronized ordered structure with a single read-write lock.
 *
 * <p>Each public method is one critical section. Subclasses implement the {@code do*} methods, which are always
 * called with the appropriate lock held and with validated arguments.
 *
 * @param <K> Key type.
 * @param <V> Value type.
 */
public abstract class AbstractOrderedSyncMap<K, V> implements OrderedMap<K, V> {
    protected final Class<K> keyType;

    protected final Comparator<? super K> comparator;

    private final ReentrantReadWriteLock lock;

    protected AbstractOrderedSyncMap(Class<K> keyType, Comparator<? super K> comparator, boolean fair) {
        this.keyType = Objects.requireNonNull(keyType, "keyType");
        this.comparator = Objects.requireNonNull(comparator, "comparator");
        this.lock = new ReentrantReadWriteLock(fair);
    }

    protected abstract @Nullable V doLoad(K key);

    /**
     * @return Previous value or {@code null} if the key was inserted.
     */
    protected abstract @Nullable V doStore(K key, V value);

    /**
     * @return Removed value or {@code null} if the key was absent.
     */
    protected abstract @Nullable V doDelete(K key);

    protected abstract int doSize();

    protected abstract List<K> doKeys();

    protected abstract @Nullable K doFirstKey();

    protected abstract @Nullable K doLastKey();

    protected abstract void doRange(@Nullable K lower, boolean lowerInclusive, @Nullable K upper,
            boolean upperInclusive, BiPredicate<? super K, ? super V> visitor);

    @Override
    public void store(K key, V value) {
        checkKey(key);
        Objects.requireNonNull(value, "value");

        lockWrite();

        try {
            doStore(key, value);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public @Nullable V load(K key) {
        checkKey(key);

        lock.readLock().lock();

        try {
            return doLoad(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void delete(K key) {
        checkKey(key);

        lockWrite();

        try {
            doDelete(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public LoadResult<V> loadOrStore(K key, V value) {
        checkKey(key);
        Objects.requireNonNull(value, "value");

        lockWrite();

        try {
            V cur = doLoad(key);

            if (cur != null)
                return LoadResult.loaded(cur);

            doStore(key, value);

            return LoadResult.stored(value);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public LoadResult<V> loadAndDelete(K key) {
        checkKey(key);

        lockWrite();

        try {
            V removed = doDelete(key);

            return removed == null ? LoadResult.missing() : LoadResult.loaded(removed);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean containsKey(K key) {
        return load(key) != null;
    }

    @Override
    public int size() {
        lock.readLock().lock();

        try {
            return doSize();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public List<K> keys() {
        lock.readLock().lock();

        try {
            return doKeys();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public @Nullable K firstKey() {
        lock.readLock().lock();

        try {
            return doFirstKey();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public @Nullable K lastKey() {
        lock.readLock().lock();

        try {
            return doLastKey();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void range(BiPredicate<? super K, ? super V> visitor) {
        range(null, true, null, true, visitor);
    }

    @Override
    public void range(@Nullable K lower, boolean lowerInclusive, @Nullable K upper, boolean upperInclusive,
            BiPredicate<? super K, ? super V> visitor) {
        Objects.requireNonNull(visitor, "visitor");

        if (emptyBounds(lower, lowerInclusive, upper, upperInclusive))
            return;

        lock.readLock().lock();

        try {
            doRange(lower, lowerInclusive, upper, upperInclusive, visitor);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Map.Entry<K, V>> scan(@Nullable K lower, boolean lowerInclusive, @Nullable K upper,
            boolean upperInclusive) {
        List<Map.Entry<K, V>> copy = new ArrayList<>();

        range(lower, lowerInclusive, upper, upperInclusive, (k, v) -> copy.add(new SimpleImmutableEntry<>(k, v)));

        return Collections.unmodifiableList(copy);
    }

    /**
     * Validates the bounds. Returns {@code true} if no key can fall between them.
     */
    private boolean emptyBounds(@Nullable K lower, boolean lowerInclusive, @Nullable K upper, boolean upperInclusive) {
        if (lower != null)
            checkKey(lower);

        if (upper != null)
            checkKey(upper);

        if (lower == null || upper == null)
            return false;

        int cmp = comparator.compare(lower, upper);

        return cmp > 0 || cmp == 0 && !(lowerInclusive && upperInclusive);
    }

    /**
     * Rejects keys which are outside of the key domain. Generic signatures make this unreachable for checked calls.
     */
    protected void checkKey(Object key) {
        Objects.requireNonNull(key, "key");

        if (!keyType.isInstance(key))
            throw new KeyDomainException(keyType, key);
    }

    /**
     * Takes the write lock. A read lock can't be upgraded, so a mutation from a range visitor would hang forever.
     */
    private void lockWrite() {
        if (lock.getReadHoldCount() > 0)
            throw new IllegalStateException("Map can't be modified while it is traversed by the same thread");

        lock.writeLock().lock();
    }
}
