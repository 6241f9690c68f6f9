package com.ascherbakoff.ordmap.map;

import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Outcome of a compound operation: the value seen or stored, and whether it was already present.
 *
 * @param <V> Value type.
 */
public class LoadResult<V> {
    private final @Nullable V value;

    private final boolean loaded;

    LoadResult(@Nullable V value, boolean loaded) {
        this.value = value;
        this.loaded = loaded;
    }

    static <V> LoadResult<V> loaded(V value) {
        return new LoadResult<>(value, true);
    }

    static <V> LoadResult<V> stored(V value) {
        return new LoadResult<>(value, false);
    }

    static <V> LoadResult<V> missing() {
        return new LoadResult<>(null, false);
    }

    /**
     * @return The current value for {@code loadOrStore}, the removed value for {@code loadAndDelete},
     *      {@code null} if nothing was removed.
     */
    public @Nullable V value() {
        return value;
    }

    /**
     * @return {@code true} if the key was live when the operation started.
     */
    public boolean loaded() {
        return loaded;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;

        if (o == null || getClass() != o.getClass())
            return false;

        LoadResult<?> that = (LoadResult<?>) o;

        return loaded == that.loaded && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, loaded);
    }

    @Override
    public String toString() {
        return "LoadResult{value=" + value + ", loaded=" + loaded + '}';
    }
}
