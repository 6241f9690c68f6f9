package com.ascherbakoff.ordmap.map;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Comparator;
import java.util.List;
import org.junit.jupiter.api.Test;

public class TreeOrderedSyncMapTest extends OrderedMapBasicTest {
    public TreeOrderedSyncMapTest() {
        map = TreeOrderedSyncMap.natural(Integer.class);
    }

    @Override
    protected <K> OrderedMap<K, String> create(Class<K> keyType, Comparator<? super K> comparator) {
        return new TreeOrderedSyncMap<>(keyType, comparator);
    }

    @Test
    public void testFairLock() {
        TreeOrderedSyncMap<Integer, String> map = new TreeOrderedSyncMap<>(Integer.class, Comparator.naturalOrder(), true);

        map.store(3, "c");
        map.store(1, "a");
        map.delete(3);

        assertEquals(List.of(1), map.keys());
        assertEquals(1, map.data.size());
    }
}
