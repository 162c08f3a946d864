/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Multimap remembering the order in which keys, and values of each key, were first inserted.
 * Unlike a set-based multimap, a value may be stored several times under the same key.
 */
public class OrderedMultimap<K, V> {
    private final LinkedHashMap<K, List<V>> map;

    public OrderedMultimap() {
        map = new LinkedHashMap<>();
    }

    /**
     * @return the values of the key in insertion order, an empty list if there are none
     */
    public List<V> get(K key) {
        List<V> values = map.get(key);
        if (values == null)
            return Collections.emptyList();
        return Collections.unmodifiableList(values);
    }

    public void put(K key, V value) {
        map.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    public Set<K> keySet() {
        return Collections.unmodifiableSet(map.keySet());
    }
}
