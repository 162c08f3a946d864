/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling.indexed;

import org.maxilp.util.exception.ConstructionException;
import org.maxilp.util.exception.IndexMismatchException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered set of labels along which variables and constraints are created.
 * <p>
 * Labels can be any objects with proper {@code equals} and {@code hashCode}:
 * integers, strings, or {@link Tuple}s for composite labels
 * (see {@link #product(Index, Index)}). Each dimension can be given a name,
 * reported in the schema of a model.
 *
 * @param <K> the type of the labels
 */
public final class Index<K> implements Iterable<K> {

    private final List<K> keys;
    private final Map<K, Integer> positions;
    private final List<String> names;

    private Index(List<K> keys, List<String> names) {
        this.keys = Collections.unmodifiableList(new ArrayList<>(keys));
        this.positions = new HashMap<>();
        for (int i = 0; i < this.keys.size(); i++) {
            K key = Objects.requireNonNull(this.keys.get(i), "null label");
            if (positions.putIfAbsent(key, i) != null)
                throw new ConstructionException("duplicate label " + key + " in index");
        }
        this.names = Collections.unmodifiableList(new ArrayList<>(names));
    }

    /**
     * @throws ConstructionException if a label appears twice
     */
    @SafeVarargs
    public static <K> Index<K> of(K... keys) {
        return new Index<>(Arrays.asList(keys), List.of());
    }

    /**
     * @throws ConstructionException if a label appears twice
     */
    public static <K> Index<K> of(List<K> keys) {
        return new Index<>(keys, List.of());
    }

    /**
     * @return the labels {@code 0, 1, ..., n-1}
     */
    public static Index<Integer> range(int n) {
        List<Integer> keys = new ArrayList<>(n);
        for (int i = 0; i < n; i++)
            keys.add(i);
        return new Index<>(keys, List.of());
    }

    /**
     * Cartesian product of two indices, the labels of {@code a} varying slowest.
     * Tuple labels are flattened, so the product of three indices has labels of three components.
     */
    public static Index<Tuple> product(Index<?> a, Index<?> b) {
        List<Tuple> keys = new ArrayList<>(a.size() * b.size());
        for (Object x : a)
            for (Object y : b)
                keys.add(Tuple.concat(x, y));
        List<String> names = new ArrayList<>();
        if (!a.names.isEmpty() || !b.names.isEmpty()) {
            names.addAll(a.dimensionNames());
            names.addAll(b.dimensionNames());
        }
        return new Index<>(keys, names);
    }

    /**
     * @param names one name per dimension, or none to remove the names
     * @return the same labels with named dimensions
     * @throws IndexMismatchException if the number of names differs from the number of dimensions
     */
    public Index<K> withNames(String... names) {
        if (names.length > 0 && names.length != dimensions())
            throw new IndexMismatchException(names.length + " names given for an index of "
                    + dimensions() + " dimensions");
        return new Index<>(keys, Arrays.asList(names));
    }

    /**
     * @return the names of the dimensions, one {@code null} per unnamed dimension
     */
    public List<String> dimensionNames() {
        if (!names.isEmpty())
            return names;
        return Collections.nCopies(dimensions(), null);
    }

    /**
     * @return the number of components of the labels, 1 unless they are tuples
     */
    public int dimensions() {
        return !keys.isEmpty() && keys.get(0) instanceof Tuple t ? t.size() : 1;
    }

    public int size() {
        return keys.size();
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    public K get(int position) {
        return keys.get(position);
    }

    public boolean contains(Object key) {
        return positions.containsKey(key);
    }

    /**
     * @return the position of the label, {@code -1} if it is not in the index
     */
    public int positionOf(Object key) {
        Integer position = positions.get(key);
        return position == null ? -1 : position;
    }

    public List<K> keys() {
        return keys;
    }

    /**
     * @return true if both indices contain the same labels, in any order
     */
    public boolean sameKeys(Index<?> other) {
        return size() == other.size() && positions.keySet().equals(other.positions.keySet());
    }

    @Override
    public Iterator<K> iterator() {
        return keys.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Index<?> other)) return false;
        return keys.equals(other.keys) && names.equals(other.names);
    }

    @Override
    public int hashCode() {
        return 31 * keys.hashCode() + names.hashCode();
    }

    @Override
    public String toString() {
        return "Index" + keys;
    }
}
