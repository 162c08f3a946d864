/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling.indexed;

import org.maxilp.util.OrderedMultimap;
import org.maxilp.util.exception.IndexMismatchException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Immutable table associating a value to each label of an {@link Index}.
 * Iteration always follows the order of the index.
 * <pre>
 * Index&lt;Tuple&gt; idx = Index.product(Index.of("a", "b"), Index.range(3));
 * Series&lt;Tuple, Variable&gt; x = model.createVariables("x", idx, 0, 10, false);
 * for (Map.Entry&lt;Object, Series&lt;Tuple, Variable&gt;&gt; g : x.groupByLevel(0).entrySet())
 *     model.createLinearConstraints("cap_" + g.getKey(), sum(g.getValue()).le(10));
 * </pre>
 *
 * @param <K> the type of the labels
 * @param <V> the type of the values
 */
public final class Series<K, V> {

    private final Index<K> index;
    private final List<V> values;

    private Series(Index<K> index, List<V> values) {
        this.index = index;
        this.values = Collections.unmodifiableList(values);
    }

    /**
     * @return the series mapping each label of the index to {@code valueOf(label)}
     */
    public static <K, V> Series<K, V> of(Index<K> index, Function<? super K, ? extends V> valueOf) {
        List<V> values = new ArrayList<>(index.size());
        for (K key : index)
            values.add(valueOf.apply(key));
        return new Series<>(index, values);
    }

    public static <K, V> Series<K, V> constant(Index<K> index, V value) {
        return new Series<>(index, new ArrayList<>(Collections.nCopies(index.size(), value)));
    }

    /**
     * @return a series whose labels are the keys of the map, in its iteration order
     */
    public static <K, V> Series<K, V> fromMap(Map<K, ? extends V> map) {
        return new Series<>(Index.of(new ArrayList<>(map.keySet())), new ArrayList<>(map.values()));
    }

    /**
     * @return a series labeled {@code 0, 1, ..., values.size()-1}
     */
    public static <V> Series<Integer, V> fromList(List<? extends V> values) {
        return new Series<>(Index.range(values.size()), new ArrayList<>(values));
    }

    public Index<K> index() {
        return index;
    }

    public List<K> keys() {
        return index.keys();
    }

    /**
     * @return the values in the order of the index
     */
    public List<V> values() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public boolean containsKey(Object key) {
        return index.contains(key);
    }

    /**
     * @throws NoSuchElementException if the label is not in the index
     */
    public V get(Object key) {
        int position = index.positionOf(key);
        if (position < 0)
            throw new NoSuchElementException("no label " + key + " in " + index);
        return values.get(position);
    }

    /**
     * @return the value at a position of the index
     */
    public V valueAt(int position) {
        return values.get(position);
    }

    public <R> Series<K, R> map(Function<? super V, ? extends R> mapper) {
        List<R> result = new ArrayList<>(values.size());
        for (V v : values)
            result.add(mapper.apply(v));
        return new Series<>(index, result);
    }

    public <R> Series<K, R> mapWithKey(BiFunction<? super K, ? super V, ? extends R> mapper) {
        List<R> result = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++)
            result.add(mapper.apply(index.get(i), values.get(i)));
        return new Series<>(index, result);
    }

    /**
     * Restricts the series to some labels, in the order they are given.
     *
     * @throws IndexMismatchException if a label is not in the index
     */
    public Series<K, V> select(Collection<? extends K> keys) {
        List<K> selected = new ArrayList<>(keys.size());
        List<V> result = new ArrayList<>(keys.size());
        for (K key : keys) {
            int position = index.positionOf(key);
            if (position < 0)
                throw new IndexMismatchException("cannot select label " + key + ": not in " + index);
            selected.add(key);
            result.add(values.get(position));
        }
        return new Series<>(Index.of(selected), result);
    }

    /**
     * @return the entries whose label satisfies the predicate
     */
    public Series<K, V> filter(Predicate<? super K> predicate) {
        List<K> selected = new ArrayList<>();
        List<V> result = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            if (predicate.test(index.get(i))) {
                selected.add(index.get(i));
                result.add(values.get(i));
            }
        }
        return new Series<>(Index.of(selected), result);
    }

    /**
     * Splits the series according to a function of the labels.
     * Groups appear in the order of their first label.
     */
    public <G> Map<G, Series<K, V>> groupBy(Function<? super K, ? extends G> groupOf) {
        OrderedMultimap<G, Integer> positions = new OrderedMultimap<>();
        for (int i = 0; i < index.size(); i++)
            positions.put(groupOf.apply(index.get(i)), i);
        Map<G, Series<K, V>> groups = new LinkedHashMap<>();
        for (G group : positions.keySet()) {
            List<K> keys = new ArrayList<>();
            List<V> result = new ArrayList<>();
            for (int i : positions.get(group)) {
                keys.add(index.get(i));
                result.add(values.get(i));
            }
            groups.put(group, new Series<>(Index.of(keys), result));
        }
        return groups;
    }

    /**
     * Groups a series with {@link Tuple} labels by one of their components.
     *
     * @param level the position of the component in the labels
     * @throws IndexMismatchException if a label is not a tuple with that many components
     */
    public Map<Object, Series<K, V>> groupByLevel(int level) {
        return groupBy(key -> {
            if (!(key instanceof Tuple t) || level < 0 || level >= t.size())
                throw new IndexMismatchException("cannot group label " + key + " by level " + level);
            return t.get(level);
        });
    }

    /**
     * Combines two series: the labels of this series followed by the new labels of the other one.
     *
     * @throws IndexMismatchException if a label of both series has two different values
     */
    public Series<K, V> union(Series<K, ? extends V> other) {
        List<K> keys = new ArrayList<>(index.keys());
        List<V> result = new ArrayList<>(values);
        for (int i = 0; i < other.size(); i++) {
            K key = other.index.get(i);
            V value = other.values.get(i);
            int position = index.positionOf(key);
            if (position < 0) {
                keys.add(key);
                result.add(value);
            } else if (!Objects.equals(values.get(position), value)) {
                throw new IndexMismatchException("label " + key + " has values " + values.get(position)
                        + " and " + value);
            }
        }
        return new Series<>(Index.of(keys), result);
    }

    /**
     * @return a copy of the series as an ordered map
     */
    public Map<K, V> asMap() {
        Map<K, V> map = new LinkedHashMap<>();
        for (int i = 0; i < values.size(); i++)
            map.put(index.get(i), values.get(i));
        return map;
    }

    public void forEach(BiConsumer<? super K, ? super V> action) {
        for (int i = 0; i < values.size(); i++)
            action.accept(index.get(i), values.get(i));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Series<?, ?> other)) return false;
        return index.keys().equals(other.index.keys()) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return 31 * index.keys().hashCode() + values.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder b = new StringBuilder("Series{");
        for (int i = 0; i < values.size(); i++) {
            if (i > 0)
                b.append(", ");
            b.append(index.get(i)).append('=').append(values.get(i));
        }
        return b.append('}').toString();
    }
}
