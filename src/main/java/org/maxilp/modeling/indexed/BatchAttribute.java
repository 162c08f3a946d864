/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling.indexed;

import org.maxilp.util.exception.IndexMismatchException;

import java.util.Objects;

/**
 * Attribute of a batch of variables: either one value shared by every label,
 * or one value per label.
 */
final class BatchAttribute<T> {

    private final T scalar;
    private final Series<?, ? extends T> perKey;

    private BatchAttribute(T scalar, Series<?, ? extends T> perKey) {
        this.scalar = scalar;
        this.perKey = perKey;
    }

    static <T> BatchAttribute<T> scalar(T value) {
        return new BatchAttribute<>(value, null);
    }

    static <T> BatchAttribute<T> perKey(Series<?, ? extends T> values) {
        return new BatchAttribute<>(null, values);
    }

    boolean isScalar() {
        return perKey == null;
    }

    T scalarValue() {
        return scalar;
    }

    T valueOf(Object key) {
        return isScalar() ? scalar : perKey.get(key);
    }

    /**
     * @throws IndexMismatchException if the labels of a per-label attribute differ from the index,
     *                                or if one of its labels has no value
     * @throws NullPointerException   if a shared value is null
     */
    void checkLabels(Index<?> index, String attribute, String setName) {
        if (isScalar()) {
            Objects.requireNonNull(scalar, () -> attribute + " of variable set " + setName + " is null");
            return;
        }
        if (!perKey.index().sameKeys(index))
            throw new IndexMismatchException("labels of " + attribute + " " + perKey.keys()
                    + " do not match the index " + index.keys() + " of variable set " + setName);
        for (int i = 0; i < perKey.size(); i++) {
            if (perKey.valueAt(i) == null)
                throw new IndexMismatchException("no " + attribute + " value for label " + perKey.keys().get(i)
                        + " of variable set " + setName);
        }
    }
}
