/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling.indexed;

import org.maxilp.modeling.Variable;

/**
 * Builder of a set of variables indexed by the labels of an {@link Index}.
 * <pre>
 * Series&lt;String, Variable&gt; x = model.variables("x", Index.of("a", "b"))
 *         .lowerBound(0)
 *         .upperBound(capacities)
 *         .integer(true)
 *         .build();
 * </pre>
 * Unset bounds are infinite and variables are continuous unless stated otherwise.
 * Nothing is added to the model before {@link #build()}.
 *
 * @param <K> the type of the labels
 */
public final class VariableBatch<K> {

    private final OptimizationModel model;
    private final String name;
    private final Index<K> index;
    private BatchAttribute<Number> lower = BatchAttribute.scalar(Double.NEGATIVE_INFINITY);
    private BatchAttribute<Number> upper = BatchAttribute.scalar(Double.POSITIVE_INFINITY);
    private BatchAttribute<Boolean> integer = BatchAttribute.scalar(false);

    VariableBatch(OptimizationModel model, String name, Index<K> index) {
        this.model = model;
        this.name = name;
        this.index = index;
    }

    public VariableBatch<K> lowerBound(double value) {
        lower = BatchAttribute.scalar(value);
        return this;
    }

    public VariableBatch<K> lowerBound(Series<K, ? extends Number> values) {
        lower = BatchAttribute.perKey(values);
        return this;
    }

    public VariableBatch<K> upperBound(double value) {
        upper = BatchAttribute.scalar(value);
        return this;
    }

    public VariableBatch<K> upperBound(Series<K, ? extends Number> values) {
        upper = BatchAttribute.perKey(values);
        return this;
    }

    public VariableBatch<K> integer(boolean value) {
        integer = BatchAttribute.scalar(value);
        return this;
    }

    public VariableBatch<K> integer(Series<K, Boolean> values) {
        integer = BatchAttribute.perKey(values);
        return this;
    }

    /**
     * Validates the batch and adds its variables to the model.
     *
     * @return the variables, labeled like the index
     * @see OptimizationModel#createVariables(String, Index, double, double, boolean)
     */
    public Series<K, Variable> build() {
        return model.addVariableSet(name, index, lower, upper, integer);
    }
}
