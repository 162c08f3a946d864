/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling;

import org.maxilp.modeling.algebra.LinearExpression;

import java.util.Objects;

/**
 * A variable (continuous or integral) of a model.
 * <p>
 * A Variable is a light reference to an entry of a {@link ModelRegistry}:
 * its attributes are read from and written to the registry. Two Variable
 * objects are equal when they refer to the same index of the same registry,
 * so variables can be used as keys in sets and maps.
 * To build an equality constraint between two variables, use
 * {@link Factory#eq(Variable, Variable)}.
 */
public final class Variable implements LinearExpression {

    private final ModelRegistry registry;
    private final int index;

    /**
     * Refers to an existing variable of the registry.
     *
     * @param registry the registry owning the variable
     * @param index the index of the variable in the registry
     * @throws IndexOutOfBoundsException if there is no variable with that index
     */
    public Variable(ModelRegistry registry, int index) {
        this.registry = Objects.requireNonNull(registry);
        this.index = Objects.checkIndex(index, registry.numVariables());
    }

    public ModelRegistry registry() {
        return registry;
    }

    public int index() {
        return index;
    }

    public double lowerBound() {
        return registry.varLowerBound(index);
    }

    public void setLowerBound(double lower) {
        registry.setVarLowerBound(index, lower);
    }

    public double upperBound() {
        return registry.varUpperBound(index);
    }

    public void setUpperBound(double upper) {
        registry.setVarUpperBound(index, upper);
    }

    public boolean isIntegral() {
        return registry.varIsIntegral(index);
    }

    public void setIntegrality(boolean integral) {
        registry.setVarIntegrality(index, integral);
    }

    public String name() {
        return registry.varName(index);
    }

    public void setName(String name) {
        registry.setVarName(index, name);
    }

    public double objectiveCoefficient() {
        return registry.varObjectiveCoefficient(index);
    }

    public void setObjectiveCoefficient(double coefficient) {
        registry.setVarObjectiveCoefficient(index, coefficient);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Variable other)) return false;
        return registry == other.registry && index == other.index;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(registry) + index;
    }

    @Override
    public String toString() {
        String name = name();
        if (!name.isEmpty())
            return name;
        return "variable#" + index;
    }
}
