/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling;

import org.maxilp.modeling.algebra.linear.LinearForm;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A linear constraint {@code lower <= sum(a_i * x_i) <= upper} of a model.
 * <p>
 * Like {@link Variable}, this is a reference to an entry of a {@link ModelRegistry}.
 * The registry only stores the homogeneous part of the constraint: the constant
 * of the expression it was built from has been moved into the bounds.
 */
public final class LinearConstraint {

    private final ModelRegistry registry;
    private final int index;

    public LinearConstraint(ModelRegistry registry, int index) {
        this.registry = Objects.requireNonNull(registry);
        this.index = Objects.checkIndex(index, registry.numConstraints());
    }

    public ModelRegistry registry() {
        return registry;
    }

    public int index() {
        return index;
    }

    public double lowerBound() {
        return registry.constraintLowerBound(index);
    }

    public void setLowerBound(double lower) {
        registry.setConstraintLowerBound(index, lower);
    }

    public double upperBound() {
        return registry.constraintUpperBound(index);
    }

    public void setUpperBound(double upper) {
        registry.setConstraintUpperBound(index, upper);
    }

    public String name() {
        return registry.constraintName(index);
    }

    public void setName(String name) {
        registry.setConstraintName(index, name);
    }

    public void addTerm(Variable x, double coefficient) {
        checkSameRegistry(x);
        registry.addTermToConstraint(index, x.index(), coefficient);
    }

    public void setCoefficient(Variable x, double coefficient) {
        checkSameRegistry(x);
        registry.setConstraintCoefficient(index, x.index(), coefficient);
    }

    /**
     * @return the left-hand side of the constraint, with a zero offset
     */
    public LinearForm expression() {
        Map<Variable, Double> terms = new LinkedHashMap<>();
        registry.constraintTerms(index).forEach((v, c) -> terms.put(new Variable(registry, v), c));
        return new LinearForm(0, terms);
    }

    private void checkSameRegistry(Variable x) {
        if (x.registry() != registry)
            throw new IllegalArgumentException("variable " + x + " belongs to another model");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LinearConstraint other)) return false;
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
        return "linear_constraint#" + index;
    }
}
