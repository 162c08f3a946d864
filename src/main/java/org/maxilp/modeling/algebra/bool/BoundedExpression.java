/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling.algebra.bool;

import org.maxilp.modeling.algebra.LinearExpression;
import org.maxilp.util.exception.AlgebraException;

import java.util.Objects;

/**
 * The linear constraint {@code lower <= expression <= upper}, not yet added to a model.
 *
 * @param expression the constrained expression
 * @param lower lower bound, possibly {@link Double#NEGATIVE_INFINITY}
 * @param upper upper bound, possibly {@link Double#POSITIVE_INFINITY}
 */
public record BoundedExpression(LinearExpression expression, double lower, double upper) implements BoolExpression {

    public BoundedExpression {
        Objects.requireNonNull(expression, "expression");
    }

    /**
     * Always throws: whether the constraint holds depends on the variables.
     */
    @Override
    public boolean truthValue() {
        throw new AlgebraException("Cannot use a BoundedExpression " + this + " as a Boolean value");
    }

    @Override
    public String toString() {
        boolean finiteLower = Double.isFinite(lower);
        boolean finiteUpper = Double.isFinite(upper);
        if (finiteLower && finiteUpper) {
            if (lower == upper)
                return expression + " == " + lower;
            return lower + " <= " + expression + " <= " + upper;
        }
        if (finiteLower)
            return expression + " >= " + lower;
        if (finiteUpper)
            return expression + " <= " + upper;
        return expression + " free";
    }
}
