/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling.algebra.linear;

import org.maxilp.modeling.algebra.LinearExpression;

import java.util.Objects;

/**
 * Deferred product of an expression by a constant.
 * <p>
 * Use {@link org.maxilp.modeling.Factory#mul(LinearExpression, double)} rather than
 * this constructor: it collapses nested products so that repeated scaling does
 * not build deep chains.
 *
 * @param expression the scaled expression
 * @param coefficient the multiplier
 */
public record Scale(LinearExpression expression, double coefficient) implements LinearExpression {

    public Scale {
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public String toString() {
        return flatten().toString();
    }
}
