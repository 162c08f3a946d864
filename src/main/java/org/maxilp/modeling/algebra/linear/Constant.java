/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling.algebra.linear;

import org.maxilp.modeling.algebra.LinearExpression;

/**
 * A numerical constant in a linear expression.
 *
 * @param value the constant
 */
public record Constant(double value) implements LinearExpression {

    public static final Constant ZERO = new Constant(0);

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
