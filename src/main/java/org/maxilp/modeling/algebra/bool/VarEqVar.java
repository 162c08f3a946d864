/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling.algebra.bool;

import org.maxilp.modeling.Variable;

import java.util.Objects;

/**
 * Result of {@code eq(x, y)} on two variables.
 * <p>
 * Its truth value tells whether both sides are the same variable. Added to a
 * model, it becomes the constraint {@code x - y == 0}.
 *
 * @param left the left variable
 * @param right the right variable
 */
public record VarEqVar(Variable left, Variable right) implements BoolExpression {

    public VarEqVar {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public boolean truthValue() {
        return left.equals(right);
    }

    @Override
    public String toString() {
        return left + " == " + right;
    }
}
