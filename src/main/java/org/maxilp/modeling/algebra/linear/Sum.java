/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling.algebra.linear;

import org.maxilp.modeling.algebra.LinearExpression;

import java.util.Objects;

/**
 * Deferred sum of two expressions.
 */
public record Sum(LinearExpression left, LinearExpression right) implements LinearExpression {

    public Sum {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public String toString() {
        return flatten().toString();
    }
}
