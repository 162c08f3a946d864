/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling.algebra.bool;

/**
 * Constraints that are always satisfied or never satisfied.
 * They compile to constraints without terms, with bounds {@code [0,0]} for
 * {@link #TRUE} and {@code [1,1]} for {@link #FALSE}.
 */
public enum BoolLiteral implements BoolExpression {
    TRUE(true),
    FALSE(false);

    private final boolean value;

    BoolLiteral(boolean value) {
        this.value = value;
    }

    public static BoolLiteral of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public boolean truthValue() {
        return value;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
