/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling.algebra.linear;

import org.maxilp.modeling.algebra.LinearExpression;
import org.maxilp.util.exception.IndexMismatchException;

import java.util.Arrays;
import java.util.List;

/**
 * Deferred {@code sum(expressions[i] * coefficients[i]) + constant}.
 */
public record WeightedSum(List<LinearExpression> expressions, double[] coefficients, double constant)
        implements LinearExpression {

    public WeightedSum {
        if (expressions.size() != coefficients.length)
            throw new IndexMismatchException("weighted sum with " + expressions.size()
                    + " expressions and " + coefficients.length + " coefficients");
        expressions = List.copyOf(expressions);
        coefficients = coefficients.clone();
    }

    public int size() {
        return expressions.size();
    }

    public LinearExpression expression(int i) {
        return expressions.get(i);
    }

    public double coefficient(int i) {
        return coefficients[i];
    }

    @Override
    public double[] coefficients() {
        return coefficients.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WeightedSum other)) return false;
        return Double.compare(constant, other.constant) == 0
                && expressions.equals(other.expressions)
                && Arrays.equals(coefficients, other.coefficients);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * expressions.hashCode() + Arrays.hashCode(coefficients)) + Double.hashCode(constant);
    }

    @Override
    public String toString() {
        return flatten().toString();
    }
}
