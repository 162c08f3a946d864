/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling.algebra.linear;

import org.maxilp.modeling.Variable;
import org.maxilp.modeling.algebra.LinearExpression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Flattened linear expression {@code offset + sum(terms[v] * v)}.
 * <p>
 * There is at most one entry per variable. Entries whose coefficients cancel
 * out are kept with a coefficient of {@code 0}.
 * A LinearForm is itself a leaf of the expression tree, so it can be combined
 * with other expressions and flattening it again gives an equal form.
 *
 * @param offset the constant part
 * @param terms coefficient of each variable, in first-seen order
 */
public record LinearForm(double offset, Map<Variable, Double> terms) implements LinearExpression {

    private static final int MAX_DISPLAYED_TERMS = 5;

    public LinearForm {
        terms = Collections.unmodifiableMap(new LinkedHashMap<>(terms));
    }

    public static LinearForm of(double offset) {
        return new LinearForm(offset, Map.of());
    }

    /**
     * Returns the coefficient of a variable, {@code 0} if it does not appear.
     */
    public double coefficient(Variable x) {
        return terms.getOrDefault(x, 0.0);
    }

    public boolean isConstant() {
        return terms.isEmpty();
    }

    /**
     * Evaluates the form for a given assignment.
     *
     * @param values the value of each variable of the form
     * @return {@code offset + sum(terms[v] * values[v])}
     * @throws IllegalArgumentException if a variable of the form has no value
     */
    public double evaluate(Map<Variable, Double> values) {
        return evaluate(x -> {
            Double v = values.get(x);
            if (v == null)
                throw new IllegalArgumentException("no value for variable " + x);
            return v;
        });
    }

    public double evaluate(ToDoubleFunction<Variable> value) {
        double result = offset;
        for (Map.Entry<Variable, Double> term : terms.entrySet())
            result += term.getValue() * value.applyAsDouble(term.getKey());
        return result;
    }

    @Override
    public LinearForm flatten() {
        return this;
    }

    @Override
    public String toString() {
        StringBuilder result = new StringBuilder(String.valueOf(offset));
        List<Variable> sorted = new ArrayList<>(terms.keySet());
        sorted.sort(Comparator.comparing(Variable::toString));
        int displayed = 0;
        for (Variable x : sorted) {
            double coefficient = terms.get(x);
            if (coefficient == 0.0)
                continue;
            if (displayed == MAX_DISPLAYED_TERMS) {
                result.append(" + ...");
                break;
            }
            result.append(coefficient > 0 ? " + " : " - ");
            if (Math.abs(coefficient) != 1.0)
                result.append(Math.abs(coefficient)).append(" * ");
            result.append(x);
            displayed++;
        }
        return result.toString();
    }
}
