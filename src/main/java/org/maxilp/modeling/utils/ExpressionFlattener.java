/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling.utils;

import org.maxilp.modeling.Variable;
import org.maxilp.modeling.algebra.LinearExpression;
import org.maxilp.modeling.algebra.linear.Constant;
import org.maxilp.modeling.algebra.linear.LinearForm;
import org.maxilp.modeling.algebra.linear.Scale;
import org.maxilp.modeling.algebra.linear.Sum;
import org.maxilp.modeling.algebra.linear.WeightedSum;
import org.maxilp.util.exception.UnrecognizedExpressionException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns an expression tree into a {@link LinearForm}.
 * <p>
 * The traversal uses an explicit stack of (node, multiplier) pairs:
 * sums built over large indexed batches can be hundreds of thousands of
 * nodes deep and must not overflow the call stack.
 */
public final class ExpressionFlattener {

    private ExpressionFlattener() {
    }

    private record Pending(LinearExpression node, double multiplier) {
    }

    public static LinearForm flatten(double constant) {
        return LinearForm.of(constant);
    }

    /**
     * Flattens an expression.
     *
     * @param root the expression to flatten
     * @return the offset of the expression and the aggregated coefficient of each variable
     * @throws UnrecognizedExpressionException if the tree contains a node of an unknown kind
     */
    public static LinearForm flatten(LinearExpression root) {
        if (root instanceof LinearForm form)
            return form;
        double offset = 0;
        Map<Variable, Double> terms = new LinkedHashMap<>();
        Deque<Pending> toProcess = new ArrayDeque<>();
        toProcess.push(new Pending(root, 1.0));
        while (!toProcess.isEmpty()) {
            Pending current = toProcess.pop();
            LinearExpression node = current.node();
            double multiplier = current.multiplier();
            if (node instanceof Constant c) {
                offset += multiplier * c.value();
            } else if (node instanceof Variable x) {
                terms.merge(x, multiplier, Double::sum);
            } else if (node instanceof Sum s) {
                toProcess.push(new Pending(s.right(), multiplier));
                toProcess.push(new Pending(s.left(), multiplier));
            } else if (node instanceof Scale s) {
                toProcess.push(new Pending(s.expression(), multiplier * s.coefficient()));
            } else if (node instanceof WeightedSum w) {
                offset += multiplier * w.constant();
                for (int i = w.size() - 1; i >= 0; i--)
                    toProcess.push(new Pending(w.expression(i), multiplier * w.coefficient(i)));
            } else if (node instanceof LinearForm f) {
                offset += multiplier * f.offset();
                for (Map.Entry<Variable, Double> term : f.terms().entrySet())
                    terms.merge(term.getKey(), multiplier * term.getValue(), Double::sum);
            } else {
                throw new UnrecognizedExpressionException("unrecognized linear expression of type "
                        + node.getClass().getName());
            }
        }
        return new LinearForm(offset, terms);
    }
}
