/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling;

import org.maxilp.modeling.algebra.LinearExpression;
import org.maxilp.modeling.algebra.bool.BoolExpression;
import org.maxilp.modeling.algebra.bool.BoolLiteral;
import org.maxilp.modeling.algebra.bool.BoundedExpression;
import org.maxilp.modeling.algebra.bool.VarEqVar;
import org.maxilp.modeling.algebra.linear.Constant;
import org.maxilp.modeling.algebra.linear.Scale;
import org.maxilp.modeling.algebra.linear.Sum;
import org.maxilp.modeling.algebra.linear.WeightedSum;
import org.maxilp.modeling.indexed.Series;
import org.maxilp.util.exception.DivisionByZeroException;
import org.maxilp.util.exception.IndexMismatchException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static java.lang.Double.NEGATIVE_INFINITY;
import static java.lang.Double.POSITIVE_INFINITY;

/**
 * Static methods to build linear expressions and constraints.
 * <p>
 * Meant to be statically imported:
 * <pre>
 * import static org.maxilp.modeling.Factory.*;
 *
 * model.add(le(sum(mul(x, 10), mul(y, 4)), 600));
 * </pre>
 * Construction applies a few simplifications eagerly: adding {@code 0} and
 * multiplying by {@code 1} return the operand, multiplying by {@code 0} gives
 * the constant {@code 0} and nested products are collapsed into one.
 */
public final class Factory {

    private Factory() {
    }

    public static Constant constant(double value) {
        return new Constant(value);
    }

    public static BoolLiteral literal(boolean value) {
        return BoolLiteral.of(value);
    }

    // ---------------- arithmetic ----------------

    public static LinearExpression plus(LinearExpression a, LinearExpression b) {
        if (isZero(a))
            return b;
        if (isZero(b))
            return a;
        return new Sum(a, b);
    }

    public static LinearExpression plus(LinearExpression a, double b) {
        if (b == 0)
            return a;
        return new Sum(a, new Constant(b));
    }

    public static LinearExpression plus(double a, LinearExpression b) {
        return plus(b, a);
    }

    public static LinearExpression minus(LinearExpression a, LinearExpression b) {
        return plus(a, minus(b));
    }

    public static LinearExpression minus(LinearExpression a, double b) {
        return plus(a, -b);
    }

    public static LinearExpression minus(double a, LinearExpression b) {
        return plus(minus(b), a);
    }

    /**
     * @return {@code -a}
     */
    public static LinearExpression minus(LinearExpression a) {
        return mul(a, -1);
    }

    /**
     * Multiplies an expression by a constant.
     *
     * @return {@code a * coefficient}
     */
    public static LinearExpression mul(LinearExpression a, double coefficient) {
        LinearExpression expression = a;
        double c = coefficient;
        while (expression instanceof Scale s) {
            c *= s.coefficient();
            expression = s.expression();
        }
        if (c == 0)
            return Constant.ZERO;
        if (expression instanceof Constant k)
            return new Constant(k.value() * c);
        if (c == 1)
            return expression;
        return new Scale(expression, c);
    }

    public static LinearExpression mul(double coefficient, LinearExpression a) {
        return mul(a, coefficient);
    }

    /**
     * @return {@code a / divisor}
     * @throws DivisionByZeroException if the divisor is {@code 0}
     */
    public static LinearExpression div(LinearExpression a, double divisor) {
        if (divisor == 0)
            throw new DivisionByZeroException("cannot divide " + a + " by zero");
        return mul(a, 1.0 / divisor);
    }

    public static LinearExpression sum(LinearExpression... expressions) {
        return sum(Arrays.asList(expressions), 0);
    }

    public static LinearExpression sum(List<? extends LinearExpression> expressions) {
        return sum(expressions, 0);
    }

    /**
     * @return {@code sum(expressions) + constant}
     */
    public static LinearExpression sum(List<? extends LinearExpression> expressions, double constant) {
        if (expressions.isEmpty())
            return new Constant(constant);
        if (expressions.size() == 1 && constant == 0)
            return expressions.get(0);
        double[] ones = new double[expressions.size()];
        Arrays.fill(ones, 1.0);
        return new WeightedSum(new ArrayList<>(expressions), ones, constant);
    }

    /**
     * Sums the values of a series, for instance all the variables of a batch.
     */
    public static LinearExpression sum(Series<?, ? extends LinearExpression> series) {
        return sum(series.values());
    }

    public static LinearExpression weightedSum(List<? extends LinearExpression> expressions, double[] coefficients) {
        return weightedSum(expressions, coefficients, 0);
    }

    /**
     * @return {@code sum(expressions[i] * coefficients[i]) + constant}
     * @throws IndexMismatchException if the two sequences have different lengths
     */
    public static LinearExpression weightedSum(List<? extends LinearExpression> expressions, double[] coefficients,
                                               double constant) {
        if (expressions.size() != coefficients.length)
            throw new IndexMismatchException("weightedSum: " + expressions.size() + " expressions and "
                    + coefficients.length + " coefficients");
        if (expressions.isEmpty())
            return new Constant(constant);
        return new WeightedSum(new ArrayList<>(expressions), coefficients, constant);
    }

    /**
     * Dot product of a series of expressions with coefficients given in the order of the series.
     */
    public static LinearExpression dot(Series<?, ? extends LinearExpression> series, double... coefficients) {
        return weightedSum(series.values(), coefficients);
    }

    /**
     * Dot product of two series over the same labels.
     *
     * @throws IndexMismatchException if the label sets differ
     */
    public static <K> LinearExpression dot(Series<K, ? extends LinearExpression> series,
                                           Series<K, ? extends Number> coefficients) {
        if (!series.index().sameKeys(coefficients.index()))
            throw new IndexMismatchException("dot: labels " + series.index() + " and "
                    + coefficients.index() + " differ");
        List<LinearExpression> expressions = new ArrayList<>(series.size());
        double[] c = new double[series.size()];
        int i = 0;
        for (K key : series.index()) {
            expressions.add(series.get(key));
            c[i++] = coefficients.get(key).doubleValue();
        }
        return weightedSum(expressions, c);
    }

    // ---------------- comparisons ----------------

    /**
     * Equality between two expressions. When both are variables, the result is
     * a {@link VarEqVar} that also answers whether they are the same variable.
     */
    public static BoolExpression eq(LinearExpression a, LinearExpression b) {
        if (a instanceof Variable x && b instanceof Variable y)
            return new VarEqVar(x, y);
        return new BoundedExpression(minus(a, b), 0, 0);
    }

    public static VarEqVar eq(Variable a, Variable b) {
        return new VarEqVar(a, b);
    }

    public static BoundedExpression eq(LinearExpression a, double b) {
        return new BoundedExpression(minus(a, b), 0, 0);
    }

    public static BoundedExpression eq(double a, LinearExpression b) {
        return new BoundedExpression(minus(a, b), 0, 0);
    }

    /**
     * @return {@code a - b <= 0}
     */
    public static BoundedExpression le(LinearExpression a, LinearExpression b) {
        return new BoundedExpression(minus(a, b), NEGATIVE_INFINITY, 0);
    }

    public static BoundedExpression le(LinearExpression a, double b) {
        return new BoundedExpression(minus(a, b), NEGATIVE_INFINITY, 0);
    }

    public static BoundedExpression le(double a, LinearExpression b) {
        return new BoundedExpression(minus(a, b), NEGATIVE_INFINITY, 0);
    }

    /**
     * @return {@code a - b >= 0}
     */
    public static BoundedExpression ge(LinearExpression a, LinearExpression b) {
        return new BoundedExpression(minus(a, b), 0, POSITIVE_INFINITY);
    }

    public static BoundedExpression ge(LinearExpression a, double b) {
        return new BoundedExpression(minus(a, b), 0, POSITIVE_INFINITY);
    }

    public static BoundedExpression ge(double a, LinearExpression b) {
        return new BoundedExpression(minus(a, b), 0, POSITIVE_INFINITY);
    }

    private static boolean isZero(LinearExpression e) {
        return e instanceof Constant c && c.value() == 0;
    }
}
