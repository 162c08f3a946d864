/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling.algebra;

import org.maxilp.modeling.Factory;
import org.maxilp.modeling.algebra.bool.BoolExpression;
import org.maxilp.modeling.algebra.bool.BoundedExpression;
import org.maxilp.modeling.algebra.linear.LinearForm;
import org.maxilp.modeling.utils.ExpressionFlattener;

/**
 * A node of an (unevaluated) linear expression tree.
 * <p>
 * Nodes are immutable and built by composition, for instance
 * {@code x.plus(y.mul(2)).le(5)}. The tree is only turned into a
 * {@link LinearForm} when it is flattened, typically when a constraint
 * or the objective is added to a model.
 * <p>
 * The default methods are shortcuts to the static methods of {@link Factory}
 * and apply the same simplifications.
 */
public interface LinearExpression {

    default LinearExpression plus(LinearExpression other) {
        return Factory.plus(this, other);
    }

    default LinearExpression plus(double constant) {
        return Factory.plus(this, constant);
    }

    default LinearExpression minus(LinearExpression other) {
        return Factory.minus(this, other);
    }

    default LinearExpression minus(double constant) {
        return Factory.minus(this, constant);
    }

    default LinearExpression negate() {
        return Factory.minus(this);
    }

    default LinearExpression mul(double coefficient) {
        return Factory.mul(this, coefficient);
    }

    /**
     * @throws org.maxilp.util.exception.DivisionByZeroException if {@code divisor == 0}
     */
    default LinearExpression div(double divisor) {
        return Factory.div(this, divisor);
    }

    default BoolExpression eq(LinearExpression other) {
        return Factory.eq(this, other);
    }

    default BoundedExpression eq(double value) {
        return Factory.eq(this, value);
    }

    default BoundedExpression le(LinearExpression other) {
        return Factory.le(this, other);
    }

    default BoundedExpression le(double value) {
        return Factory.le(this, value);
    }

    default BoundedExpression ge(LinearExpression other) {
        return Factory.ge(this, other);
    }

    default BoundedExpression ge(double value) {
        return Factory.ge(this, value);
    }

    /**
     * Flattens this expression into its canonical form.
     *
     * @return offset and one coefficient per variable
     */
    default LinearForm flatten() {
        return ExpressionFlattener.flatten(this);
    }
}
