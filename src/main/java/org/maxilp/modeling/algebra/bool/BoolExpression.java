/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling.algebra.bool;

/**
 * Something that can be added to a model as a linear constraint:
 * a {@link BoundedExpression}, a {@link VarEqVar} or a {@link BoolLiteral}.
 */
public interface BoolExpression {

    /**
     * Returns the truth value of this expression, when it has one
     * independently of any solution.
     *
     * @return the truth value
     * @throws org.maxilp.util.exception.AlgebraException if the value depends on the variables
     */
    boolean truthValue();
}
