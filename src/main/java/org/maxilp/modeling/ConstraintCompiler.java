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
import org.maxilp.modeling.algebra.linear.LinearForm;
import org.maxilp.modeling.utils.ExpressionFlattener;
import org.maxilp.util.exception.DuplicateNameException;
import org.maxilp.util.exception.UnrecognizedExpressionException;

import java.util.Map;

/**
 * Writes constraints into a {@link ModelRegistry}.
 * <p>
 * The registry stores {@code lower <= sum(a_i * x_i) <= upper}: the offset of
 * the flattened expression is subtracted from both requested bounds.
 */
public final class ConstraintCompiler {

    private ConstraintCompiler() {
    }

    /**
     * Adds a constraint to the registry.
     *
     * @param registry the model receiving the constraint
     * @param constraint a bounded expression, a variable equality or a literal
     * @param name the name of the constraint, may be null or empty
     * @return the new constraint
     * @throws UnrecognizedExpressionException if the constraint is of an unknown kind
     * @throws DuplicateNameException if the registry enforces unique names and the name is taken
     */
    public static LinearConstraint compile(ModelRegistry registry, BoolExpression constraint, String name) {
        checkNameAvailable(registry, name);
        if (constraint instanceof BoundedExpression b)
            return compile(registry, b.expression(), b.lower(), b.upper(), name);
        if (constraint instanceof VarEqVar v)
            return compileVarEqVar(registry, v, name);
        if (constraint instanceof BoolLiteral literal) {
            // 0 <= nothing <= 0 always holds, 1 <= nothing <= 1 never does
            double bound = literal.truthValue() ? 0 : 1;
            int index = registry.addLinearConstraint();
            registry.setConstraintLowerBound(index, bound);
            registry.setConstraintUpperBound(index, bound);
            registry.setConstraintName(index, name);
            return new LinearConstraint(registry, index);
        }
        throw new UnrecognizedExpressionException("cannot add a constraint of type "
                + (constraint == null ? "null" : constraint.getClass().getName()));
    }

    /**
     * Adds the constraint {@code lower <= expression <= upper}.
     */
    public static LinearConstraint compile(ModelRegistry registry, LinearExpression expression,
                                           double lower, double upper, String name) {
        checkNameAvailable(registry, name);
        LinearForm form = ExpressionFlattener.flatten(expression);
        for (Variable x : form.terms().keySet())
            checkOwner(registry, x);
        int index = registry.addLinearConstraint();
        for (Map.Entry<Variable, Double> term : form.terms().entrySet())
            registry.addTermToConstraint(index, term.getKey().index(), term.getValue());
        registry.setConstraintLowerBound(index, lower - form.offset());
        registry.setConstraintUpperBound(index, upper - form.offset());
        registry.setConstraintName(index, name);
        return new LinearConstraint(registry, index);
    }

    private static void checkNameAvailable(ModelRegistry registry, String name) {
        if (registry.enforcesUniqueNames() && name != null && registry.hasConstraintName(name))
            throw new DuplicateNameException("a constraint named " + name + " already exists");
    }

    private static void checkOwner(ModelRegistry registry, Variable x) {
        if (x.registry() != registry)
            throw new IllegalArgumentException("variable " + x + " belongs to another model");
    }

    private static LinearConstraint compileVarEqVar(ModelRegistry registry, VarEqVar constraint, String name) {
        checkOwner(registry, constraint.left());
        checkOwner(registry, constraint.right());
        int index = registry.addLinearConstraint();
        registry.setConstraintLowerBound(index, 0);
        registry.setConstraintUpperBound(index, 0);
        registry.addTermToConstraint(index, constraint.left().index(), 1.0);
        registry.addTermToConstraint(index, constraint.right().index(), -1.0);
        registry.setConstraintName(index, name);
        return new LinearConstraint(registry, index);
    }
}
