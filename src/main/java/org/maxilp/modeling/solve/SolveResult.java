/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling.solve;

import org.maxilp.modeling.LinearConstraint;
import org.maxilp.modeling.Variable;
import org.maxilp.modeling.algebra.LinearExpression;
import org.maxilp.modeling.indexed.Series;
import org.maxilp.modeling.utils.ExpressionFlattener;

import java.util.Objects;

/**
 * Result of a solve: a status and, when the backend found one, a solution.
 * <p>
 * Values are indexed like the variables and constraints of the solved
 * {@link org.maxilp.modeling.ModelRegistry}. Reduced costs and dual values
 * are only available for continuous models, when the backend computes them.
 */
public final class SolveResult {

    private final SolveStatus status;
    private final double objectiveValue;
    private final double[] values;
    private final double[] reducedCosts;
    private final double[] dualValues;

    /**
     * @param status the solve status
     * @param objectiveValue value of the objective for the solution
     * @param values value of each variable, by index
     * @param reducedCosts reduced cost of each variable, may be null
     * @param dualValues dual value of each constraint, may be null
     */
    public SolveResult(SolveStatus status, double objectiveValue, double[] values,
                       double[] reducedCosts, double[] dualValues) {
        this.status = Objects.requireNonNull(status);
        this.objectiveValue = objectiveValue;
        this.values = Objects.requireNonNull(values).clone();
        this.reducedCosts = reducedCosts == null ? null : reducedCosts.clone();
        this.dualValues = dualValues == null ? null : dualValues.clone();
    }

    private SolveResult(SolveStatus status) {
        this.status = status;
        this.objectiveValue = Double.NaN;
        this.values = null;
        this.reducedCosts = null;
        this.dualValues = null;
    }

    /**
     * A result without solution, for instance for an infeasible model.
     */
    public static SolveResult withoutSolution(SolveStatus status) {
        return new SolveResult(Objects.requireNonNull(status));
    }

    public SolveStatus status() {
        return status;
    }

    public boolean hasSolution() {
        return values != null;
    }

    /**
     * @return the objective value, {@code NaN} if there is no solution
     */
    public double objectiveValue() {
        return objectiveValue;
    }

    /**
     * @throws IllegalStateException if there is no solution
     */
    public double value(Variable x) {
        checkHasSolution();
        return values[Objects.checkIndex(x.index(), values.length)];
    }

    /**
     * Evaluates an expression on the solution.
     *
     * @throws IllegalStateException if there is no solution
     */
    public double value(LinearExpression expression) {
        checkHasSolution();
        return ExpressionFlattener.flatten(expression).evaluate(x -> value(x));
    }

    /**
     * @return the value of each variable of the series, {@code NaN} values if there is no solution
     */
    public <K> Series<K, Double> variableValues(Series<K, Variable> variables) {
        if (!hasSolution())
            return variables.map(x -> Double.NaN);
        return variables.map(x -> value(x));
    }

    /**
     * @throws IllegalStateException if the backend did not report reduced costs
     */
    public double reducedCost(Variable x) {
        if (reducedCosts == null)
            throw new IllegalStateException("no reduced costs available (status " + status + ")");
        return reducedCosts[Objects.checkIndex(x.index(), reducedCosts.length)];
    }

    /**
     * @throws IllegalStateException if the backend did not report dual values
     */
    public double dualValue(LinearConstraint constraint) {
        if (dualValues == null)
            throw new IllegalStateException("no dual values available (status " + status + ")");
        return dualValues[Objects.checkIndex(constraint.index(), dualValues.length)];
    }

    private void checkHasSolution() {
        if (!hasSolution())
            throw new IllegalStateException("no solution available (status " + status + ")");
    }

    @Override
    public String toString() {
        return "SolveResult(status=" + status + ", objective=" + objectiveValue + ")";
    }
}
