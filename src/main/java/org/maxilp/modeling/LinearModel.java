/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling;

import org.maxilp.modeling.algebra.LinearExpression;
import org.maxilp.modeling.algebra.bool.BoolExpression;
import org.maxilp.modeling.algebra.linear.LinearForm;
import org.maxilp.modeling.solve.SolveOptions;
import org.maxilp.modeling.solve.SolveResult;
import org.maxilp.modeling.solve.SolverBackend;
import org.maxilp.modeling.utils.ExpressionFlattener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A linear (or mixed-integer) model built one variable and one constraint at a time.
 * <pre>
 * LinearModel model = new LinearModel("example");
 * Variable x = model.newNumVar(0, 10, "x");
 * Variable y = model.newIntVar(0, 5, "y");
 * model.add(x.plus(y.mul(2)).le(12), "capacity");
 * model.maximize(x.plus(y));
 * </pre>
 * For variables and constraints indexed by labels, see
 * {@link org.maxilp.modeling.indexed.OptimizationModel}.
 */
public class LinearModel {

    private static final Logger LOGGER = LoggerFactory.getLogger(LinearModel.class);

    private final ModelRegistry registry;

    public LinearModel() {
        this(new ModelRegistry());
    }

    public LinearModel(String name) {
        this(new ModelRegistry(name, false));
    }

    public LinearModel(ModelRegistry registry) {
        this.registry = registry;
    }

    public ModelRegistry registry() {
        return registry;
    }

    public String name() {
        return registry.name();
    }

    // ---------------- variables ----------------

    /**
     * Creates a variable with domain {@code [lower, upper]}.
     *
     * @param lower lower bound of the variable
     * @param upper upper bound of the variable
     * @param integer whether the variable must take integral values
     * @param name the name of the variable, may be null
     * @return the new variable
     */
    public Variable newVar(double lower, double upper, boolean integer, String name) {
        int index = registry.addVar();
        registry.setVarLowerBound(index, lower);
        registry.setVarUpperBound(index, upper);
        registry.setVarIntegrality(index, integer);
        if (name != null && !name.isEmpty())
            registry.setVarName(index, name);
        return new Variable(registry, index);
    }

    public Variable newNumVar(double lower, double upper, String name) {
        return newVar(lower, upper, false, name);
    }

    public Variable newIntVar(double lower, double upper, String name) {
        return newVar(lower, upper, true, name);
    }

    public Variable newBoolVar(String name) {
        return newVar(0, 1, true, name);
    }

    /**
     * Declares a variable fixed to a value.
     */
    public Variable newConstant(double value) {
        return newVar(value, value, false, null);
    }

    /**
     * Rebuilds a variable from its index in the model.
     */
    public Variable varFromIndex(int index) {
        return new Variable(registry, index);
    }

    public int numVariables() {
        return registry.numVariables();
    }

    public List<Variable> variables() {
        List<Variable> result = new ArrayList<>(registry.numVariables());
        for (int i = 0; i < registry.numVariables(); i++)
            result.add(new Variable(registry, i));
        return result;
    }

    // ---------------- constraints ----------------

    public LinearConstraint add(BoolExpression constraint) {
        return add(constraint, null);
    }

    /**
     * Adds a bounded expression, an equality between variables or a literal.
     *
     * @param constraint the constraint to add
     * @param name the name of the constraint, may be null
     * @return the new constraint
     */
    public LinearConstraint add(BoolExpression constraint, String name) {
        return ConstraintCompiler.compile(registry, constraint, name);
    }

    /**
     * Adds the constraint {@code lower <= expression <= upper}.
     */
    public LinearConstraint addLinearConstraint(LinearExpression expression, double lower, double upper, String name) {
        return ConstraintCompiler.compile(registry, expression, lower, upper, name);
    }

    public int numConstraints() {
        return registry.numConstraints();
    }

    public List<LinearConstraint> constraints() {
        List<LinearConstraint> result = new ArrayList<>(registry.numConstraints());
        for (int i = 0; i < registry.numConstraints(); i++)
            result.add(new LinearConstraint(registry, i));
        return result;
    }

    // ---------------- objective ----------------

    public void minimize(LinearExpression expression) {
        setObjective(expression, ObjectiveSense.MINIMIZE);
    }

    public void maximize(LinearExpression expression) {
        setObjective(expression, ObjectiveSense.MAXIMIZE);
    }

    /**
     * Replaces the objective. To clear it, minimize the constant {@code 0}.
     *
     * @param expression the expression to optimize
     * @param sense whether to minimize or maximize it
     */
    public void setObjective(LinearExpression expression, ObjectiveSense sense) {
        LinearForm form = ExpressionFlattener.flatten(expression);
        for (Variable x : form.terms().keySet())
            if (x.registry() != registry)
                throw new IllegalArgumentException("variable " + x + " belongs to another model");
        registry.clearObjective();
        registry.setObjectiveOffset(form.offset());
        for (Map.Entry<Variable, Double> term : form.terms().entrySet())
            registry.setVarObjectiveCoefficient(term.getKey().index(), term.getValue());
        registry.setMaximize(sense == ObjectiveSense.MAXIMIZE);
        LOGGER.debug("{} objective set on {} terms", sense, form.terms().size());
    }

    /**
     * Reads the objective back from the model. Variables with a zero objective
     * coefficient are not part of the result.
     */
    public LinearForm objectiveExpression() {
        Map<Variable, Double> terms = new LinkedHashMap<>();
        for (int i = 0; i < registry.numVariables(); i++) {
            double coefficient = registry.varObjectiveCoefficient(i);
            if (coefficient != 0)
                terms.put(new Variable(registry, i), coefficient);
        }
        return new LinearForm(registry.objectiveOffset(), terms);
    }

    /**
     * @return the sense of the objective, {@link ObjectiveSense#MINIMIZE} if none was set
     */
    public ObjectiveSense objectiveSense() {
        return registry.isMaximize() ? ObjectiveSense.MAXIMIZE : ObjectiveSense.MINIMIZE;
    }

    public double objectiveOffset() {
        return registry.objectiveOffset();
    }

    public void setObjectiveOffset(double offset) {
        registry.setObjectiveOffset(offset);
    }

    // ---------------- solve ----------------

    public SolveResult solve(SolverBackend backend) {
        return solve(backend, SolveOptions.DEFAULT);
    }

    /**
     * Hands the model to a solver.
     *
     * @param backend the solver
     * @param options the solve parameters
     * @return the result reported by the solver
     */
    public SolveResult solve(SolverBackend backend, SolveOptions options) {
        LOGGER.debug("solving {} with {} variables and {} constraints", registry.name(),
                registry.numVariables(), registry.numConstraints());
        SolveResult result = backend.solve(registry, options);
        LOGGER.debug("solve of {} ended with status {}", registry.name(), result.status());
        return result;
    }
}
