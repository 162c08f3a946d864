/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling.indexed;

import org.json.JSONArray;
import org.json.JSONObject;
import org.maxilp.modeling.LinearConstraint;
import org.maxilp.modeling.LinearModel;
import org.maxilp.modeling.ModelRegistry;
import org.maxilp.modeling.ObjectiveSense;
import org.maxilp.modeling.Variable;
import org.maxilp.modeling.algebra.LinearExpression;
import org.maxilp.modeling.algebra.bool.BoolExpression;
import org.maxilp.modeling.algebra.bool.BoolLiteral;
import org.maxilp.modeling.algebra.bool.BoundedExpression;
import org.maxilp.modeling.algebra.bool.VarEqVar;
import org.maxilp.modeling.algebra.linear.LinearForm;
import org.maxilp.modeling.solve.SolveOptions;
import org.maxilp.modeling.solve.SolveResult;
import org.maxilp.modeling.solve.SolverBackend;
import org.maxilp.util.exception.DuplicateNameException;
import org.maxilp.util.exception.InvalidBoundsException;
import org.maxilp.util.exception.InvalidNameException;
import org.maxilp.util.exception.UnrecognizedExpressionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * A model whose variables and constraints are created by named sets, one
 * element per label of an {@link Index}.
 * <pre>
 * OptimizationModel model = new OptimizationModel("production");
 * Index&lt;String&gt; products = Index.of("chairs", "tables").withNames("product");
 * Series&lt;String, Variable&gt; x = model.createVariables("x", products, 0, 100, false);
 * model.createLinearConstraints("wood", dot(x, 2, 5).le(400));
 * model.maximize(dot(x, 30, 70));
 * </pre>
 * Element {@code k} of set {@code s} is named {@code s[k]}. Variable sets and
 * constraint sets have separate namespaces.
 */
public class OptimizationModel {

    private static final Logger LOGGER = LoggerFactory.getLogger(OptimizationModel.class);

    private final LinearModel model;
    private final Map<String, Series<?, Variable>> variableSets = new LinkedHashMap<>();
    private final Map<String, Series<?, LinearConstraint>> constraintSets = new LinkedHashMap<>();

    /**
     * @param name the name of the model
     * @throws InvalidNameException if the name is not an identifier
     */
    public OptimizationModel(String name) {
        checkIdentifier(name);
        this.model = new LinearModel(name);
    }

    public String getName() {
        return model.name();
    }

    /**
     * @return the underlying registry, as handed to solvers
     */
    public ModelRegistry registry() {
        return model.registry();
    }

    // ---------------- variables ----------------

    /**
     * Creates unbounded continuous variables, one per label.
     */
    public <K> Series<K, Variable> createVariables(String name, Index<K> index) {
        return variables(name, index).build();
    }

    /**
     * Creates one variable per label, all with the same bounds and integrality.
     *
     * @param name the name of the set
     * @param index the labels of the variables
     * @param lower lower bound of every variable
     * @param upper upper bound of every variable
     * @param integer whether the variables must take integral values
     * @return the variables, labeled like the index
     * @throws InvalidNameException if the name is not an identifier
     * @throws DuplicateNameException if a variable set already has this name
     * @throws InvalidBoundsException if {@code lower > upper}, or if there is no integer
     *                                between them for integer variables
     */
    public <K> Series<K, Variable> createVariables(String name, Index<K> index,
                                                   double lower, double upper, boolean integer) {
        return variables(name, index).lowerBound(lower).upperBound(upper).integer(integer).build();
    }

    /**
     * Creates one variable per label, with bounds and integrality given per label.
     *
     * @throws org.maxilp.util.exception.IndexMismatchException if the labels of a table differ from the index,
     *                                                          or if a table holds a null value
     */
    public <K> Series<K, Variable> createVariables(String name, Index<K> index,
                                                   Series<K, ? extends Number> lower,
                                                   Series<K, ? extends Number> upper,
                                                   Series<K, Boolean> integer) {
        return variables(name, index).lowerBound(lower).upperBound(upper).integer(integer).build();
    }

    /**
     * Starts the creation of a variable set, for mixing shared and per-label attributes.
     */
    public <K> VariableBatch<K> variables(String name, Index<K> index) {
        return new VariableBatch<>(this, name, index);
    }

    <K> Series<K, Variable> addVariableSet(String name, Index<K> index, BatchAttribute<Number> lower,
                                           BatchAttribute<Number> upper, BatchAttribute<Boolean> integer) {
        checkIdentifier(name);
        if (variableSets.containsKey(name))
            throw new DuplicateNameException("a variable set named " + name + " already exists");
        if (lower.isScalar() && upper.isScalar()) {
            double lb = lower.scalarValue().doubleValue();
            double ub = upper.scalarValue().doubleValue();
            if (lb > ub)
                throw new InvalidBoundsException("lower bound " + lb + " is greater than upper bound "
                        + ub + " for variable set " + name);
            if (integer.isScalar() && integer.scalarValue() && Double.isFinite(lb) && Double.isFinite(ub)
                    && Math.ceil(lb) > Math.floor(ub))
                throw new InvalidBoundsException("ceil(" + lb + ") is greater than floor(" + ub
                        + ") for integer variable set " + name);
        }
        lower.checkLabels(index, "lower bounds", name);
        upper.checkLabels(index, "upper bounds", name);
        integer.checkLabels(index, "integrality", name);

        Series<K, Variable> variables = Series.of(index, key -> model.newVar(
                lower.valueOf(key).doubleValue(),
                upper.valueOf(key).doubleValue(),
                integer.valueOf(key),
                name + "[" + key + "]"));
        variableSets.put(name, variables);
        LOGGER.debug("created variable set {} with {} variables", name, variables.size());
        return variables;
    }

    /**
     * @return every variable of the model, set by set
     */
    public Index<Variable> getVariables() {
        List<Variable> all = new ArrayList<>();
        for (Series<?, Variable> set : variableSets.values())
            all.addAll(set.values());
        return Index.of(all);
    }

    /**
     * @throws NoSuchElementException if no variable set has this name
     */
    public Index<Variable> getVariables(String name) {
        return Index.of(getVariableReferences(name).values());
    }

    /**
     * @return the variables of a set, labeled like the index they were created with
     * @throws NoSuchElementException if no variable set has this name
     */
    public Series<?, Variable> getVariableReferences(String name) {
        Series<?, Variable> variables = variableSets.get(name);
        if (variables == null)
            throw new NoSuchElementException("no variable set named " + name);
        return variables;
    }

    public Series<Variable, Double> getVariableLowerBounds() {
        return Series.of(getVariables(), Variable::lowerBound);
    }

    public <K> Series<K, Double> getVariableLowerBounds(Series<K, Variable> variables) {
        return variables.map(Variable::lowerBound);
    }

    public Series<Variable, Double> getVariableUpperBounds() {
        return Series.of(getVariables(), Variable::upperBound);
    }

    public <K> Series<K, Double> getVariableUpperBounds(Series<K, Variable> variables) {
        return variables.map(Variable::upperBound);
    }

    // ---------------- constraints ----------------

    /**
     * Adds a single constraint as a set labeled {@code 0}.
     */
    public Series<Integer, LinearConstraint> createLinearConstraints(String name, BoolExpression constraint) {
        return createLinearConstraints(name, Series.fromList(List.of(constraint)));
    }

    /**
     * Adds one constraint per label of the series.
     *
     * @param name the name of the set
     * @param constraints bounded expressions, variable equalities or literals
     * @return the constraints, labeled like the series
     * @throws InvalidNameException if the name is not an identifier
     * @throws DuplicateNameException if a constraint set already has this name
     * @throws UnrecognizedExpressionException if a value is not a supported constraint
     */
    public <K> Series<K, LinearConstraint> createLinearConstraints(String name,
                                                                   Series<K, ? extends BoolExpression> constraints) {
        checkIdentifier(name);
        if (constraintSets.containsKey(name))
            throw new DuplicateNameException("a linear constraint set named " + name + " already exists");
        for (BoolExpression constraint : constraints.values())
            if (!(constraint instanceof BoundedExpression || constraint instanceof VarEqVar
                    || constraint instanceof BoolLiteral))
                throw new UnrecognizedExpressionException("cannot add a constraint of type "
                        + (constraint == null ? "null" : constraint.getClass().getName()) + " to set " + name);
        Series<K, LinearConstraint> result = constraints.mapWithKey(
                (key, constraint) -> model.add(constraint, name + "[" + key + "]"));
        constraintSets.put(name, result);
        LOGGER.debug("created linear constraint set {} with {} constraints", name, result.size());
        return result;
    }

    /**
     * @return every constraint of the model, set by set
     */
    public Index<LinearConstraint> getLinearConstraints() {
        List<LinearConstraint> all = new ArrayList<>();
        for (Series<?, LinearConstraint> set : constraintSets.values())
            all.addAll(set.values());
        return Index.of(all);
    }

    /**
     * @throws NoSuchElementException if no constraint set has this name
     */
    public Index<LinearConstraint> getLinearConstraints(String name) {
        return Index.of(getLinearConstraintReferences(name).values());
    }

    /**
     * @throws NoSuchElementException if no constraint set has this name
     */
    public Series<?, LinearConstraint> getLinearConstraintReferences(String name) {
        Series<?, LinearConstraint> constraints = constraintSets.get(name);
        if (constraints == null)
            throw new NoSuchElementException("no linear constraint set named " + name);
        return constraints;
    }

    /**
     * @return the left-hand side of each constraint, without offset
     */
    public <K> Series<K, LinearForm> getLinearConstraintExpressions(Series<K, LinearConstraint> constraints) {
        return constraints.map(LinearConstraint::expression);
    }

    public Series<LinearConstraint, LinearForm> getLinearConstraintExpressions() {
        return Series.of(getLinearConstraints(), LinearConstraint::expression);
    }

    public <K> Series<K, Double> getLinearConstraintLowerBounds(Series<K, LinearConstraint> constraints) {
        return constraints.map(LinearConstraint::lowerBound);
    }

    public Series<LinearConstraint, Double> getLinearConstraintLowerBounds() {
        return Series.of(getLinearConstraints(), LinearConstraint::lowerBound);
    }

    public <K> Series<K, Double> getLinearConstraintUpperBounds(Series<K, LinearConstraint> constraints) {
        return constraints.map(LinearConstraint::upperBound);
    }

    public Series<LinearConstraint, Double> getLinearConstraintUpperBounds() {
        return Series.of(getLinearConstraints(), LinearConstraint::upperBound);
    }

    // ---------------- objective ----------------

    public void minimize(LinearExpression expression) {
        model.minimize(expression);
    }

    public void maximize(LinearExpression expression) {
        model.maximize(expression);
    }

    /**
     * Replaces the current objective.
     */
    public void setObjective(LinearExpression expression, ObjectiveSense sense) {
        model.setObjective(expression, sense);
    }

    /**
     * @return the objective, restricted to the variables with a nonzero coefficient
     */
    public LinearForm getObjectiveExpression() {
        return model.objectiveExpression();
    }

    public ObjectiveSense getObjectiveSense() {
        return model.objectiveSense();
    }

    // ---------------- schema ----------------

    /**
     * @return one entry per variable set then one per constraint set, in creation order
     */
    public List<SchemaEntry> getSchema() {
        List<SchemaEntry> schema = new ArrayList<>();
        variableSets.forEach((name, set) -> schema.add(
                new SchemaEntry(SchemaEntry.VARIABLE, name, set.index().dimensionNames(), set.size())));
        constraintSets.forEach((name, set) -> schema.add(
                new SchemaEntry(SchemaEntry.LINEAR_CONSTRAINT, name, set.index().dimensionNames(), set.size())));
        return schema;
    }

    /**
     * @return the schema as a JSON array of objects with keys {@code type}, {@code name},
     *         {@code dimensions} and {@code count}
     */
    public String schemaToJson() {
        JSONArray array = new JSONArray();
        for (SchemaEntry entry : getSchema()) {
            JSONArray dimensions = new JSONArray();
            for (String dimension : entry.dimensions())
                dimensions.put(dimension == null ? JSONObject.NULL : dimension);
            JSONObject o = new JSONObject();
            o.put("type", entry.type());
            o.put("name", entry.name());
            o.put("dimensions", dimensions);
            o.put("count", entry.count());
            array.put(o);
        }
        return array.toString();
    }

    // ---------------- solve ----------------

    public SolveResult solve(SolverBackend backend) {
        return model.solve(backend);
    }

    public SolveResult solve(SolverBackend backend, SolveOptions options) {
        return model.solve(backend, options);
    }

    private static void checkIdentifier(String name) {
        if (name == null || name.isEmpty())
            throw new InvalidNameException("name " + name + " is not a valid identifier");
        char first = name.charAt(0);
        boolean valid = Character.isLetter(first) || first == '_';
        for (int i = 1; valid && i < name.length(); i++) {
            char c = name.charAt(i);
            valid = Character.isLetterOrDigit(c) || c == '_';
        }
        if (!valid)
            throw new InvalidNameException("name " + name + " is not a valid identifier");
    }

    @Override
    public String toString() {
        return "OptimizationModel(name=" + getName() + ") with schema " + schemaToJson();
    }
}
