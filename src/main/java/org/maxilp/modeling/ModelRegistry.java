/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling;

import org.maxilp.util.exception.DuplicateNameException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Storage of the variables and linear constraints of one model.
 * <p>
 * Variables and constraints are addressed by dense indices, assigned in
 * creation order and never reused. The registry does not check that bounds
 * are consistent ({@code lower > upper} is accepted): the validity of the
 * model is left to the solver, and bounds can be edited in any order.
 * <p>
 * The registry is not thread-safe. A model must be built from a single thread.
 */
public class ModelRegistry {

    /**
     * A variable as seen by a solver.
     */
    public record VariableInfo(int index, double lower, double upper, boolean integral,
                               String name, double objectiveCoefficient) {
    }

    /**
     * A coefficient of a variable in a constraint.
     */
    public record Term(int variableIndex, double coefficient) {
    }

    /**
     * A linear constraint {@code lower <= sum(terms) <= upper} as seen by a solver.
     */
    public record ConstraintInfo(int index, double lower, double upper, String name, List<Term> terms) {
    }

    private static final class VariableData {
        double lower = Double.NEGATIVE_INFINITY;
        double upper = Double.POSITIVE_INFINITY;
        boolean integral;
        String name = "";
        double objectiveCoefficient;
    }

    private static final class ConstraintData {
        double lower = Double.NEGATIVE_INFINITY;
        double upper = Double.POSITIVE_INFINITY;
        String name = "";
        final LinkedHashMap<Integer, Double> terms = new LinkedHashMap<>();
    }

    private final List<VariableData> variables = new ArrayList<>();
    private final List<ConstraintData> constraints = new ArrayList<>();
    private final boolean enforceUniqueNames;
    // name -> indices currently carrying it, several when uniqueness is not enforced
    private final Map<String, Set<Integer>> variableNames = new HashMap<>();
    private final Map<String, Set<Integer>> constraintNames = new HashMap<>();

    private String name;
    private boolean maximize;
    private double objectiveOffset;

    public ModelRegistry() {
        this("", false);
    }

    /**
     * @param name the name of the model
     * @param enforceUniqueNames if true, giving a variable (resp. constraint) the name
     *                           of another variable (resp. constraint) throws a {@link DuplicateNameException}
     */
    public ModelRegistry(String name, boolean enforceUniqueNames) {
        this.name = Objects.requireNonNull(name);
        this.enforceUniqueNames = enforceUniqueNames;
    }

    public String name() {
        return name;
    }

    public void setName(String name) {
        this.name = Objects.requireNonNull(name);
    }

    public boolean enforcesUniqueNames() {
        return enforceUniqueNames;
    }

    // ---------------- variables ----------------

    /**
     * Adds an unnamed continuous variable with bounds {@code [-inf, +inf]}.
     *
     * @return the index of the new variable
     */
    public int addVar() {
        variables.add(new VariableData());
        return variables.size() - 1;
    }

    public int numVariables() {
        return variables.size();
    }

    public void setVarLowerBound(int index, double lower) {
        variable(index).lower = lower;
    }

    public void setVarUpperBound(int index, double upper) {
        variable(index).upper = upper;
    }

    public void setVarIntegrality(int index, boolean integral) {
        variable(index).integral = integral;
    }

    public void setVarObjectiveCoefficient(int index, double coefficient) {
        variable(index).objectiveCoefficient = coefficient;
    }

    public void setVarName(int index, String name) {
        VariableData data = variable(index);
        rename(variableNames, "variable", index, data.name, name);
        data.name = name == null ? "" : name;
    }

    /**
     * @return true if a variable already has this name
     */
    public boolean hasVariableName(String name) {
        return variableNames.containsKey(name);
    }

    public double varLowerBound(int index) {
        return variable(index).lower;
    }

    public double varUpperBound(int index) {
        return variable(index).upper;
    }

    public boolean varIsIntegral(int index) {
        return variable(index).integral;
    }

    public double varObjectiveCoefficient(int index) {
        return variable(index).objectiveCoefficient;
    }

    /**
     * @return the name of the variable, the empty string if it has none
     */
    public String varName(int index) {
        return variable(index).name;
    }

    // ---------------- constraints ----------------

    /**
     * Adds an unnamed constraint without terms and with bounds {@code [-inf, +inf]}.
     *
     * @return the index of the new constraint
     */
    public int addLinearConstraint() {
        constraints.add(new ConstraintData());
        return constraints.size() - 1;
    }

    public int numConstraints() {
        return constraints.size();
    }

    public void setConstraintLowerBound(int index, double lower) {
        constraint(index).lower = lower;
    }

    public void setConstraintUpperBound(int index, double upper) {
        constraint(index).upper = upper;
    }

    public void setConstraintName(int index, String name) {
        ConstraintData data = constraint(index);
        rename(constraintNames, "constraint", index, data.name, name);
        data.name = name == null ? "" : name;
    }

    /**
     * Adds {@code coefficient * variable} to a constraint. If the variable already
     * appears in the constraint, the coefficients are summed.
     */
    public void addTermToConstraint(int index, int variableIndex, double coefficient) {
        variable(variableIndex);
        constraint(index).terms.merge(variableIndex, coefficient, Double::sum);
    }

    /**
     * Sets the coefficient of a variable in a constraint, replacing any previous one.
     */
    public void setConstraintCoefficient(int index, int variableIndex, double coefficient) {
        variable(variableIndex);
        constraint(index).terms.put(variableIndex, coefficient);
    }

    /**
     * @return true if a constraint already has this name
     */
    public boolean hasConstraintName(String name) {
        return constraintNames.containsKey(name);
    }

    public double constraintLowerBound(int index) {
        return constraint(index).lower;
    }

    public double constraintUpperBound(int index) {
        return constraint(index).upper;
    }

    public String constraintName(int index) {
        return constraint(index).name;
    }

    /**
     * @return the coefficient of each variable index in the constraint, in insertion order
     */
    public Map<Integer, Double> constraintTerms(int index) {
        return Collections.unmodifiableMap(constraint(index).terms);
    }

    // ---------------- objective ----------------

    /**
     * Resets every objective coefficient and the offset to {@code 0}.
     * The optimization sense is left unchanged.
     */
    public void clearObjective() {
        for (VariableData v : variables)
            v.objectiveCoefficient = 0;
        objectiveOffset = 0;
    }

    public boolean isMaximize() {
        return maximize;
    }

    public void setMaximize(boolean maximize) {
        this.maximize = maximize;
    }

    public double objectiveOffset() {
        return objectiveOffset;
    }

    public void setObjectiveOffset(double offset) {
        this.objectiveOffset = offset;
    }

    // ---------------- enumeration ----------------

    /**
     * @return a snapshot of all variables, by increasing index
     */
    public List<VariableInfo> variables() {
        List<VariableInfo> result = new ArrayList<>(variables.size());
        for (int i = 0; i < variables.size(); i++) {
            VariableData v = variables.get(i);
            result.add(new VariableInfo(i, v.lower, v.upper, v.integral, v.name, v.objectiveCoefficient));
        }
        return result;
    }

    /**
     * @return a snapshot of all constraints, by increasing index
     */
    public List<ConstraintInfo> constraints() {
        List<ConstraintInfo> result = new ArrayList<>(constraints.size());
        for (int i = 0; i < constraints.size(); i++) {
            ConstraintData c = constraints.get(i);
            List<Term> terms = new ArrayList<>(c.terms.size());
            c.terms.forEach((variable, coefficient) -> terms.add(new Term(variable, coefficient)));
            result.add(new ConstraintInfo(i, c.lower, c.upper, c.name, List.copyOf(terms)));
        }
        return result;
    }

    private VariableData variable(int index) {
        return variables.get(Objects.checkIndex(index, variables.size()));
    }

    private ConstraintData constraint(int index) {
        return constraints.get(Objects.checkIndex(index, constraints.size()));
    }

    private void rename(Map<String, Set<Integer>> used, String kind, int index, String oldName, String newName) {
        if (newName != null && !newName.isEmpty()) {
            Set<Integer> owners = used.get(newName);
            if (enforceUniqueNames && owners != null && !owners.contains(index))
                throw new DuplicateNameException("a " + kind + " named " + newName + " already exists");
            used.computeIfAbsent(newName, k -> new TreeSet<>()).add(index);
        }
        if (!oldName.isEmpty() && !oldName.equals(newName)) {
            Set<Integer> owners = used.get(oldName);
            if (owners != null) {
                owners.remove(index);
                if (owners.isEmpty())
                    used.remove(oldName);
            }
        }
    }
}
