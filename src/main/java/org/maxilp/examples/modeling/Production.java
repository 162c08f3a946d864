/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.examples.modeling;

import org.maxilp.modeling.LinearConstraint;
import org.maxilp.modeling.ModelRegistry;
import org.maxilp.modeling.Variable;
import org.maxilp.modeling.indexed.Index;
import org.maxilp.modeling.indexed.OptimizationModel;
import org.maxilp.modeling.indexed.Series;

import java.util.Map;

import static org.maxilp.modeling.Factory.dot;
import static org.maxilp.modeling.Factory.sum;

/**
 * A small production planning problem: three products share the capacity
 * of three workshops, and the profit must be maximized.
 * <p>
 * The model is only compiled and printed, in the form a solver receives it.
 */
public class Production {

    public static void main(String[] args) {
        OptimizationModel model = new OptimizationModel("production");

        Index<String> products = Index.of("desk", "table", "chair").withNames("product");
        Series<String, Variable> x = model.createVariables("x", products, 0, Double.POSITIVE_INFINITY, false);

        double[][] usage = {
                {1, 1, 1},
                {10, 4, 5},
                {2, 2, 6}
        };
        double[] capacity = {100, 600, 300};
        Index<String> workshops = Index.of("finishing", "carpentry", "assembly").withNames("workshop");

        model.createLinearConstraints("capacity", Series.of(workshops,
                w -> dot(x, usage[workshops.positionOf(w)]).le(capacity[workshops.positionOf(w)])));
        model.createLinearConstraints("demand", sum(x).ge(10));

        model.maximize(dot(x, 10, 6, 4));

        System.out.println(model);
        ModelRegistry registry = model.registry();
        for (ModelRegistry.ConstraintInfo c : registry.constraints())
            System.out.println(c.lower() + " <= " + c.name() + " <= " + c.upper() + " " + c.terms());
        Series<?, LinearConstraint> capacities = model.getLinearConstraintReferences("capacity");
        for (Map.Entry<?, LinearConstraint> e : capacities.asMap().entrySet())
            System.out.println(e.getKey() + ": " + e.getValue().expression());
        System.out.println("objective: " + model.getObjectiveSense() + " " + model.getObjectiveExpression());
    }
}
