/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling.utils;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.maxilp.modeling.LinearModel;
import org.maxilp.modeling.Variable;
import org.maxilp.modeling.algebra.LinearExpression;
import org.maxilp.modeling.algebra.linear.Constant;
import org.maxilp.modeling.algebra.linear.LinearForm;
import org.maxilp.modeling.algebra.linear.Scale;
import org.maxilp.modeling.algebra.linear.Sum;
import org.maxilp.modeling.algebra.linear.WeightedSum;
import org.maxilp.util.exception.UnrecognizedExpressionException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionFlattenerTest {

    public static IntStream getSeeds() {
        return IntStream.range(0, 30);
    }

    /**
     * Builds a random tree and evaluates it directly, with the given assignment.
     */
    private static LinearExpression randomTree(Random rand, List<Variable> vars, int depth, double[] value,
                                               Map<Variable, Double> assignment) {
        int kind = depth == 0 ? rand.nextInt(2) : rand.nextInt(5);
        switch (kind) {
            case 0: {
                double c = rand.nextInt(21) - 10;
                value[0] = c;
                return new Constant(c);
            }
            case 1: {
                Variable x = vars.get(rand.nextInt(vars.size()));
                value[0] = assignment.get(x);
                return x;
            }
            case 2: {
                LinearExpression left = randomTree(rand, vars, depth - 1, value, assignment);
                double l = value[0];
                LinearExpression right = randomTree(rand, vars, depth - 1, value, assignment);
                value[0] += l;
                return new Sum(left, right);
            }
            case 3: {
                double c = rand.nextInt(7) - 3;
                LinearExpression e = randomTree(rand, vars, depth - 1, value, assignment);
                value[0] *= c;
                return new Scale(e, c);
            }
            default: {
                int n = 1 + rand.nextInt(3);
                List<LinearExpression> children = new ArrayList<>();
                double[] coefficients = new double[n];
                double constant = rand.nextInt(5);
                double total = constant;
                for (int i = 0; i < n; i++) {
                    children.add(randomTree(rand, vars, depth - 1, value, assignment));
                    coefficients[i] = rand.nextInt(9) - 4;
                    total += coefficients[i] * value[0];
                }
                value[0] = total;
                return new WeightedSum(children, coefficients, constant);
            }
        }
    }

    @ParameterizedTest
    @MethodSource("getSeeds")
    public void flattenedFormEvaluatesLikeTheTree(int seed) {
        Random rand = new Random(seed);
        LinearModel model = new LinearModel();
        List<Variable> vars = new ArrayList<>();
        Map<Variable, Double> assignment = new HashMap<>();
        for (int i = 0; i < 4; i++) {
            Variable x = model.newNumVar(-10, 10, "x" + i);
            vars.add(x);
            assignment.put(x, (double) (rand.nextInt(11) - 5));
        }
        double[] expected = new double[1];
        LinearExpression tree = randomTree(rand, vars, 5, expected, assignment);
        LinearForm form = ExpressionFlattener.flatten(tree);
        assertEquals(expected[0], form.evaluate(assignment), 1e-9);
        for (Variable x : form.terms().keySet())
            assertTrue(vars.contains(x));
    }

    @ParameterizedTest
    @MethodSource("getSeeds")
    public void flatteningIsIdempotent(int seed) {
        Random rand = new Random(seed);
        LinearModel model = new LinearModel();
        List<Variable> vars = List.of(model.newNumVar(0, 1, "a"), model.newNumVar(0, 1, "b"));
        Map<Variable, Double> assignment = Map.of(vars.get(0), 1.0, vars.get(1), 2.0);
        LinearForm once = ExpressionFlattener.flatten(randomTree(rand, vars, 4, new double[1], assignment));
        LinearForm twice = ExpressionFlattener.flatten(once);
        assertSame(once, twice);
        assertEquals(once, ExpressionFlattener.flatten(new Scale(once, 1)));
    }

    @Test
    public void termsOfTheSameVariableAreAggregated() {
        LinearModel model = new LinearModel();
        Variable x = model.newNumVar(0, 1, "x");
        Variable y = model.newNumVar(0, 1, "y");
        LinearForm form = ExpressionFlattener.flatten(x.mul(2).plus(y).plus(x.mul(3)).plus(4));
        assertEquals(4.0, form.offset());
        assertEquals(5.0, form.coefficient(x));
        assertEquals(1.0, form.coefficient(y));
        assertEquals(2, form.terms().size());
    }

    @Test
    public void cancelledTermsAreKept() {
        LinearModel model = new LinearModel();
        Variable x = model.newNumVar(0, 1, "x");
        LinearForm form = x.minus(x).flatten();
        assertEquals(0.0, form.offset());
        assertEquals(Map.of(x, 0.0), form.terms());
        assertEquals("0.0", form.toString());
    }

    @Test
    public void constantOnlyExpression() {
        LinearForm form = ExpressionFlattener.flatten(new Sum(new Constant(2), new Scale(new Constant(3), 4)));
        assertTrue(form.isConstant());
        assertEquals(14.0, form.offset());
        assertEquals(LinearForm.of(3.5), ExpressionFlattener.flatten(3.5));
    }

    @Test
    public void deepSumDoesNotOverflowTheStack() {
        LinearModel model = new LinearModel();
        Variable x = model.newNumVar(0, 1, "x");
        LinearExpression e = new Constant(0);
        for (int i = 0; i < 100_000; i++)
            e = new Sum(e, x);
        LinearForm form = ExpressionFlattener.flatten(e);
        assertEquals(100_000.0, form.coefficient(x));
        assertEquals(0.0, form.offset());
    }

    @Test
    public void deepProductDoesNotOverflowTheStack() {
        LinearModel model = new LinearModel();
        Variable x = model.newNumVar(0, 1, "x");
        LinearExpression e = x;
        for (int i = 0; i < 100_000; i++)
            e = new Scale(e, i % 2 == 0 ? -1 : 1);
        assertEquals(1.0, ExpressionFlattener.flatten(e).coefficient(x));
    }

    @Test
    public void unknownNodeIsRejected() {
        LinearExpression unknown = new LinearExpression() {
        };
        assertThrows(UnrecognizedExpressionException.class, () -> ExpressionFlattener.flatten(unknown));
        assertThrows(UnrecognizedExpressionException.class,
                () -> ExpressionFlattener.flatten(new Sum(new Constant(1), unknown)));
    }
}
