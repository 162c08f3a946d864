/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.maxilp.modeling.algebra.bool.BoolExpression;
import org.maxilp.util.exception.DuplicateNameException;
import org.maxilp.util.exception.UnrecognizedExpressionException;

import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.maxilp.modeling.Factory.*;

public class ConstraintCompilerTest {

    public static Stream<ModelRegistry> getRegistry() {
        return Stream.of(new ModelRegistry(), new ModelRegistry("unique", true));
    }

    @ParameterizedTest
    @MethodSource("getRegistry")
    public void offsetIsMovedToTheBounds(ModelRegistry registry) {
        Variable x = new LinearModel(registry).newNumVar(0, 10, "x");
        LinearConstraint c = ConstraintCompiler.compile(registry, x.plus(5).le(8), "c");
        assertEquals(Double.NEGATIVE_INFINITY, c.lowerBound());
        assertEquals(3.0, c.upperBound());
        assertEquals(Map.of(x.index(), 1.0), registry.constraintTerms(c.index()));
        assertEquals("c", c.name());
    }

    @ParameterizedTest
    @MethodSource("getRegistry")
    public void sidesAreSymmetric(ModelRegistry registry) {
        LinearModel model = new LinearModel(registry);
        Variable x = model.newNumVar(0, 10, "x");
        Variable y = model.newNumVar(0, 10, "y");
        LinearConstraint left = model.add(le(x, y.plus(2)));
        LinearConstraint right = model.add(ge(y.plus(2), x));
        assertEquals(Double.NEGATIVE_INFINITY, left.lowerBound());
        assertEquals(2.0, left.upperBound());
        assertEquals(Map.of(x.index(), 1.0, y.index(), -1.0), registry.constraintTerms(left.index()));
        assertEquals(-2.0, right.lowerBound());
        assertEquals(Double.POSITIVE_INFINITY, right.upperBound());
        assertEquals(Map.of(x.index(), -1.0, y.index(), 1.0), registry.constraintTerms(right.index()));
    }

    @ParameterizedTest
    @MethodSource("getRegistry")
    public void variableEquality(ModelRegistry registry) {
        LinearModel model = new LinearModel(registry);
        Variable x = model.newNumVar(0, 10, "x");
        Variable y = model.newNumVar(0, 10, "y");
        LinearConstraint c = model.add(eq(x, y), "same");
        assertEquals(0.0, c.lowerBound());
        assertEquals(0.0, c.upperBound());
        assertEquals(Map.of(x.index(), 1.0, y.index(), -1.0), registry.constraintTerms(c.index()));
    }

    @ParameterizedTest
    @MethodSource("getRegistry")
    public void literals(ModelRegistry registry) {
        LinearModel model = new LinearModel(registry);
        LinearConstraint always = model.add(literal(true));
        LinearConstraint never = model.add(literal(false));
        assertEquals(0.0, always.lowerBound());
        assertEquals(0.0, always.upperBound());
        assertTrue(registry.constraintTerms(always.index()).isEmpty());
        assertEquals(1.0, never.lowerBound());
        assertEquals(1.0, never.upperBound());
        assertTrue(registry.constraintTerms(never.index()).isEmpty());
    }

    @Test
    public void cancelledVariablesStayInTheConstraint() {
        ModelRegistry registry = new ModelRegistry();
        LinearModel model = new LinearModel(registry);
        Variable x = model.newNumVar(0, 10, "x");
        LinearConstraint c = model.add(x.minus(x).le(1));
        assertEquals(Map.of(x.index(), 0.0), registry.constraintTerms(c.index()));
    }

    @Test
    public void duplicateNamesWhenEnforced() {
        ModelRegistry registry = new ModelRegistry("unique", true);
        LinearModel model = new LinearModel(registry);
        Variable x = model.newNumVar(0, 10, "x");
        model.add(x.le(1), "c");
        assertThrows(DuplicateNameException.class, () -> model.add(x.ge(0), "c"));
        assertEquals(1, registry.numConstraints());
    }

    @Test
    public void duplicateNamesAreAllowedByDefault() {
        LinearModel model = new LinearModel();
        Variable x = model.newNumVar(0, 10, "x");
        model.add(x.le(1), "c");
        model.add(x.ge(0), "c");
        assertEquals(2, model.numConstraints());
    }

    @Test
    public void variablesOfAnotherModelAreRejected() {
        LinearModel model = new LinearModel();
        Variable foreign = new LinearModel().newNumVar(0, 1, "x");
        assertThrows(IllegalArgumentException.class, () -> model.add(foreign.le(1)));
        assertEquals(0, model.numConstraints());
    }

    @Test
    public void unknownConstraintIsRejected() {
        LinearModel model = new LinearModel();
        BoolExpression unknown = () -> true;
        assertThrows(UnrecognizedExpressionException.class, () -> model.add(unknown));
        assertEquals(0, model.numConstraints());
    }
}
