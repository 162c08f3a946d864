/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling.indexed;

import org.junit.jupiter.api.Test;
import org.maxilp.modeling.Variable;
import org.maxilp.util.exception.IndexMismatchException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class VariableBatchTest {

    @Test
    public void defaultsAreUnboundedAndContinuous() {
        OptimizationModel model = new OptimizationModel("batch");
        Series<Integer, Variable> x = model.variables("x", Index.range(2)).build();
        for (Variable v : x.values()) {
            assertEquals(Double.NEGATIVE_INFINITY, v.lowerBound());
            assertEquals(Double.POSITIVE_INFINITY, v.upperBound());
            assertFalse(v.isIntegral());
        }
    }

    @Test
    public void mixesSharedAndPerLabelAttributes() {
        OptimizationModel model = new OptimizationModel("batch");
        Index<String> items = Index.of("small", "large");
        Series<String, Double> capacity = Series.of(items, k -> k.equals("small") ? 5.0 : 50.0);
        Series<String, Variable> x = model.variables("stock", items)
                .lowerBound(0)
                .upperBound(capacity)
                .integer(true)
                .build();
        assertEquals(List.of(5.0, 50.0), model.getVariableUpperBounds(x).values());
        assertEquals(List.of(0.0, 0.0), model.getVariableLowerBounds(x).values());
        assertTrue(x.get("large").isIntegral());
        assertEquals("stock[small]", x.get("small").name());
    }

    @Test
    public void nothingIsAddedBeforeBuild() {
        OptimizationModel model = new OptimizationModel("batch");
        VariableBatch<Integer> batch = model.variables("x", Index.range(3)).upperBound(1);
        assertEquals(0, model.registry().numVariables());
        batch.build();
        assertEquals(3, model.registry().numVariables());
    }

    @Test
    public void perLabelBoundsAreNotCompared() {
        OptimizationModel model = new OptimizationModel("batch");
        Index<Integer> index = Index.range(2);
        Series<Integer, Variable> x = model.variables("x", index)
                .lowerBound(Series.constant(index, 3))
                .upperBound(1)
                .build();
        assertEquals(3.0, x.get(0).lowerBound());
        assertEquals(1.0, x.get(0).upperBound());
    }

    @Test
    public void integralityTableMustMatch() {
        OptimizationModel model = new OptimizationModel("batch");
        VariableBatch<Integer> batch = model.variables("x", Index.range(2))
                .integer(Series.constant(Index.range(3), true));
        assertThrows(IndexMismatchException.class, batch::build);
        assertEquals(0, model.registry().numVariables());
    }
}
