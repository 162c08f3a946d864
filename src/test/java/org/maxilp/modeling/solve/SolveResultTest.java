/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling.solve;

import org.junit.jupiter.api.Test;
import org.maxilp.modeling.LinearConstraint;
import org.maxilp.modeling.LinearModel;
import org.maxilp.modeling.Variable;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class SolveResultTest {

    @Test
    public void valuesAreCopied() {
        double[] values = {1, 2};
        SolveResult result = new SolveResult(SolveStatus.FEASIBLE, 3, values, null, null);
        values[0] = 42;
        LinearModel model = new LinearModel();
        Variable x = model.newNumVar(0, 5, "x");
        assertEquals(1.0, result.value(x));
        assertEquals(3.0, result.objectiveValue());
    }

    @Test
    public void reducedCostsAndDualsAreOptional() {
        LinearModel model = new LinearModel();
        Variable x = model.newNumVar(0, 5, "x");
        LinearConstraint c = model.add(x.le(4));
        SolveResult without = new SolveResult(SolveStatus.OPTIMAL, 4, new double[]{4}, null, null);
        assertThrows(IllegalStateException.class, () -> without.reducedCost(x));
        assertThrows(IllegalStateException.class, () -> without.dualValue(c));

        SolveResult with = new SolveResult(SolveStatus.OPTIMAL, 4, new double[]{4}, new double[]{0}, new double[]{1});
        assertEquals(0.0, with.reducedCost(x));
        assertEquals(1.0, with.dualValue(c));
    }

    @Test
    public void noSolution() {
        SolveResult result = SolveResult.withoutSolution(SolveStatus.UNBOUNDED);
        assertEquals(SolveStatus.UNBOUNDED, result.status());
        assertFalse(result.hasSolution());
        assertTrue(Double.isNaN(result.objectiveValue()));
        Variable x = new LinearModel().newNumVar(0, 1, "x");
        assertThrows(IllegalStateException.class, () -> result.value(x.plus(1)));
    }

    @Test
    public void options() {
        SolveOptions options = SolveOptions.DEFAULT.withTimeLimit(Duration.ofMinutes(1)).withOutput(true);
        assertEquals(Duration.ofMinutes(1), options.timeLimit());
        assertTrue(options.enableOutput());
        assertEquals("", options.solverSpecificParameters());
        assertFalse(SolveOptions.DEFAULT.enableOutput());
        assertThrows(IllegalArgumentException.class, () -> SolveOptions.DEFAULT.withTimeLimit(Duration.ofSeconds(-1)));
    }
}
