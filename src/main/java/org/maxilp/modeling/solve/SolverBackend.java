/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling.solve;

import org.maxilp.modeling.ModelRegistry;

/**
 * A solver able to optimize the models of a {@link ModelRegistry}.
 * <p>
 * Implementations read the model through {@link ModelRegistry#variables()},
 * {@link ModelRegistry#constraints()}, {@link ModelRegistry#isMaximize()} and
 * {@link ModelRegistry#objectiveOffset()}, and must not modify it.
 */
@FunctionalInterface
public interface SolverBackend {

    /**
     * Solves the model.
     *
     * @param model the model to solve
     * @param options the solve parameters
     * @return the status and, when one was found, the solution
     */
    SolveResult solve(ModelRegistry model, SolveOptions options);
}
