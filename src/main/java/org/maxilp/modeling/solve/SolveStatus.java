/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling.solve;

/**
 * Outcome of a solve, as reported by the backend.
 */
public enum SolveStatus {
    /** the solution is feasible and proven optimal */
    OPTIMAL,
    /** the solution is feasible, optimality is not proven */
    FEASIBLE,
    /** the model has no feasible solution */
    INFEASIBLE,
    /** the objective can be improved without limit */
    UNBOUNDED,
    UNKNOWN
}
