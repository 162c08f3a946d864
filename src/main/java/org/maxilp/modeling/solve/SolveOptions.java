/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling.solve;

import java.time.Duration;
import java.util.Objects;

/**
 * Parameters passed to a {@link SolverBackend}.
 *
 * @param timeLimit maximum solving time
 * @param enableOutput whether the backend may log its progress
 * @param solverSpecificParameters backend-specific settings, passed through untouched
 */
public record SolveOptions(Duration timeLimit, boolean enableOutput, String solverSpecificParameters) {

    public static final SolveOptions DEFAULT = new SolveOptions(Duration.ofSeconds(Long.MAX_VALUE), false, "");

    public SolveOptions {
        Objects.requireNonNull(timeLimit, "timeLimit");
        Objects.requireNonNull(solverSpecificParameters, "solverSpecificParameters");
        if (timeLimit.isNegative())
            throw new IllegalArgumentException("negative time limit " + timeLimit);
    }

    public SolveOptions withTimeLimit(Duration timeLimit) {
        return new SolveOptions(timeLimit, enableOutput, solverSpecificParameters);
    }

    public SolveOptions withOutput(boolean enableOutput) {
        return new SolveOptions(timeLimit, enableOutput, solverSpecificParameters);
    }
}
