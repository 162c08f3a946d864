/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling.indexed;

import java.util.List;

/**
 * Description of one named set of an {@link OptimizationModel}.
 *
 * @param type {@code "variable"} or {@code "linear_constraint"}
 * @param name the name of the set
 * @param dimensions the dimension names of its index, {@code null} for unnamed dimensions
 * @param count the number of variables or constraints in the set
 */
public record SchemaEntry(String type, String name, List<String> dimensions, int count) {

    public static final String VARIABLE = "variable";
    public static final String LINEAR_CONSTRAINT = "linear_constraint";
}
