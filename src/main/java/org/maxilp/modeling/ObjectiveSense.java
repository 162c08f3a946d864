/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling;

/**
 * Sense of the optimization objective.
 */
public enum ObjectiveSense {
    MINIMIZE,
    MAXIMIZE
}
