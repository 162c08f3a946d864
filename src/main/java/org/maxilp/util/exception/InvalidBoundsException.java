/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.util.exception;

/**
 * Scalar lower bound greater than the scalar upper bound of a variable set.
 */
public class InvalidBoundsException extends ModelingException {

    public InvalidBoundsException(String message) {
        super(message);
    }
}
