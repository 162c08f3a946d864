/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.util.exception;

/**
 * Thrown when an expression node of an unknown kind reaches the flattener or the compiler.
 */
public class UnrecognizedExpressionException extends AlgebraException {

    public UnrecognizedExpressionException(String message) {
        super(message);
    }
}
