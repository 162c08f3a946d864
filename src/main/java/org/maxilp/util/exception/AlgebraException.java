/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.util.exception;

/**
 * Invalid operation on linear expressions.
 */
public class AlgebraException extends ModelingException {

    public AlgebraException(String message) {
        super(message);
    }
}
