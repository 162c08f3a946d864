/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.util.exception;

public class DivisionByZeroException extends AlgebraException {

    public DivisionByZeroException(String message) {
        super(message);
    }
}
