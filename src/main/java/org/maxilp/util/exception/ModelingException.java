/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.util.exception;

/**
 * Root of the errors raised while building a model.
 * Construction is not transactional: after one of these is thrown,
 * entities created before the failing call stay in the model.
 */
public class ModelingException extends RuntimeException {

    public ModelingException(String message) {
        super(message);
    }

    public ModelingException(String message, Throwable cause) {
        super(message, cause);
    }
}
