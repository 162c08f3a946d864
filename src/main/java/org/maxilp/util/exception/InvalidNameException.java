/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.util.exception;

/**
 * A name that is not a valid identifier.
 */
public class InvalidNameException extends ConstructionException {

    public InvalidNameException(String message) {
        super(message);
    }
}
