/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.util.exception;

/**
 * Malformed model construction request: bad identifiers, duplicate names,
 * label sets that do not match.
 */
public class ConstructionException extends ModelingException {

    public ConstructionException(String message) {
        super(message);
    }
}
