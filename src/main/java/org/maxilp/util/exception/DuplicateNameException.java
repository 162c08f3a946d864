/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.util.exception;

/**
 * A name already used by another entity of the same kind in the model.
 */
public class DuplicateNameException extends ConstructionException {

    public DuplicateNameException(String message) {
        super(message);
    }
}
