/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.util.exception;

/**
 * A per-key table whose key set differs from the requested index,
 * or two sequences whose lengths should agree and do not.
 */
public class IndexMismatchException extends ConstructionException {

    public IndexMismatchException(String message) {
        super(message);
    }
}
