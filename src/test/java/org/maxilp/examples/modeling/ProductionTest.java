/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.examples.modeling;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

public class ProductionTest {

    @Test
    public void runs() {
        assertDoesNotThrow(() -> Production.main(new String[0]));
    }
}
