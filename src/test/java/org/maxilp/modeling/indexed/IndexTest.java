/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling.indexed;

import org.junit.jupiter.api.Test;
import org.maxilp.util.exception.ConstructionException;
import org.maxilp.util.exception.IndexMismatchException;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IndexTest {

    @Test
    public void keepsTheOrderOfItsLabels() {
        Index<String> index = Index.of("c", "a", "b");
        assertEquals(List.of("c", "a", "b"), index.keys());
        assertEquals(1, index.positionOf("a"));
        assertEquals(-1, index.positionOf("z"));
        assertTrue(index.contains("b"));
        assertEquals("b", index.get(2));
    }

    @Test
    public void duplicateLabelsAreRejected() {
        assertThrows(ConstructionException.class, () -> Index.of(1, 2, 1));
        assertThrows(ConstructionException.class, () -> Index.of(Arrays.asList("a", "a")));
    }

    @Test
    public void range() {
        assertEquals(List.of(0, 1, 2), Index.range(3).keys());
        assertTrue(Index.range(0).isEmpty());
    }

    @Test
    public void product() {
        Index<Tuple> index = Index.product(Index.of("a", "b"), Index.range(2));
        assertEquals(List.of(Tuple.of("a", 0), Tuple.of("a", 1), Tuple.of("b", 0), Tuple.of("b", 1)), index.keys());
        Index<Tuple> cube = Index.product(index, Index.of("u"));
        assertEquals(Tuple.of("b", 1, "u"), cube.get(3));
        assertEquals(3, cube.dimensionNames().size());
    }

    @Test
    public void dimensionNames() {
        Index<String> products = Index.of("p", "q").withNames("product");
        Index<Integer> periods = Index.range(2);
        assertEquals(List.of("product"), products.dimensionNames());
        assertEquals(Arrays.asList((String) null), periods.dimensionNames());
        assertEquals(Arrays.asList("product", null), Index.product(products, periods).dimensionNames());
        assertEquals(Arrays.asList(null, null), Index.product(periods, periods.withNames()).dimensionNames());
        assertEquals(2, Index.product(products, periods).dimensions());
        assertThrows(IndexMismatchException.class, () -> periods.withNames("period", "extra"));
    }

    @Test
    public void sameKeysIgnoresOrder() {
        assertTrue(Index.of(1, 2, 3).sameKeys(Index.of(3, 1, 2)));
        assertFalse(Index.of(1, 2, 3).sameKeys(Index.of(1, 2)));
        assertFalse(Index.of(1, 2).sameKeys(Index.of("1", "2")));
        assertNotEquals(Index.of(1, 2), Index.of(2, 1));
        assertEquals(Index.of(0, 1), Index.range(2));
    }

    @Test
    public void tupleRendering() {
        assertEquals("(a, 0)", Tuple.of("a", 0).toString());
        assertEquals("a", Tuple.of("a", 0).get(0));
        assertEquals(Tuple.of("a", 0), Tuple.concat("a", 0));
    }
}
