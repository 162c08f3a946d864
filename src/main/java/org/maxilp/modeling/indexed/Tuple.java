/*
 * MaxiLP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.maxilp.modeling.indexed;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Composite label made of several components, one per dimension of an {@link Index}.
 * Two tuples are equal when their components are equal, in order.
 *
 * @param components the components of the label
 */
public record Tuple(List<Object> components) {

    public Tuple {
        components = List.copyOf(components);
    }

    public static Tuple of(Object... components) {
        return new Tuple(Arrays.asList(components));
    }

    /**
     * Concatenates the components of two labels. A label that is not a tuple
     * counts as a single component.
     */
    public static Tuple concat(Object left, Object right) {
        List<Object> result = new ArrayList<>();
        addComponents(result, left);
        addComponents(result, right);
        return new Tuple(result);
    }

    private static void addComponents(List<Object> into, Object label) {
        if (label instanceof Tuple t)
            into.addAll(t.components);
        else
            into.add(label);
    }

    /**
     * @param level position of the component
     * @return the component at that position
     */
    public Object get(int level) {
        return components.get(level);
    }

    public int size() {
        return components.size();
    }

    @Override
    public String toString() {
        return components.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }
}
