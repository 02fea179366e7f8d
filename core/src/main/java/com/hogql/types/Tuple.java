package com.hogql.types;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A fixed-arity, positional group of constants that may differ in kind.
 *
 * <p>Java has no native tuple, so constants that must classify as
 * {@link ConstantType#TUPLE} are wrapped in this class. Lists and arrays classify as
 * {@link ConstantType#ARRAY}.
 *
 * <p>Example: {@code Tuple.of(1, "a", true)} renders as {@code tuple(1, 'a', true)}.
 */
public final class Tuple {

    private final List<Object> elements;

    private Tuple(List<Object> elements) {
        this.elements = Collections.unmodifiableList(elements);
    }

    /**
     * Creates a tuple of the given elements. Null elements are permitted.
     *
     * @param elements the tuple elements, in order
     * @return the tuple
     */
    public static Tuple of(Object... elements) {
        Objects.requireNonNull(elements, "elements must not be null");
        return new Tuple(new ArrayList<>(Arrays.asList(elements)));
    }

    /**
     * Creates a tuple from a list of elements.
     *
     * @param elements the tuple elements, in order
     * @return the tuple
     */
    public static Tuple fromList(List<?> elements) {
        Objects.requireNonNull(elements, "elements must not be null");
        return new Tuple(new ArrayList<>(elements));
    }

    public List<Object> elements() {
        return elements;
    }

    public int arity() {
        return elements.size();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Tuple)) return false;
        return elements.equals(((Tuple) obj).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return "Tuple" + elements;
    }
}
