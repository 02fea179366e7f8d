package com.hogql.functions;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * The permitted number of arguments for a function: an optional lower and an optional
 * upper bound.
 *
 * <p>An absent lower bound enforces nothing beyond zero. An absent upper bound makes the
 * function variadic.
 */
public final class Arity {

    private static final Arity UNBOUNDED = new Arity(null, null);

    private final Integer min;
    private final Integer max;

    private Arity(Integer min, Integer max) {
        if (min != null && min < 0) {
            throw new IllegalArgumentException("minArgs must not be negative: " + min);
        }
        if (max != null && max < 0) {
            throw new IllegalArgumentException("maxArgs must not be negative: " + max);
        }
        if (min != null && max != null && min > max) {
            throw new IllegalArgumentException("minArgs (" + min + ") must not exceed maxArgs (" + max + ")");
        }
        this.min = min;
        this.max = max;
    }

    /**
     * Creates an arity from optional bounds.
     *
     * @param min the lower bound, or null for none
     * @param max the upper bound, or null for variadic
     * @return the arity
     * @throws IllegalArgumentException if a bound is negative or min exceeds max
     */
    public static Arity of(Integer min, Integer max) {
        if (min == null && max == null) {
            return UNBOUNDED;
        }
        return new Arity(min, max);
    }

    public static Arity exactly(int count) {
        return new Arity(count, count);
    }

    public static Arity between(int min, int max) {
        return new Arity(min, max);
    }

    public static Arity atLeast(int min) {
        return new Arity(min, null);
    }

    public static Arity unbounded() {
        return UNBOUNDED;
    }

    public OptionalInt min() {
        return min == null ? OptionalInt.empty() : OptionalInt.of(min);
    }

    public OptionalInt max() {
        return max == null ? OptionalInt.empty() : OptionalInt.of(max);
    }

    /**
     * Returns the lower bound, treating an absent one as zero.
     */
    public int effectiveMin() {
        return min == null ? 0 : min;
    }

    /**
     * Returns whether {@code count} arguments satisfy both bounds.
     *
     * @param count the number of supplied arguments
     * @return true if accepted
     */
    public boolean accepts(int count) {
        if (min != null && count < min) {
            return false;
        }
        return max == null || count <= max;
    }

    /**
     * Describes the bounds for error messages, e.g. "exactly 2" or "between 1 and 3".
     *
     * @return the description
     */
    public String describe() {
        if (min != null && max != null) {
            return min.equals(max) ? "exactly " + min : "between " + min + " and " + max;
        }
        if (min != null) {
            return "at least " + min;
        }
        if (max != null) {
            return "at most " + max;
        }
        return "any number of";
    }

    /**
     * Returns whether {@link #describe()} ends on the number one, for pluralization.
     */
    public boolean isSingular() {
        if (max != null) {
            return max == 1;
        }
        return min != null && min == 1;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Arity)) return false;
        Arity that = (Arity) obj;
        return Objects.equals(min, that.min) && Objects.equals(max, that.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(min, max);
    }

    @Override
    public String toString() {
        return "[" + (min == null ? "" : min) + ", " + (max == null ? "" : max) + "]";
    }
}
