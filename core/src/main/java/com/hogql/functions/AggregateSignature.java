package com.hogql.functions;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * An allowed HogQL aggregate. Aggregates keep their name in ClickHouse.
 *
 * <p>Conditional variants ({@code countIf}, {@code sumIf}, ...) are separate entries that
 * take one more argument than their base aggregate: the trailing row filter.
 */
public final class AggregateSignature {

    private final String sourceName;
    private final Arity arity;

    public AggregateSignature(String sourceName, Arity arity) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName must not be null");
        this.arity = Objects.requireNonNull(arity, "arity must not be null");
        if (arity.min().isEmpty()) {
            throw new IllegalArgumentException("aggregate '" + sourceName + "' must declare minArgs");
        }
    }

    public String sourceName() {
        return sourceName;
    }

    /**
     * Returns the ClickHouse name, which is the HogQL name.
     */
    public String targetName() {
        return sourceName;
    }

    public Arity arity() {
        return arity;
    }

    public int minArgs() {
        return arity.effectiveMin();
    }

    public OptionalInt maxArgs() {
        return arity.max();
    }

    /**
     * Returns whether this is an {@code -If} conditional aggregate.
     */
    public boolean isConditional() {
        return sourceName.endsWith("If");
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AggregateSignature)) return false;
        AggregateSignature that = (AggregateSignature) obj;
        return sourceName.equals(that.sourceName) && arity.equals(that.arity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceName, arity);
    }

    @Override
    public String toString() {
        return sourceName + arity;
    }
}
