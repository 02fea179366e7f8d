package com.hogql.functions;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * An allowed HogQL function: its ClickHouse name, its arity and its special rules.
 *
 * <p>Signatures are built once when {@link FunctionRegistry} is initialized and never
 * change afterwards.
 */
public final class FunctionSignature {

    private final String sourceName;
    private final String targetName;
    private final Arity arity;
    private final Set<SpecialRule> rules;

    /**
     * Creates a function signature.
     *
     * @param sourceName the HogQL function name
     * @param targetName the ClickHouse function name
     * @param arity the permitted argument count
     * @param rules the special rules applied at rewrite time
     */
    public FunctionSignature(String sourceName, String targetName, Arity arity, Set<SpecialRule> rules) {
        this.sourceName = requireName(sourceName, "sourceName");
        this.targetName = requireName(targetName, "targetName");
        this.arity = Objects.requireNonNull(arity, "arity must not be null");
        Objects.requireNonNull(rules, "rules must not be null");
        this.rules = rules.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(rules));
    }

    /**
     * Creates a function signature without special rules.
     */
    public FunctionSignature(String sourceName, String targetName, Arity arity) {
        this(sourceName, targetName, arity, Collections.emptySet());
    }

    private static String requireName(String name, String what) {
        Objects.requireNonNull(name, what + " must not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException(what + " must not be empty");
        }
        return name;
    }

    public String sourceName() {
        return sourceName;
    }

    public String targetName() {
        return targetName;
    }

    public Arity arity() {
        return arity;
    }

    public OptionalInt minArgs() {
        return arity.min();
    }

    public OptionalInt maxArgs() {
        return arity.max();
    }

    public Set<SpecialRule> rules() {
        return rules;
    }

    public boolean hasRule(SpecialRule rule) {
        return rules.contains(rule);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionSignature)) return false;
        FunctionSignature that = (FunctionSignature) obj;
        return sourceName.equals(that.sourceName) &&
               targetName.equals(that.targetName) &&
               arity.equals(that.arity) &&
               rules.equals(that.rules);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceName, targetName, arity, rules);
    }

    @Override
    public String toString() {
        return sourceName + " -> " + targetName + arity + (rules.isEmpty() ? "" : " " + rules);
    }
}
