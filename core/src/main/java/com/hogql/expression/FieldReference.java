package com.hogql.expression;

import com.hogql.generator.ClickHouseQuoting;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Expression referencing a field by name.
 *
 * <p>Fields can be simple ({@code event}) or chained ({@code properties.$browser}).
 * Each part is quoted only when it is not a plain word.
 */
public final class FieldReference implements Expression {

    private final List<String> chain;

    /**
     * Creates a field reference from its name parts.
     *
     * @param chain the name parts, outermost first
     */
    public FieldReference(List<String> chain) {
        Objects.requireNonNull(chain, "chain must not be null");
        if (chain.isEmpty()) {
            throw new IllegalArgumentException("chain must not be empty");
        }
        for (String part : chain) {
            Objects.requireNonNull(part, "chain must not contain null parts");
        }
        this.chain = List.copyOf(chain);
    }

    /**
     * Creates a field reference.
     *
     * @param first the first name part
     * @param rest further name parts
     * @return the field reference
     */
    public static FieldReference of(String first, String... rest) {
        Objects.requireNonNull(first, "first must not be null");
        String[] parts = new String[rest.length + 1];
        parts[0] = first;
        System.arraycopy(rest, 0, parts, 1, rest.length);
        return new FieldReference(Arrays.asList(parts));
    }

    public List<String> chain() {
        return Collections.unmodifiableList(chain);
    }

    @Override
    public String toSQL() {
        return chain.stream()
            .map(ClickHouseQuoting::quoteIdentifierIfNeeded)
            .collect(Collectors.joining("."));
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FieldReference)) return false;
        return chain.equals(((FieldReference) obj).chain);
    }

    @Override
    public int hashCode() {
        return chain.hashCode();
    }
}
