package com.hogql.functions;

import java.util.Objects;

/**
 * A function that exists only in HogQL and has no ClickHouse counterpart.
 *
 * <p>The registry confirms the name and arity. Expansion into ClickHouse constructs is
 * done by a {@link com.hogql.generator.LanguageFunctionExpander}.
 */
public record LanguageFunctionSignature(String name, Arity arity) {

    public LanguageFunctionSignature {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(arity, "arity must not be null");
    }
}
