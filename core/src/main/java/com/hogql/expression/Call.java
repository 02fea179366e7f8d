package com.hogql.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Expression representing a function or aggregate call.
 *
 * <p>Examples:
 * <pre>
 *   toDateTime(timestamp)        -- function
 *   count(DISTINCT person_id)    -- aggregate with DISTINCT
 *   if(a, b, c)                  -- multi-argument function
 * </pre>
 *
 * <p>A call is only a name and an ordered argument list. Whether the name is legal is
 * decided by {@link com.hogql.generator.ExpressionTranslator}, never here.
 */
public final class Call implements Expression {

    private final String name;
    private final List<Expression> arguments;
    private final boolean distinct;

    /**
     * Creates a call expression.
     *
     * @param name the function name
     * @param arguments the call arguments
     * @param distinct whether DISTINCT is applied to arguments
     */
    public Call(String name, List<? extends Expression> arguments, boolean distinct) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        if (this.name.trim().isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
        this.arguments = new ArrayList<>(Objects.requireNonNull(arguments, "arguments must not be null"));
        for (Expression argument : this.arguments) {
            Objects.requireNonNull(argument, "arguments must not contain null");
        }
        this.distinct = distinct;
    }

    /**
     * Creates a call expression without DISTINCT.
     *
     * @param name the function name
     * @param arguments the call arguments
     */
    public Call(String name, List<? extends Expression> arguments) {
        this(name, arguments, false);
    }

    /**
     * Creates a call expression without DISTINCT.
     *
     * @param name the function name
     * @param arguments the call arguments
     * @return the call
     */
    public static Call of(String name, Expression... arguments) {
        return new Call(name, List.of(arguments));
    }

    public String name() {
        return name;
    }

    /**
     * Returns the call arguments.
     *
     * @return an unmodifiable list of arguments
     */
    public List<Expression> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    public int argumentCount() {
        return arguments.size();
    }

    public boolean distinct() {
        return distinct;
    }

    @Override
    public String toSQL() {
        String args = arguments.stream()
            .map(Expression::toSQL)
            .collect(Collectors.joining(", "));
        return name + "(" + (distinct ? "DISTINCT " : "") + args + ")";
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Call)) return false;
        Call that = (Call) obj;
        return distinct == that.distinct &&
               name.equals(that.name) &&
               arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arguments, distinct);
    }
}
