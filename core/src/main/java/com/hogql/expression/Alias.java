package com.hogql.expression;

import com.hogql.generator.ClickHouseQuoting;

import java.util.Objects;

/**
 * Expression that gives a user-chosen name to another expression.
 *
 * <p>Examples:
 * <pre>
 *   count() AS total
 *   toStartOfDay(timestamp) AS day
 * </pre>
 *
 * <p>Aliases are checked against {@link com.hogql.validation.ReservedVocabulary} during
 * translation.
 */
public final class Alias implements Expression {

    private final Expression expression;
    private final String alias;

    public Alias(Expression expression, String alias) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
        if (alias.isEmpty()) {
            throw new IllegalArgumentException("alias must not be empty");
        }
    }

    public Expression expression() {
        return expression;
    }

    public String alias() {
        return alias;
    }

    @Override
    public String toSQL() {
        return expression.toSQL() + " AS " + ClickHouseQuoting.quoteIdentifierIfNeeded(alias);
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Alias)) return false;
        Alias that = (Alias) obj;
        return expression.equals(that.expression) && alias.equals(that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, alias);
    }
}
