package com.hogql.generator;

import com.hogql.expression.Expression;

import java.util.List;

/**
 * Expands a HogQL-only function (such as {@code cohort}) into an expression built from
 * registered functions.
 *
 * <p>The expansion is translated like any other expression, so it must only use names
 * the registry accepts.
 */
@FunctionalInterface
public interface LanguageFunctionExpander {

    /**
     * Expands a call.
     *
     * @param arguments the untranslated call arguments, already checked for arity
     * @param context the query context
     * @return the replacement expression
     */
    Expression expand(List<Expression> arguments, QueryContext context);
}
