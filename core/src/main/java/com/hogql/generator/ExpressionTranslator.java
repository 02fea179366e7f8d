package com.hogql.generator;

import com.hogql.exception.QueryCompilationException;
import com.hogql.exception.UnknownFunctionException;
import com.hogql.expression.Alias;
import com.hogql.expression.Call;
import com.hogql.expression.Constant;
import com.hogql.expression.Expression;
import com.hogql.expression.FieldReference;
import com.hogql.functions.AggregateSignature;
import com.hogql.functions.CallRewriter;
import com.hogql.functions.FunctionRegistry;
import com.hogql.functions.FunctionSignature;
import com.hogql.functions.LanguageFunctionSignature;
import com.hogql.validation.ReservedVocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Translates HogQL expression trees into ClickHouse expression trees.
 *
 * <p>Translation is bottom-up and keeps the structure of the input tree:
 * <ul>
 *   <li>Constants, keyword literals and field references pass through unchanged</li>
 *   <li>Aliases are checked against {@link ReservedVocabulary} before anything inside
 *       them is resolved</li>
 *   <li>Calls are resolved as a function, then an aggregate, then a language-level
 *       function; a name found in none of them fails with
 *       {@link UnknownFunctionException}</li>
 * </ul>
 *
 * <p>A translator is immutable and may be shared by threads compiling queries for the
 * same context.
 *
 * <p>Example usage:
 * <pre>
 *   ExpressionTranslator translator = new ExpressionTranslator(new QueryContext(1, "UTC"));
 *   translator.generate(Call.of("toDateTime", FieldReference.of("timestamp")));
 *   // parseDateTime64BestEffortOrNull(timestamp, 'UTC')
 * </pre>
 */
public final class ExpressionTranslator {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionTranslator.class);

    private final QueryContext context;
    private final CallRewriter rewriter;
    private final Map<String, LanguageFunctionExpander> expanders;

    /**
     * Creates a translator without language-level function expanders.
     *
     * @param context the query context
     */
    public ExpressionTranslator(QueryContext context) {
        this(context, new CallRewriter(), Map.of());
    }

    /**
     * Creates a translator.
     *
     * @param context the query context
     * @param rewriter the call rewriter
     * @param expanders expanders keyed by language-level function name
     * @throws IllegalArgumentException if an expander is keyed by a name that is not a
     *         registered language-level function
     */
    public ExpressionTranslator(QueryContext context, CallRewriter rewriter,
                                Map<String, LanguageFunctionExpander> expanders) {
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.rewriter = Objects.requireNonNull(rewriter, "rewriter must not be null");
        Objects.requireNonNull(expanders, "expanders must not be null");
        for (String name : expanders.keySet()) {
            if (!FunctionRegistry.languageFunctionNames().contains(name)) {
                throw new IllegalArgumentException("Not a language-level function: " + name);
            }
        }
        this.expanders = Map.copyOf(expanders);
    }

    public QueryContext context() {
        return context;
    }

    /**
     * Translates an expression tree.
     *
     * @param expression the HogQL expression
     * @return the equivalent ClickHouse expression
     * @throws QueryCompilationException if any part of the tree cannot be compiled
     */
    public Expression translate(Expression expression) {
        Objects.requireNonNull(expression, "expression must not be null");

        if (expression instanceof Constant || expression instanceof FieldReference) {
            return expression;
        }
        if (expression instanceof Alias) {
            Alias alias = (Alias) expression;
            ReservedVocabulary.validateAlias(alias.alias());
            return new Alias(translate(alias.expression()), alias.alias());
        }
        if (expression instanceof Call) {
            return translateCall((Call) expression);
        }
        throw new QueryCompilationException(
            "Unsupported expression type: " + expression.getClass().getSimpleName(), expression.toSQL());
    }

    /**
     * Translates an expression tree and renders it as ClickHouse SQL.
     *
     * @param expression the HogQL expression
     * @return the ClickHouse SQL text
     * @throws QueryCompilationException if any part of the tree cannot be compiled
     */
    public String generate(Expression expression) {
        String sql = translate(expression).toSQL();
        logger.debug("Translated {} to {}", expression, sql);
        return sql;
    }

    private Expression translateCall(Call call) {
        String name = call.name();

        if (call.distinct() && FunctionRegistry.isSupported(name) && !FunctionRegistry.isAggregate(name)) {
            throw new QueryCompilationException(
                "DISTINCT is only allowed in aggregate functions, not in '" + name + "'", call.toSQL());
        }

        Optional<FunctionSignature> function = FunctionRegistry.resolve(name);
        if (function.isPresent()) {
            return rewriter.rewrite(function.get(), translateAll(call.arguments()), context.timezone()).toCall();
        }

        Optional<AggregateSignature> aggregate = FunctionRegistry.resolveAggregate(name);
        if (aggregate.isPresent()) {
            return rewriter.rewriteAggregate(aggregate.get(), translateAll(call.arguments()), call.distinct());
        }

        Optional<LanguageFunctionSignature> languageFunction = FunctionRegistry.resolveLanguageLevelFunction(name);
        if (languageFunction.isPresent()) {
            CallRewriter.checkArity(name, languageFunction.get().arity(), call.argumentCount());
            LanguageFunctionExpander expander = expanders.get(name);
            if (expander == null) {
                throw new QueryCompilationException(
                    "Function '" + name + "' must be expanded before it can be sent to ClickHouse", call.toSQL());
            }
            Expression expanded = Objects.requireNonNull(
                expander.expand(call.arguments(), context), "expander returned null for " + name);
            logger.debug("Expanded {} into {}", call, expanded);
            return translate(expanded);
        }

        throw new UnknownFunctionException(name);
    }

    private List<Expression> translateAll(List<Expression> arguments) {
        List<Expression> translated = new ArrayList<>(arguments.size());
        for (Expression argument : arguments) {
            translated.add(translate(argument));
        }
        return translated;
    }
}
