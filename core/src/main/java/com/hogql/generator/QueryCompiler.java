package com.hogql.generator;

import com.hogql.exception.QueryCompilationException;
import com.hogql.expression.Expression;
import com.hogql.runtime.QueryLimits;
import com.hogql.settings.QuerySettings;
import com.hogql.settings.QuerySettingsEnforcer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Compiles the parts of a query this library owns: the select columns, the settings and
 * the row limit.
 *
 * <p>Settings are enforced first, once per query. If they fail, no column is translated.
 */
public final class QueryCompiler {

    private static final Logger logger = LoggerFactory.getLogger(QueryCompiler.class);

    private final ExpressionTranslator translator;

    public QueryCompiler(ExpressionTranslator translator) {
        this.translator = Objects.requireNonNull(translator, "translator must not be null");
    }

    /**
     * Compiles a query.
     *
     * @param columns the HogQL select columns
     * @param settingsRequest the settings submitted with the query (may be empty)
     * @param requestedLimit the LIMIT of the query, if any
     * @return the compiled query
     * @throws QueryCompilationException if the settings or any column fail to compile
     * @throws IllegalArgumentException if the requested limit is negative
     */
    public CompiledQuery compile(List<? extends Expression> columns, Map<String, ?> settingsRequest,
                                 OptionalLong requestedLimit) {
        Objects.requireNonNull(columns, "columns must not be null");
        if (columns.isEmpty()) {
            throw new QueryCompilationException("A query must select at least one column");
        }

        QuerySettings settings = QuerySettingsEnforcer.enforce(settingsRequest);

        List<String> sql = new ArrayList<>(columns.size());
        for (Expression column : columns) {
            sql.add(translator.generate(column));
        }

        long limit = QueryLimits.applyLimit(requestedLimit);
        logger.debug("Compiled {} columns for team {} with limit {}",
            sql.size(), translator.context().teamId(), limit);
        return new CompiledQuery(sql, settings, limit);
    }
}
