package com.hogql.generator;

import com.hogql.settings.QuerySettings;

import java.util.List;
import java.util.Objects;

/**
 * The output of {@link QueryCompiler}: translated select columns, the validated settings
 * and the effective row limit.
 *
 * @param columns the ClickHouse SQL of each select column, in input order
 * @param settings the validated settings to send with the query
 * @param limit the effective row limit
 */
public record CompiledQuery(List<String> columns, QuerySettings settings, long limit) {

    public CompiledQuery {
        columns = List.copyOf(Objects.requireNonNull(columns, "columns must not be null"));
        Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * Returns the select list, e.g. {@code count() AS total, event}.
     */
    public String selectList() {
        return String.join(", ", columns);
    }

    /**
     * Returns the limit clause, e.g. {@code LIMIT 100}.
     */
    public String limitClause() {
        return "LIMIT " + limit;
    }

    /**
     * Returns the settings clause, e.g. {@code SETTINGS readonly=2, max_execution_time=60}.
     */
    public String settingsClause() {
        return "SETTINGS " + settings.toSQL();
    }
}
