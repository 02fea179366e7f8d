package com.hogql.expression;

/**
 * Base interface for the AST nodes exchanged with the surrounding compiler.
 *
 * <p>The parser that produces these nodes and the planner that assembles full queries
 * live outside this library. The translation core only needs the node kinds that can
 * appear inside a function call:
 * <ul>
 *   <li>Constants ({@link Constant})</li>
 *   <li>Field references ({@link FieldReference})</li>
 *   <li>Function and aggregate calls ({@link Call})</li>
 *   <li>Aliased expressions ({@link Alias})</li>
 * </ul>
 *
 * <p>All implementations are immutable and may be shared between threads.
 */
public interface Expression {

    /**
     * Renders this expression as SQL text.
     *
     * <p>For an untranslated tree this is the HogQL text; for a translated tree it is the
     * ClickHouse text.
     *
     * @return the SQL string representation
     */
    String toSQL();
}
