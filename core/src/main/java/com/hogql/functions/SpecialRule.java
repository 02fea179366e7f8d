package com.hogql.functions;

/**
 * Rewrite rules attached to specific source function names.
 *
 * <p>Rules are applied by {@link CallRewriter} at rewrite time. They never change the
 * registry entry they are attached to.
 *
 * @see FunctionCategories
 */
public enum SpecialRule {

    /**
     * Append the query timezone as a trailing argument unless the caller supplied one.
     */
    ADD_TIMEZONE_ARG,

    /**
     * The target is the null-returning variant of a function that would otherwise throw
     * on invalid input. The rewriter refuses to emit a throwing variant.
     */
    PREFER_OR_NULL_VARIANT,

    /**
     * The first argument must be a whole-second {@code DateTime}, not a {@code DateTime64}.
     */
    FIRST_ARG_MUST_BE_NON_FRACTIONAL_DATETIME
}
