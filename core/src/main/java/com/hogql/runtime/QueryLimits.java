package com.hogql.runtime;

import java.util.OptionalLong;

/**
 * Row caps applied to every compiled SELECT.
 *
 * <p>These limits are part of the contract with callers and cannot be changed per
 * request.
 */
public final class QueryLimits {

    private QueryLimits() {} // Utility class

    /** Limit applied to SELECT statements without a LIMIT clause */
    public static final long DEFAULT_RETURNED_ROWS = 100;

    /** Absolute maximum for any SELECT, and the default for exports */
    public static final long MAX_SELECT_RETURNED_ROWS = 10_000;

    /**
     * Returns the effective row limit for an interactive query.
     *
     * @param requested the LIMIT the query asked for, if any
     * @return {@link #DEFAULT_RETURNED_ROWS} when absent, otherwise the request capped at
     *         {@link #MAX_SELECT_RETURNED_ROWS}
     * @throws IllegalArgumentException if the requested limit is negative
     */
    public static long applyLimit(OptionalLong requested) {
        return normalize(requested, DEFAULT_RETURNED_ROWS);
    }

    /**
     * Returns the effective row limit for an export.
     *
     * @param requested the LIMIT the query asked for, if any
     * @return {@link #MAX_SELECT_RETURNED_ROWS} when absent, otherwise the request capped
     * @throws IllegalArgumentException if the requested limit is negative
     */
    public static long exportLimit(OptionalLong requested) {
        return normalize(requested, MAX_SELECT_RETURNED_ROWS);
    }

    private static long normalize(OptionalLong requested, long fallback) {
        if (requested == null || requested.isEmpty()) return fallback;
        long limit = requested.getAsLong();
        if (limit < 0) {
            throw new IllegalArgumentException("LIMIT must not be negative: " + limit);
        }
        return Math.min(limit, MAX_SELECT_RETURNED_ROWS);
    }
}
