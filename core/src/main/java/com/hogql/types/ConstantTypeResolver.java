package com.hogql.types;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.List;

/**
 * Classifies host Java values into {@link ConstantType}s.
 *
 * <p>Classification is structural:
 * <ul>
 *   <li>Integral numbers map to {@code int}, other numbers to {@code float}</li>
 *   <li>Strings and characters map to {@code str}</li>
 *   <li>{@link LocalDate} and {@link java.sql.Date} map to {@code date};
 *       {@link LocalDateTime}, {@link Instant}, {@link OffsetDateTime},
 *       {@link ZonedDateTime}, {@link Timestamp} and other {@link Date}s map to
 *       {@code datetime}</li>
 *   <li>{@link Time} carries no date and maps to {@code unknown}</li>
 *   <li>{@link List}s and Java arrays map to {@code array}, {@link Tuple}s to
 *       {@code tuple}</li>
 *   <li>Anything else maps to {@code unknown}</li>
 * </ul>
 *
 * <p>The resolver holds no state and is safe to call from any thread.
 */
public final class ConstantTypeResolver {

    private ConstantTypeResolver() {
        // Utility class - prevent instantiation
    }

    /**
     * Classifies a value.
     *
     * @param value the host value (may be null)
     * @return the constant kind; {@link ConstantType#UNKNOWN} for null or unrecognized values
     */
    public static ConstantType classify(Object value) {
        if (value == null) {
            return ConstantType.UNKNOWN;
        }
        if (value instanceof Boolean) {
            return ConstantType.BOOLEAN;
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer
                || value instanceof Long || value instanceof BigInteger) {
            return ConstantType.INTEGER;
        }
        if (value instanceof Float || value instanceof Double || value instanceof BigDecimal) {
            return ConstantType.FLOAT;
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return ConstantType.STRING;
        }
        if (value instanceof LocalDate || value instanceof java.sql.Date) {
            return ConstantType.DATE;
        }
        if (value instanceof Time) {
            return ConstantType.UNKNOWN;
        }
        if (value instanceof LocalDateTime || value instanceof Instant
                || value instanceof OffsetDateTime || value instanceof ZonedDateTime
                || value instanceof Date) {
            return ConstantType.DATETIME;
        }
        if (value instanceof java.util.UUID) {
            return ConstantType.UUID;
        }
        if (value instanceof Tuple) {
            return ConstantType.TUPLE;
        }
        if (value instanceof List || value.getClass().isArray()) {
            return ConstantType.ARRAY;
        }
        return ConstantType.UNKNOWN;
    }

    /**
     * Classifies a value together with its nullability.
     *
     * @param value the host value (may be null)
     * @return the resolved type; nullable {@code unknown} for null
     */
    public static ResolvedConstantType resolve(Object value) {
        if (value == null) {
            return ResolvedConstantType.nullableOf(ConstantType.UNKNOWN);
        }
        return ResolvedConstantType.of(classify(value));
    }

    /**
     * Returns whether a datetime value carries a sub-second component.
     *
     * <p>Values that are not datetimes never have one.
     *
     * @param value the host value
     * @return true if the value has non-zero fractional seconds
     */
    public static boolean hasFractionalSeconds(Object value) {
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).getNano() != 0;
        }
        if (value instanceof Instant) {
            return ((Instant) value).getNano() != 0;
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).getNano() != 0;
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).getNano() != 0;
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).getNanos() != 0;
        }
        if (value instanceof java.sql.Date || value instanceof Time) {
            return false;
        }
        if (value instanceof Date) {
            return ((Date) value).getTime() % 1000 != 0;
        }
        return false;
    }
}
