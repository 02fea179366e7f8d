package com.hogql.expression;

import com.hogql.generator.ClickHouseQuoting;
import com.hogql.types.ConstantType;
import com.hogql.types.ConstantTypeResolver;
import com.hogql.types.ResolvedConstantType;
import com.hogql.types.Tuple;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Expression representing a constant value.
 *
 * <p>The kind of the constant is derived from the host value by
 * {@link ConstantTypeResolver}. Examples in SQL:
 * <pre>
 *   42                                   -- int
 *   'hello'                              -- str
 *   true                                 -- bool
 *   null                                 -- unknown, nullable
 *   toDate('2024-01-15')                 -- date
 *   toDateTime('2024-01-15 10:00:00')    -- datetime
 *   [1, 2, 3]                            -- array
 *   tuple(1, 'a')                        -- tuple
 * </pre>
 *
 * <p>The keyword literals {@code true}, {@code false} and {@code null} render unchanged.
 */
public final class Constant implements Expression {

    private static final DateTimeFormatter SECONDS_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter MICROS_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");
    private static final DateTimeFormatter NANOS_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSSSSS");

    private final Object value;
    private final ResolvedConstantType type;

    private Constant(Object value) {
        this.value = value;
        this.type = ConstantTypeResolver.resolve(value);
    }

    /**
     * Creates a constant for a host value.
     *
     * @param value the value (may be null)
     * @return the constant expression
     */
    public static Constant of(Object value) {
        return new Constant(value);
    }

    /**
     * Creates a NULL constant.
     *
     * @return the null constant
     */
    public static Constant nullValue() {
        return new Constant(null);
    }

    /**
     * Returns the constant value.
     *
     * @return the value, or null for NULL constants
     */
    public Object value() {
        return value;
    }

    /**
     * Returns the kind of this constant.
     */
    public ConstantType constantType() {
        return type.type();
    }

    /**
     * Returns the kind of this constant with its nullability.
     */
    public ResolvedConstantType resolvedType() {
        return type;
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    public String toSQL() {
        return render(value);
    }

    private static String render(Object value) {
        if (value == null) {
            return "null";
        }

        switch (ConstantTypeResolver.classify(value)) {
            case BOOLEAN:
                return value.toString();
            case INTEGER:
                return value.toString();
            case FLOAT:
                return renderFloat(value);
            case STRING:
                return ClickHouseQuoting.quoteLiteral(value.toString());
            case DATE:
                return renderDate(value);
            case DATETIME:
                return renderDateTime(value);
            case UUID:
                return "toUUID(" + ClickHouseQuoting.quoteLiteral(value.toString()) + ")";
            case ARRAY:
                return renderElements("[", elementsOf(value), "]");
            case TUPLE:
                return renderElements("tuple(", ((Tuple) value).elements(), ")");
            default:
                // Unrecognized host values are accepted and sent as their string form
                return ClickHouseQuoting.quoteLiteral(value.toString());
        }
    }

    private static String renderFloat(Object value) {
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        double d = ((Number) value).doubleValue();
        if (Double.isNaN(d)) {
            return "nan";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "inf" : "-inf";
        }
        return value.toString();
    }

    private static String renderDate(Object value) {
        LocalDate date = value instanceof java.sql.Date ? ((java.sql.Date) value).toLocalDate() : (LocalDate) value;
        return "toDate(" + ClickHouseQuoting.quoteLiteral(date.toString()) + ")";
    }

    private static String renderDateTime(Object value) {
        LocalDateTime local;
        String zone;
        if (value instanceof LocalDateTime) {
            local = (LocalDateTime) value;
            zone = null;
        } else if (value instanceof ZonedDateTime) {
            ZonedDateTime zoned = (ZonedDateTime) value;
            local = zoned.toLocalDateTime();
            zone = zoned.getZone().getId();
        } else if (value instanceof OffsetDateTime) {
            local = LocalDateTime.ofInstant(((OffsetDateTime) value).toInstant(), ZoneOffset.UTC);
            zone = "UTC";
        } else if (value instanceof Instant) {
            local = LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC);
            zone = "UTC";
        } else if (value instanceof Timestamp) {
            local = LocalDateTime.ofInstant(((Timestamp) value).toInstant(), ZoneOffset.UTC);
            zone = "UTC";
        } else {
            local = LocalDateTime.ofInstant(Instant.ofEpochMilli(((Date) value).getTime()), ZoneOffset.UTC);
            zone = "UTC";
        }

        String zoneArg = zone == null ? "" : ", " + ClickHouseQuoting.quoteLiteral(zone);
        if (local.getNano() == 0) {
            return "toDateTime(" + ClickHouseQuoting.quoteLiteral(local.format(SECONDS_FORMAT)) + zoneArg + ")";
        }
        // DateTime64(6) unless the value has nanoseconds, which need scale 9
        if (local.getNano() % 1000 == 0) {
            return "toDateTime64(" + ClickHouseQuoting.quoteLiteral(local.format(MICROS_FORMAT)) + ", 6" + zoneArg + ")";
        }
        return "toDateTime64(" + ClickHouseQuoting.quoteLiteral(local.format(NANOS_FORMAT)) + ", 9" + zoneArg + ")";
    }

    private static List<Object> elementsOf(Object array) {
        if (array instanceof List) {
            return new ArrayList<>((List<?>) array);
        }
        int length = Array.getLength(array);
        List<Object> elements = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            elements.add(Array.get(array, i));
        }
        return elements;
    }

    private static String renderElements(String open, List<Object> elements, String close) {
        StringJoiner joiner = new StringJoiner(", ", open, close);
        for (Object element : elements) {
            joiner.add(render(element));
        }
        return joiner.toString();
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Constant)) return false;
        return Objects.deepEquals(value, ((Constant) obj).value);
    }

    @Override
    public int hashCode() {
        return value != null && value.getClass().isArray() ? 0 : Objects.hashCode(value);
    }
}
