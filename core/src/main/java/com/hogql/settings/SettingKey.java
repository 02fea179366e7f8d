package com.hogql.settings;

import com.hogql.exception.InvalidSettingValueException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Optional;

/**
 * The closed schema of ClickHouse settings a HogQL query may carry.
 *
 * <p>Each key has a default and a constraint on the values it accepts. Keys outside this
 * enum are rejected; nothing is passed through to ClickHouse unchecked.
 */
public enum SettingKey {

    /**
     * ClickHouse {@code readonly} level: 0 allows writes, 1 forbids writes and setting
     * changes, 2 forbids writes but allows setting changes.
     */
    READONLY("readonly", 2) {
        @Override
        void check(long value, Object raw) {
            if (value < 0 || value > 2) {
                throw new InvalidSettingValueException(key(), raw, "must be 0, 1 or 2");
            }
        }
    },

    /**
     * Maximum query execution time in seconds.
     */
    MAX_EXECUTION_TIME("max_execution_time", 60) {
        @Override
        void check(long value, Object raw) {
            long ceiling = SettingsConfig.maxExecutionTimeCeiling();
            if (value < 1 || value > ceiling) {
                throw new InvalidSettingValueException(key(), raw, "must be between 1 and " + ceiling + " seconds");
            }
        }
    };

    private final String key;
    private final int defaultValue;

    SettingKey(String key, int defaultValue) {
        this.key = key;
        this.defaultValue = defaultValue;
    }

    /**
     * Returns the ClickHouse name of this setting.
     */
    public String key() {
        return key;
    }

    public int defaultValue() {
        return defaultValue;
    }

    /**
     * Looks up a setting by its ClickHouse name.
     *
     * @param key the setting name (case-sensitive)
     * @return the setting, or empty if the name is not in the schema
     */
    public static Optional<SettingKey> fromKey(String key) {
        return Arrays.stream(values())
            .filter(s -> s.key.equals(key))
            .findFirst();
    }

    /**
     * Converts and validates a requested value.
     *
     * <p>Integral numbers, including whole floating-point and decimal values such as
     * {@code 2.0}, and decimal-integer strings are accepted. Booleans, fractions, nulls and
     * other types are rejected.
     *
     * @param raw the value as submitted
     * @return the validated value
     * @throws InvalidSettingValueException if the value is not an acceptable integer
     */
    public int validate(Object raw) {
        long value = toLong(raw);
        check(value, raw);
        return (int) value;
    }

    abstract void check(long value, Object raw);

    private long toLong(Object raw) {
        if (raw instanceof Byte || raw instanceof Short || raw instanceof Integer || raw instanceof Long) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof BigInteger) {
            try {
                return ((BigInteger) raw).longValueExact();
            } catch (ArithmeticException e) {
                throw new InvalidSettingValueException(key, raw, "must be an integer");
            }
        }
        if (raw instanceof Double || raw instanceof Float) {
            double d = ((Number) raw).doubleValue();
            if (Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) < 0x1p63) {
                return (long) d;
            }
            throw new InvalidSettingValueException(key, raw, "must be an integer");
        }
        if (raw instanceof BigDecimal) {
            try {
                return ((BigDecimal) raw).longValueExact();
            } catch (ArithmeticException e) {
                throw new InvalidSettingValueException(key, raw, "must be an integer");
            }
        }
        if (raw instanceof String) {
            try {
                return Long.parseLong(((String) raw).trim());
            } catch (NumberFormatException e) {
                throw new InvalidSettingValueException(key, raw, "must be an integer");
            }
        }
        throw new InvalidSettingValueException(key, raw, "must be an integer");
    }
}
