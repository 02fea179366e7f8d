package com.hogql.exception;

/**
 * Thrown for a known settings key whose value violates its constraint.
 */
public class InvalidSettingValueException extends SettingsValidationException {

    private final String key;
    private final Object value;

    public InvalidSettingValueException(String key, Object value, String constraint) {
        super("Invalid value " + describe(value) + " for setting '" + key + "': " + constraint);
        this.key = key;
        this.value = value;
    }

    public String key() {
        return key;
    }

    /**
     * Returns the rejected value as submitted (may be null).
     */
    public Object value() {
        return value;
    }

    private static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence) {
            return "'" + value + "'";
        }
        return value.toString();
    }
}
