package com.hogql.exception;

/**
 * Thrown for a settings key outside the closed schema.
 */
public class UnknownSettingKeyException extends SettingsValidationException {

    private final String key;

    public UnknownSettingKeyException(String key) {
        super("Unknown setting '" + key + "'");
        this.key = key;
    }

    public String key() {
        return key;
    }
}
