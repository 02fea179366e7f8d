package com.hogql.exception;

/**
 * Thrown when the settings requested for a query do not validate.
 *
 * <p>A settings failure rejects the whole query; settings are never partially applied.
 *
 * @see com.hogql.settings.QuerySettingsEnforcer
 */
public class SettingsValidationException extends QueryCompilationException {

    public SettingsValidationException(String message) {
        super(message);
    }

    public SettingsValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
