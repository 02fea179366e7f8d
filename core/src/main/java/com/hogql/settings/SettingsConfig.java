package com.hogql.settings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JVM-level configuration for settings enforcement.
 *
 * <p>System properties are read once when the class is loaded, so the settings schema
 * does not change while the process runs. Malformed values fall back to the default.
 */
public final class SettingsConfig {

    private static final Logger logger = LoggerFactory.getLogger(SettingsConfig.class);

    /** System property for the largest accepted max_execution_time, in seconds */
    public static final String PROP_MAX_EXECUTION_TIME_CEILING = "hogql.settings.maxExecutionTimeCeiling";

    /** Default ceiling for max_execution_time: 10 minutes */
    public static final long DEFAULT_MAX_EXECUTION_TIME_CEILING = 600L;

    private static final long MAX_EXECUTION_TIME_CEILING =
        parseCeiling(System.getProperty(PROP_MAX_EXECUTION_TIME_CEILING));

    private SettingsConfig() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns the largest value accepted for {@code max_execution_time}.
     *
     * @return the ceiling in seconds, never below the setting's default
     */
    public static long maxExecutionTimeCeiling() {
        return MAX_EXECUTION_TIME_CEILING;
    }

    /**
     * Parses a configured ceiling.
     *
     * @param value the property value (may be null)
     * @return the ceiling, or the default if the value is absent, malformed or below the
     *         setting's default
     */
    static long parseCeiling(String value) {
        if (value == null) {
            return DEFAULT_MAX_EXECUTION_TIME_CEILING;
        }
        try {
            long ceiling = Long.parseLong(value.trim());
            if (ceiling >= SettingKey.MAX_EXECUTION_TIME.defaultValue()) {
                logger.info("Using {}={}", PROP_MAX_EXECUTION_TIME_CEILING, ceiling);
                return ceiling;
            }
            logger.warn("Ignoring {}={}: below the default of {} seconds",
                PROP_MAX_EXECUTION_TIME_CEILING, value, SettingKey.MAX_EXECUTION_TIME.defaultValue());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring malformed {}={}", PROP_MAX_EXECUTION_TIME_CEILING, value);
        }
        return DEFAULT_MAX_EXECUTION_TIME_CEILING;
    }
}
