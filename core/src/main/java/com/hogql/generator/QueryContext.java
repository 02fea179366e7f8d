package com.hogql.generator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Per-query context supplied by the surrounding application.
 *
 * @param teamId the team the query runs for
 * @param timezone the team's timezone identifier, injected into timezone-aware functions
 */
public record QueryContext(long teamId, String timezone) {

    /** System property overriding the timezone used when a team has none configured */
    public static final String PROP_DEFAULT_TIMEZONE = "hogql.timezone.default";

    /** Timezone used when neither the team nor the JVM configuration sets one */
    public static final String DEFAULT_TIMEZONE = "UTC";

    private static final Logger logger = LoggerFactory.getLogger(QueryContext.class);

    /** Read once at class load; later property changes have no effect */
    private static final String CONFIGURED_TIMEZONE =
        configuredTimezone(System.getProperty(PROP_DEFAULT_TIMEZONE));

    public QueryContext {
        Objects.requireNonNull(timezone, "timezone must not be null");
        try {
            ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid timezone: " + timezone, e);
        }
    }

    /**
     * Creates a context with the default timezone.
     *
     * @param teamId the team the query runs for
     * @return the context
     */
    public static QueryContext forTeam(long teamId) {
        return new QueryContext(teamId, CONFIGURED_TIMEZONE);
    }

    /**
     * Resolves a configured default timezone.
     *
     * @param value the property value (may be null)
     * @return the value if it is a valid zone id, otherwise {@link #DEFAULT_TIMEZONE}
     */
    static String configuredTimezone(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_TIMEZONE;
        }
        try {
            ZoneId.of(value.trim());
            return value.trim();
        } catch (DateTimeException e) {
            logger.warn("Ignoring invalid {}={}", PROP_DEFAULT_TIMEZONE, value);
            return DEFAULT_TIMEZONE;
        }
    }
}
