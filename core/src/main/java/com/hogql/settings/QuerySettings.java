package com.hogql.settings;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The validated settings sent with a compiled query.
 *
 * <p>Always complete: every key of {@link SettingKey} has a value. Instances are only
 * created by {@link QuerySettingsEnforcer}.
 */
public final class QuerySettings {

    private final int readonly;
    private final int maxExecutionTimeSeconds;

    QuerySettings(int readonly, int maxExecutionTimeSeconds) {
        this.readonly = readonly;
        this.maxExecutionTimeSeconds = maxExecutionTimeSeconds;
    }

    public int readonly() {
        return readonly;
    }

    public int maxExecutionTimeSeconds() {
        return maxExecutionTimeSeconds;
    }

    /**
     * Returns the value of a setting.
     *
     * @param key the setting
     * @return its value
     */
    public int get(SettingKey key) {
        switch (Objects.requireNonNull(key, "key must not be null")) {
            case READONLY:
                return readonly;
            case MAX_EXECUTION_TIME:
                return maxExecutionTimeSeconds;
            default:
                throw new IllegalArgumentException("Unhandled setting: " + key);
        }
    }

    /**
     * Returns all settings keyed by their ClickHouse names, in schema order.
     *
     * @return an ordered map of setting name to value
     */
    public Map<String, Integer> asMap() {
        Map<String, Integer> map = new LinkedHashMap<>();
        for (SettingKey key : SettingKey.values()) {
            map.put(key.key(), get(key));
        }
        return map;
    }

    /**
     * Renders the settings as the body of a ClickHouse {@code SETTINGS} clause.
     *
     * @return e.g. {@code readonly=2, max_execution_time=60}
     */
    public String toSQL() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Integer> entry : asMap().entrySet()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof QuerySettings)) return false;
        QuerySettings that = (QuerySettings) obj;
        return readonly == that.readonly && maxExecutionTimeSeconds == that.maxExecutionTimeSeconds;
    }

    @Override
    public int hashCode() {
        return Objects.hash(readonly, maxExecutionTimeSeconds);
    }

    @Override
    public String toString() {
        return "QuerySettings{" + toSQL() + "}";
    }
}
