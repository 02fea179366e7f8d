package com.hogql.settings;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hogql.exception.SettingsValidationException;
import com.hogql.exception.UnknownSettingKeyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Validates a caller's settings request against the closed {@link SettingKey} schema.
 *
 * <p>Every requested key must be in the schema and every value must satisfy its key's
 * constraint. Keys that are not requested take their defaults. The result is either a
 * complete {@link QuerySettings} or an exception; settings are never partially applied.
 *
 * <p>This is the only place where execution safety defaults ({@code readonly},
 * {@code max_execution_time}) may be changed.
 *
 * <p>Example usage:
 * <pre>
 *   QuerySettings settings = QuerySettingsEnforcer.enforce(Map.of("readonly", 0));
 *   settings.toSQL();  // readonly=0, max_execution_time=60
 * </pre>
 */
public final class QuerySettingsEnforcer {

    private static final Logger logger = LoggerFactory.getLogger(QuerySettingsEnforcer.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static final QuerySettings DEFAULTS = new QuerySettings(
        SettingKey.READONLY.defaultValue(),
        SettingKey.MAX_EXECUTION_TIME.defaultValue());

    private QuerySettingsEnforcer() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns the settings applied when a query requests none.
     *
     * @return readonly=2, max_execution_time=60
     */
    public static QuerySettings defaults() {
        return DEFAULTS;
    }

    /**
     * Validates and merges a settings request.
     *
     * @param requested the requested settings keyed by ClickHouse name (may be empty)
     * @return the complete, validated settings
     * @throws UnknownSettingKeyException if a key is not in the schema
     * @throws com.hogql.exception.InvalidSettingValueException if a value violates its constraint
     */
    public static QuerySettings enforce(Map<String, ?> requested) {
        Objects.requireNonNull(requested, "requested must not be null");
        if (requested.isEmpty()) {
            return DEFAULTS;
        }

        Map<SettingKey, Integer> values = new EnumMap<>(SettingKey.class);
        for (Map.Entry<String, ?> entry : requested.entrySet()) {
            SettingKey key = SettingKey.fromKey(entry.getKey())
                .orElseThrow(() -> new UnknownSettingKeyException(String.valueOf(entry.getKey())));
            values.put(key, key.validate(entry.getValue()));
        }

        QuerySettings settings = new QuerySettings(
            values.getOrDefault(SettingKey.READONLY, SettingKey.READONLY.defaultValue()),
            values.getOrDefault(SettingKey.MAX_EXECUTION_TIME, SettingKey.MAX_EXECUTION_TIME.defaultValue()));
        logger.debug("Overriding settings {}: {}", values.keySet(), settings);
        return settings;
    }

    /**
     * Validates and merges a settings request submitted as a JSON object.
     *
     * <p>Example: {@code {"readonly": 1, "max_execution_time": 120}}
     *
     * @param json the JSON object text; null or blank means no overrides
     * @return the complete, validated settings
     * @throws SettingsValidationException if the text is not a JSON object or a setting is invalid
     */
    public static QuerySettings enforceJson(String json) {
        if (json == null || json.isBlank()) {
            return DEFAULTS;
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SettingsValidationException("Failed to parse settings JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new SettingsValidationException("Settings must be a JSON object");
        }

        Map<String, Object> requested = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            requested.put(field.getKey(), toValue(field.getValue()));
        }
        return enforce(requested);
    }

    private static Object toValue(JsonNode node) {
        if (node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.bigIntegerValue();
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.toString();
    }
}
