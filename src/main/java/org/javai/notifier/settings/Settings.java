package org.javai.notifier.settings;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The opaque key-value settings blob attached to a notification channel.
 *
 * <p>Instances are immutable. Lookups use get-if-present semantics through {@link #find(String)};
 * typed reads go through {@link SettingsAccessor}.
 *
 * <pre>{@code
 * Settings settings = Settings.fromJson("""
 *     {"url": "https://hooks.example.com", "uploadImage": "true", "retries": 3}
 *     """);
 *
 * boolean upload = SettingsAccessor.getBool(settings, "uploadImage", true).value();
 * }</pre>
 */
public final class Settings {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Settings EMPTY = new Settings(Map.of());

    private final Map<String, SettingValue> values;

    private Settings(Map<String, SettingValue> values) {
        this.values = values;
    }

    public static Settings empty() {
        return EMPTY;
    }

    /**
     * Creates settings from plain Java values.
     *
     * <p>Booleans, strings and numbers map to their matching {@link SettingValue} variant,
     * {@code null} maps to {@link SettingValue.NullValue}, and anything else (maps, lists,
     * arbitrary objects) is kept as a {@link SettingValue.StructuredValue}.
     *
     * @param raw the key-value pairs; keys must not be null
     * @return immutable settings
     */
    public static Settings of(Map<String, ?> raw) {
        Objects.requireNonNull(raw, "raw must not be null");
        Map<String, SettingValue> converted = new LinkedHashMap<>();
        raw.forEach((key, value) -> converted.put(
                Objects.requireNonNull(key, "setting keys must not be null"),
                fromJavaValue(value)));
        return new Settings(Collections.unmodifiableMap(converted));
    }

    /**
     * Parses settings from a JSON object.
     *
     * @param json the JSON text; must hold an object at its root
     * @return immutable settings
     * @throws JsonProcessingException if the text is not valid JSON
     * @throws IllegalArgumentException if the root is not a JSON object
     */
    public static Settings fromJson(String json) throws JsonProcessingException {
        Objects.requireNonNull(json, "json must not be null");
        if (json.isBlank()) {
            return EMPTY;
        }
        return fromJson(MAPPER.readTree(json));
    }

    /**
     * Builds settings from an already parsed JSON tree.
     */
    public static Settings fromJson(JsonNode node) {
        Objects.requireNonNull(node, "node must not be null");
        if (node.isNull() || node.isMissingNode()) {
            return EMPTY;
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("settings must be a JSON object, got: " + node.getNodeType());
        }
        Map<String, SettingValue> converted = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            converted.put(field.getKey(), fromJsonNode(field.getValue()));
        }
        return new Settings(Collections.unmodifiableMap(converted));
    }

    /**
     * Looks up a value if present.
     */
    public Optional<SettingValue> find(String key) {
        Objects.requireNonNull(key, "key must not be null");
        return Optional.ofNullable(values.get(key));
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Settings other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Settings" + values.keySet();
    }

    private static SettingValue fromJavaValue(Object value) {
        if (value == null) {
            return SettingValue.NullValue.instance();
        }
        if (value instanceof SettingValue settingValue) {
            return settingValue;
        }
        if (value instanceof Boolean b) {
            return SettingValue.of(b);
        }
        if (value instanceof String s) {
            return SettingValue.of(s);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return SettingValue.of(((Number) value).longValue());
        }
        if (value instanceof BigInteger big) {
            return big.bitLength() < 64 ? SettingValue.of(big.longValue()) : SettingValue.of(big.doubleValue());
        }
        if (value instanceof BigDecimal decimal) {
            return SettingValue.of(decimal.doubleValue());
        }
        if (value instanceof Double || value instanceof Float) {
            return SettingValue.of(((Number) value).doubleValue());
        }
        return new SettingValue.StructuredValue(value);
    }

    private static SettingValue fromJsonNode(JsonNode node) {
        if (node.isNull()) {
            return SettingValue.NullValue.instance();
        }
        if (node.isBoolean()) {
            return SettingValue.of(node.booleanValue());
        }
        if (node.isTextual()) {
            return SettingValue.of(node.textValue());
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? SettingValue.of(node.longValue()) : SettingValue.of(node.doubleValue());
        }
        if (node.isNumber()) {
            return SettingValue.of(node.doubleValue());
        }
        return new SettingValue.StructuredValue(node);
    }
}
