package io.storyloom.core.workflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Typed read access to a node's opaque config map.
///
/// Values written by the editor are loosely typed: numbers may arrive as strings and
/// booleans as `"true"`. Accessors coerce where the intent is unambiguous and fall back
/// to the supplied default otherwise. Unknown keys are ignored.
public final class NodeConfig {

    private final Map<String, Object> values;

    public NodeConfig(Map<String, Object> values) {
        this.values = Objects.requireNonNull(values, "values must not be null");
    }

    public static NodeConfig of(Map<String, Object> values) {
        return new NodeConfig(values);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean has(String key) {
        Object value = values.get(key);
        return value != null && !(value instanceof String s && s.isEmpty());
    }

    public Object get(String key) {
        return values.get(key);
    }

    /// Returns the string value, or null when absent.
    public String getString(String key) {
        Object value = values.get(key);
        return value != null ? value.toString() : null;
    }

    /// Returns the string value, or `defaultValue` when absent or empty.
    public String getString(String key, String defaultValue) {
        String value = getString(key);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    public int getInt(String key, int defaultValue) {
        Object value = values.get(key);
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return (int) Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /// Returns the integer value, or null when absent or not numeric.
    public Integer getInteger(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        int sentinel = Integer.MIN_VALUE;
        int parsed = getInt(key, sentinel);
        return parsed == sentinel ? null : parsed;
    }

    /// Returns the decimal value, or null when absent or not numeric.
    public Double getDouble(String key) {
        Object value = values.get(key);
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s && !s.isBlank()) {
            return Boolean.parseBoolean(s.trim());
        }
        return defaultValue;
    }

    /// Returns list elements converted to strings, skipping nulls.
    ///
    /// @return list of strings, empty when absent or not a list
    public List<String> getStringList(String key) {
        Object value = values.get(key);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<String> result = new ArrayList<>(list.size());
        for (Object element : list) {
            if (element != null) {
                result.add(element.toString());
            }
        }
        return Collections.unmodifiableList(result);
    }

    /// Returns list elements that are maps, each wrapped as a nested config.
    ///
    /// @return nested configs, empty when absent or not a list
    @SuppressWarnings("unchecked")
    public List<NodeConfig> getConfigList(String key) {
        Object value = values.get(key);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<NodeConfig> result = new ArrayList<>(list.size());
        for (Object element : list) {
            if (element instanceof Map<?, ?> map) {
                result.add(new NodeConfig((Map<String, Object>) map));
            }
        }
        return Collections.unmodifiableList(result);
    }

    /// Returns a nested map value wrapped as a config.
    ///
    /// @return nested config, empty when absent or not a map
    @SuppressWarnings("unchecked")
    public NodeConfig getConfig(String key) {
        Object value = values.get(key);
        if (value instanceof Map<?, ?> map) {
            return new NodeConfig((Map<String, Object>) map);
        }
        return new NodeConfig(Map.of());
    }
}
