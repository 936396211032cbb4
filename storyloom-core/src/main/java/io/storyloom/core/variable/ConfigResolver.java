package io.storyloom.core.variable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Applies template resolution to every string inside a node config.
///
/// Nested maps and lists are walked; numbers, booleans and nulls pass through unchanged.
/// Unknown keys are kept, so editor-only fields survive into the resolved config.
public class ConfigResolver {

    private final TemplateResolver templateResolver;

    public ConfigResolver(TemplateResolver templateResolver) {
        this.templateResolver =
                Objects.requireNonNull(templateResolver, "templateResolver must not be null");
    }

    /// Resolves a config against the current variables.
    ///
    /// @param config raw node config, not null
    /// @param store variable scope to resolve against, not null
    /// @return new map with the same keys in the same order, never null
    public Map<String, Object> resolve(Map<String, Object> config, VariableStore store) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        config.forEach((key, value) -> resolved.put(key, resolveValue(value, store)));
        return resolved;
    }

    @SuppressWarnings("unchecked")
    private Object resolveValue(Object value, VariableStore store) {
        if (value instanceof String text) {
            return templateResolver.resolve(text, store);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            ((Map<Object, Object>) map)
                    .forEach((k, v) -> nested.put(String.valueOf(k), resolveValue(v, store)));
            return nested;
        }
        if (value instanceof List<?> list) {
            List<Object> items = new ArrayList<>(list.size());
            for (Object item : list) {
                items.add(resolveValue(item, store));
            }
            return items;
        }
        return value;
    }
}
