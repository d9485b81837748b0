package com.modelsentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for free-form {@code map<string, JSON value>} metadata.
 */
final class JsonValues {

    private JsonValues() {
        // utility class, not instantiable
    }

    /**
     * @return {@code true} for strings, finite numbers, booleans, {@code null},
     *         and lists or string-keyed maps of those
     */
    static boolean isJsonValue(Object v) {
        if (v == null || v instanceof String || v instanceof Boolean) {
            return true;
        }
        if (v instanceof Number n) {
            return Double.isFinite(n.doubleValue());
        }
        if (v instanceof List<?> list) {
            return list.stream().allMatch(JsonValues::isJsonValue);
        }
        if (v instanceof Map<?, ?> map) {
            return map.entrySet().stream()
                    .allMatch(e -> e.getKey() instanceof String && isJsonValue(e.getValue()));
        }
        return false;
    }

    /**
     * Unmodifiable deep copy of a metadata map. Nested lists and maps are
     * copied too, so later changes to the source never show through.
     */
    static Map<String, Object> immutableCopy(Map<String, Object> metadata) {
        Map<String, Object> copy = new LinkedHashMap<>();
        metadata.forEach((key, value) -> copy.put(key, copyValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object copyValue(Object value) {
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(copyValue(item)));
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((key, item) -> copy.put(key, copyValue(item)));
            return Collections.unmodifiableMap(copy);
        }
        return value;
    }
}
