package org.netcoord.runtime.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a single agent sees after a simulator step. Values are opaque to the core.
 *
 * @param values Observed quantities, copied into an unmodifiable map.
 */
public record Observation(Map<String, Object> values) {

    private static final Observation EMPTY = new Observation(Map.of());

    public Observation {
        values = values == null || values.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static Observation empty() {
        return EMPTY;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public double getDouble(String key, double fallback) {
        Object value = values.get(key);
        return value instanceof Number number ? number.doubleValue() : fallback;
    }
}
