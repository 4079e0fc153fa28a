package org.netcoord.runtime.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An action addressed to one agent's slot in a simulator.
 * <p>
 * Parameters are opaque to the orchestration core; their meaning is defined by the simulator
 * that consumes them. An action without parameters is the hold (no-op) action.
 *
 * @param parameters Action parameters, copied into an unmodifiable map.
 */
public record Action(Map<String, Object> parameters) {

    private static final Action NOOP = new Action(Map.of());

    public Action {
        parameters = parameters == null || parameters.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /**
     * @return The shared hold action.
     */
    public static Action noop() {
        return NOOP;
    }

    public static Action of(String key, Object value) {
        return new Action(Map.of(key, value));
    }

    public boolean isNoop() {
        return parameters.isEmpty();
    }

    /**
     * Reads a numeric parameter.
     *
     * @param key Parameter name.
     * @param fallback Value returned when the parameter is absent or not a number.
     * @return The parameter as a double.
     */
    public double getDouble(String key, double fallback) {
        Object value = parameters.get(key);
        return value instanceof Number number ? number.doubleValue() : fallback;
    }
}
