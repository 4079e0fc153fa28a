package org.netcoord.runtime.spi;

import java.util.Map;

/**
 * A stateless helper (solver, allocator, predictor) that the runtime invokes by name.
 * <p>
 * Tools are registered like any other capability and resolved once per scenario. A tool may be
 * called from the orchestrator thread only.
 */
public interface ITool {

    /**
     * @return Canonical tool name, used in logs.
     */
    String name();

    /**
     * Runs the tool.
     *
     * @param args Named inputs; values are plain Java types (numbers, strings, lists, maps).
     * @return The structured result, never {@code null}.
     * @throws IllegalArgumentException if a required input is missing or malformed.
     */
    Map<String, Object> call(Map<String, Object> args);
}
