package org.netcoord.runtime.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The coordinator's committed action bundle for one step.
 *
 * @param committedAgentIds Agents whose own proposals were committed (at most one with the
 *                          shipped ranking policies).
 * @param actions Action per agent to dispatch; agents without an entry abstain.
 * @param telemetry Ranking diagnostics.
 */
public record Plan(List<String> committedAgentIds, Map<String, Action> actions, Map<String, Object> telemetry) {

    public Plan {
        committedAgentIds = committedAgentIds == null ? List.of() : List.copyOf(committedAgentIds);
        actions = actions == null || actions.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(actions));
        telemetry = telemetry == null || telemetry.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(telemetry));
    }

    /**
     * @return The committed agent, or {@code null} when every agent was defaulted.
     */
    public String selectedAgentId() {
        return committedAgentIds.isEmpty() ? null : committedAgentIds.get(0);
    }

    /**
     * One-line human readable summary used in telemetry records and logs.
     *
     * @return e.g. {@code "selected=a1 actions=2"} or {@code "selected=<none> actions=2"}
     */
    public String summary() {
        String selected = committedAgentIds.isEmpty() ? "<none>" : String.join(",", committedAgentIds);
        return "selected=" + selected + " actions=" + actions.size();
    }
}
