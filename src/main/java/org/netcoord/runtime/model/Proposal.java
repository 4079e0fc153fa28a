package org.netcoord.runtime.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An agent's candidate action for the current step together with its own utility estimate.
 * Created by the agent and discarded by the coordinator within the same step.
 *
 * @param agentId The proposing agent.
 * @param action The candidate action for the agent's own slot.
 * @param utility Scalar utility estimate used for ranking.
 * @param metadata Optional extra data (for example metric estimates).
 */
public record Proposal(String agentId, Action action, double utility, Map<String, Object> metadata) {

    public Proposal {
        Objects.requireNonNull(agentId, "agentId");
        action = action == null ? Action.noop() : action;
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Proposal(String agentId, Action action, double utility) {
        this(agentId, action, utility, Map.of());
    }
}
