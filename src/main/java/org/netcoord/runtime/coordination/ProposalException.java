package org.netcoord.runtime.coordination;

import org.netcoord.runtime.OrchestrationException;

/**
 * Describes why an agent's proposal was excluded from ranking for one step.
 * Never thrown out of the coordinator; it is carried inside a failed proposal result.
 */
public class ProposalException extends OrchestrationException {

    private final String agentId;

    public ProposalException(String agentId, String message) {
        super(message);
        this.agentId = agentId;
    }

    public ProposalException(String agentId, String message, Throwable cause) {
        super(message, cause);
        this.agentId = agentId;
    }

    public String getAgentId() {
        return agentId;
    }
}
