package org.netcoord.runtime.model;

/**
 * Outcome of asking one agent for a proposal during a step.
 * <p>
 * The {@code index} is the agent's position in registry enumeration order; ranking policies use
 * it to break ties, so it must never depend on the order in which proposals were evaluated.
 */
public sealed interface ProposalResult permits ProposalResult.Success, ProposalResult.Failure {

    int index();

    String agentId();

    /**
     * A usable proposal.
     *
     * @param index Registry enumeration index of the agent.
     * @param proposal The agent's proposal.
     */
    record Success(int index, Proposal proposal) implements ProposalResult {
        @Override
        public String agentId() {
            return proposal.agentId();
        }
    }

    /**
     * An agent that could not propose this step.
     *
     * @param index Registry enumeration index of the agent.
     * @param agentId The failing agent.
     * @param cause Why the agent was excluded.
     */
    record Failure(int index, String agentId, Throwable cause) implements ProposalResult {
    }
}
