package org.netcoord.runtime.spi;

import java.util.List;

import org.netcoord.runtime.model.ProposalResult;

/**
 * Orders the successful proposals of one step, best first.
 * <p>
 * Implementations must be deterministic and must depend only on the proposals and their
 * registry indices, never on the order of the input list.
 */
public interface IRankingPolicy {

    /**
     * A ranked proposal.
     *
     * @param result The successful proposal.
     * @param score The score the policy ranked it by.
     */
    record Ranked(ProposalResult.Success result, double score) {
    }

    /**
     * @param successes Successful proposals of the step, in any order.
     * @return The proposals ordered best first; empty when the input is empty.
     */
    List<Ranked> rank(List<ProposalResult.Success> successes);
}
