package org.netcoord.runtime.spi;

import org.netcoord.runtime.model.Observation;
import org.netcoord.runtime.model.Plan;
import org.netcoord.runtime.model.Proposal;
import org.netcoord.runtime.model.Transition;

/**
 * An autonomous control agent that competes for the committed action each step.
 * <p>
 * {@link #propose(Observation)} may be called from a worker thread when the coordinator runs
 * with parallelism greater than one; it is never called concurrently for the same agent.
 */
public interface IAgent {

    /**
     * @return The agent id; must match the id the agent is registered under.
     */
    String id();

    /**
     * Produces this step's candidate action.
     *
     * @param observation The agent's own slice of the merged observation, or an empty
     *                    observation when the environment exposes nothing for it.
     * @return The proposal. Throwing excludes the agent from ranking for this step only.
     */
    Proposal propose(Observation observation);

    /**
     * Called before the environment steps when this agent's own proposal was committed. Agents
     * that lost the ranking are not notified. Default: ignored.
     *
     * @param plan The plan that carries this agent's action.
     */
    default void onCommitted(Plan plan) {
    }

    /**
     * Receives the merged transition after each step. Default: ignored.
     *
     * @param transition The transition produced by dispatching the committed plan.
     */
    default void feedback(Transition transition) {
    }
}
