package org.netcoord.runtime.spi;

import java.util.Map;

import org.netcoord.runtime.model.Action;
import org.netcoord.runtime.model.Transition;

/**
 * A steppable simulator driven in lockstep by the orchestrator.
 * <p>
 * Implementations loaded by class name must provide a public constructor with one of the
 * signatures {@code (IRandomProvider rng, com.typesafe.config.Config options)},
 * {@code (com.typesafe.config.Config options)} or {@code ()}.
 */
public interface ISimulator {

    /**
     * Starts a new episode.
     *
     * @param seed Seed for the episode.
     * @return The initial transition; its rewards are typically zero.
     */
    Transition reset(long seed);

    /**
     * Advances the simulator by one step.
     * <p>
     * Agents without an entry in {@code actions} follow the simulator's default no-op policy.
     *
     * @param actions Actions keyed by agent id; may be empty.
     * @return The resulting transition.
     */
    Transition step(Map<String, Action> actions);
}
