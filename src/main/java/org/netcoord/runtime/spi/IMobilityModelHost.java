package org.netcoord.runtime.spi;

/**
 * Implemented by simulators that accept per-agent mobility model overrides.
 */
public interface IMobilityModelHost {

    /**
     * Installs the mobility model for an agent, replacing any model already attached to it.
     *
     * @param agentId The agent to move.
     * @param model The model to use.
     */
    void registerMobilityModel(String agentId, IMobilityModel model);
}
