package org.netcoord.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Assembles a scenario, runs it once and releases it.
 * <p>
 * A {@link ConfigurationException} during assembly is reported as an {@link RunStatus#ABORTED}
 * result with zero steps rather than thrown.
 */
public class ScenarioRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ScenarioRunner.class);

    /**
     * @param config Full application configuration containing the {@code netcoord} block.
     * @return The run's completion signal.
     */
    public RunResult run(Config config) {
        try (Scenario scenario = ScenarioAssembler.assembleFrom(config)) {
            return scenario.newOrchestrator().run(scenario.maxSteps());
        } catch (ConfigurationException e) {
            LOG.error("Scenario could not be assembled: {}", e.getMessage());
            LOG.debug("Exception details:", e);
            return RunResult.aborted(e, 0);
        }
    }
}
