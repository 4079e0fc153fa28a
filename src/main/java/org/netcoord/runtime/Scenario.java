package org.netcoord.runtime;

import org.netcoord.runtime.coordination.Coordinator;
import org.netcoord.runtime.environment.CompositeEnvironment;
import org.netcoord.runtime.registry.CapabilityRegistry;
import org.netcoord.runtime.spi.ITelemetrySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Everything assembled from one scenario configuration.
 *
 * @param registry The build context the scenario was resolved with.
 * @param environment The composite environment.
 * @param coordinator The coordinator over the registered agents.
 * @param telemetrySink Sink receiving one record per tick.
 * @param maxSteps Step horizon.
 * @param seed Scenario seed.
 */
public record Scenario(
        CapabilityRegistry registry,
        CompositeEnvironment environment,
        Coordinator coordinator,
        ITelemetrySink telemetrySink,
        long maxSteps,
        long seed
) implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(Scenario.class);

    /**
     * @return A new orchestrator over this scenario's environment, coordinator and sink.
     */
    public Orchestrator newOrchestrator() {
        return new Orchestrator(environment, coordinator, telemetrySink, seed);
    }

    @Override
    public void close() {
        coordinator.close();
        environment.close();
        try {
            telemetrySink.close();
        } catch (RuntimeException e) {
            LOG.warn("Failed to close telemetry sink: {}", e.getMessage());
        }
    }
}
