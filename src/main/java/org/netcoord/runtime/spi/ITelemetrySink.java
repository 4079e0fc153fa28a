package org.netcoord.runtime.spi;

import org.netcoord.runtime.model.TelemetryRecord;

/**
 * Receives exactly one record per orchestrator tick, in step order.
 */
public interface ITelemetrySink extends AutoCloseable {

    void accept(TelemetryRecord record);

    /**
     * Flushes and releases the sink. Default: nothing to release.
     */
    @Override
    default void close() {
    }
}
