package org.netcoord.runtime.telemetry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.netcoord.runtime.model.TelemetryRecord;
import org.netcoord.runtime.spi.ITelemetrySink;

/**
 * Keeps every record in memory. Intended for tests and embedding.
 */
public class InMemoryTelemetrySink implements ITelemetrySink {

    private final List<TelemetryRecord> records = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void accept(TelemetryRecord record) {
        records.add(record);
    }

    /**
     * @return Snapshot of the received records in arrival order.
     */
    public List<TelemetryRecord> getRecords() {
        synchronized (records) {
            return List.copyOf(records);
        }
    }

    public void clear() {
        records.clear();
    }
}
