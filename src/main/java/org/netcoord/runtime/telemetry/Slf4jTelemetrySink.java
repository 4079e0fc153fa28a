package org.netcoord.runtime.telemetry;

import java.util.LinkedHashMap;
import java.util.Map;

import org.netcoord.runtime.model.Observation;
import org.netcoord.runtime.model.TelemetryRecord;
import org.netcoord.runtime.spi.ITelemetrySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Writes every telemetry record as one JSON line at INFO level.
 */
public class Slf4jTelemetrySink implements ITelemetrySink {

    private static final Logger LOG = LoggerFactory.getLogger(Slf4jTelemetrySink.class);

    private final Gson gson = new GsonBuilder()
            .serializeNulls()
            .serializeSpecialFloatingPointValues()
            .create();

    @Override
    public void accept(TelemetryRecord record) {
        if (LOG.isInfoEnabled()) {
            LOG.info(render(record));
        }
    }

    String render(TelemetryRecord record) {
        Map<String, Object> observations = new LinkedHashMap<>();
        for (Map.Entry<String, Observation> entry : record.observationSnapshot().entrySet()) {
            observations.put(entry.getKey(), entry.getValue().values());
        }
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("step", record.stepIndex());
        json.put("plan", record.planSummary());
        json.put("done", record.done());
        json.put("rewards", record.rewards());
        json.put("observations", observations);
        return gson.toJson(json);
    }
}
