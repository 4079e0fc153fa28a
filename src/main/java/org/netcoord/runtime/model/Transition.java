package org.netcoord.runtime.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The result of one simulator step: per-agent observations and rewards, the termination flag and
 * a free-form info payload. Produced once per step and read-only downstream.
 *
 * @param observations Observations keyed by agent id.
 * @param rewards Rewards keyed by agent id.
 * @param done Whether the producing simulator has finished its episode.
 * @param info Diagnostic payload; shape defined by the producer.
 */
public record Transition(
        Map<String, Observation> observations,
        Map<String, Double> rewards,
        boolean done,
        Map<String, Object> info
) {

    public Transition {
        observations = copy(observations);
        rewards = copy(rewards);
        info = copy(info);
    }

    private static <V> Map<String, V> copy(Map<String, V> source) {
        return source == null || source.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
