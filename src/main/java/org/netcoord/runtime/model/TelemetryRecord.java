package org.netcoord.runtime.model;

import java.util.Map;

/**
 * Per-tick record handed to the external telemetry sink.
 *
 * @param stepIndex Zero-based tick index.
 * @param planSummary {@link Plan#summary()} of the committed plan.
 * @param observationSnapshot Merged observations after the step.
 * @param rewards Merged rewards after the step, never {@code null}.
 * @param done Whether the composite environment reported completion.
 */
public record TelemetryRecord(
        long stepIndex,
        String planSummary,
        Map<String, Observation> observationSnapshot,
        Map<String, Double> rewards,
        boolean done
) {

    public static TelemetryRecord of(StepRecord record) {
        Transition transition = record.transition();
        return new TelemetryRecord(
                record.step(),
                record.plan().summary(),
                transition.observations(),
                transition.rewards(),
                transition.done());
    }
}
