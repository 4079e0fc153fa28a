package org.netcoord.runtime.model;

/**
 * One entry of the run history.
 *
 * @param step Zero-based tick index.
 * @param plan The plan committed for the tick.
 * @param transition The merged transition produced by dispatching the plan.
 */
public record StepRecord(long step, Plan plan, Transition transition) {
}
