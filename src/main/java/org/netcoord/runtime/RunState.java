package org.netcoord.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.netcoord.runtime.environment.DelegateState;
import org.netcoord.runtime.model.Observation;
import org.netcoord.runtime.model.StepRecord;
import org.netcoord.runtime.model.Transition;

/**
 * Mutable state of one run, owned by the {@link Orchestrator}.
 * <p>
 * Written by the orchestrator thread only. Readers on other threads see a consistent history
 * because appends and reads are synchronized; history entries are immutable.
 */
public class RunState {

    private final List<StepRecord> history = new ArrayList<>();
    private final Map<String, DelegateState> delegateStates = new LinkedHashMap<>();
    private Transition initialTransition;
    private Transition lastTransition;

    synchronized void begin(Transition initial) {
        history.clear();
        initialTransition = initial;
        lastTransition = initial;
    }

    synchronized void append(StepRecord record) {
        history.add(record);
        lastTransition = record.transition();
    }

    synchronized void updateDelegateStates(Map<String, DelegateState> states) {
        delegateStates.clear();
        delegateStates.putAll(states);
    }

    synchronized void clear() {
        history.clear();
        delegateStates.clear();
        initialTransition = null;
        lastTransition = null;
    }

    /**
     * @return Index of the next tick, equal to the number of recorded ticks.
     */
    public synchronized long getStepIndex() {
        return history.size();
    }

    /**
     * @return Snapshot of the history in step order.
     */
    public synchronized List<StepRecord> getHistory() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }

    /**
     * @return Lifecycle state per delegate after the latest tick; empty when the environment is
     *         not composite.
     */
    public synchronized Map<String, DelegateState> getDelegateStates() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(delegateStates));
    }

    /**
     * @return The transition returned by the environment reset, or {@code null} before a run.
     */
    public synchronized Transition getInitialTransition() {
        return initialTransition;
    }

    /**
     * @return The latest transition, or {@code null} before a run.
     */
    public synchronized Transition getLastTransition() {
        return lastTransition;
    }

    /**
     * @return Observations the next plan is built from.
     */
    public synchronized Map<String, Observation> getLatestObservations() {
        return lastTransition == null ? Map.of() : lastTransition.observations();
    }
}
