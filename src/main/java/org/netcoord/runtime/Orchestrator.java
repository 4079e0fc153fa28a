package org.netcoord.runtime;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import org.netcoord.runtime.coordination.Coordinator;
import org.netcoord.runtime.environment.CompositeEnvironment;
import org.netcoord.runtime.model.Observation;
import org.netcoord.runtime.model.Plan;
import org.netcoord.runtime.model.StepRecord;
import org.netcoord.runtime.model.TelemetryRecord;
import org.netcoord.runtime.model.Transition;
import org.netcoord.runtime.spi.IAgent;
import org.netcoord.runtime.spi.ISimulator;
import org.netcoord.runtime.spi.ITelemetrySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the lockstep loop between the coordinator and the environment.
 * <p>
 * Each tick runs in a fixed order:
 * <ol>
 *   <li>the coordinator builds a plan from the latest observations, restricted to agents whose
 *       delegate is still active,</li>
 *   <li>the committed agent is notified through {@link IAgent#onCommitted(Plan)},</li>
 *   <li>the environment executes the plan's actions,</li>
 *   <li>the step is appended to the {@link RunState} history,</li>
 *   <li>a {@link TelemetryRecord} is handed to the sink,</li>
 *   <li>agents receive the transition as feedback.</li>
 * </ol>
 * The run completes when the environment reports {@code done}, when the step horizon is reached,
 * or when {@link #cancel()} is observed at a tick boundary. A delegate failure aborts the run;
 * agent proposal failures never do.
 * <p>
 * <strong>Thread Safety:</strong> {@link #run(long)} must be called from a single thread.
 * {@link #cancel()}, {@link #getStatus()} and {@link #getRunState()} may be called from any thread.
 */
public class Orchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(Orchestrator.class);

    private final ISimulator environment;
    private final Coordinator coordinator;
    private final ITelemetrySink telemetrySink;
    private final long seed;

    private final AtomicReference<RunStatus> status = new AtomicReference<>(RunStatus.IDLE);
    private final RunState runState = new RunState();
    private volatile boolean cancelRequested;
    private volatile RunResult lastResult;

    /**
     * @param environment The (usually composite) environment to drive.
     * @param coordinator Coordinator producing one plan per tick.
     * @param telemetrySink Receives one record per tick.
     * @param seed Seed passed to {@link ISimulator#reset(long)} at the start of each run.
     */
    public Orchestrator(ISimulator environment, Coordinator coordinator, ITelemetrySink telemetrySink, long seed) {
        this.environment = environment;
        this.coordinator = coordinator;
        this.telemetrySink = telemetrySink;
        this.seed = seed;
    }

    /**
     * Runs one episode to completion.
     *
     * @param maxSteps Step horizon; {@code 0} completes immediately.
     * @return The completion signal.
     * @throws IllegalStateException if the orchestrator is not {@link RunStatus#IDLE}.
     * @throws IllegalArgumentException if {@code maxSteps} is negative.
     */
    public RunResult run(long maxSteps) {
        if (maxSteps < 0) {
            throw new IllegalArgumentException("maxSteps must be >= 0, got " + maxSteps);
        }
        if (!status.compareAndSet(RunStatus.IDLE, RunStatus.RUNNING)) {
            throw new IllegalStateException("Cannot start a run in state " + status.get());
        }
        LOG.info("Run started: maxSteps={}, seed={}, agents={}", maxSteps, seed, coordinator.getAgents().size());

        try {
            runState.begin(environment.reset(seed));
            recordDelegateStates();
            while (true) {
                if (cancelRequested) {
                    return complete(CompletionReason.CANCELLED);
                }
                long stepIndex = runState.getStepIndex();
                if (stepIndex >= maxSteps) {
                    return complete(CompletionReason.HORIZON_EXHAUSTED);
                }

                Map<String, Observation> observations = runState.getLatestObservations();
                Plan plan = coordinator.step(observations, eligibleAgentIds(observations));
                notifyCommitted(plan);
                Transition transition = environment.step(plan.actions());
                StepRecord record = new StepRecord(stepIndex, plan, transition);
                runState.append(record);
                recordDelegateStates();
                publish(TelemetryRecord.of(record));
                deliverFeedback(transition);

                LOG.debug("Step {} finished: {} done={}", stepIndex, plan.summary(), transition.done());
                if (transition.done()) {
                    return complete(CompletionReason.DELEGATE_DONE);
                }
            }
        } catch (RuntimeException e) {
            return abort(e);
        }
    }

    /**
     * Requests cancellation; the loop stops at the next tick boundary. The history recorded so
     * far stays readable.
     */
    public void cancel() {
        cancelRequested = true;
    }

    /**
     * Returns a finished orchestrator to {@link RunStatus#IDLE} and clears its run state.
     *
     * @throws IllegalStateException while a run is in progress.
     */
    public void reset() {
        RunStatus current = status.get();
        if (current == RunStatus.RUNNING) {
            throw new IllegalStateException("Cannot reset while running");
        }
        runState.clear();
        cancelRequested = false;
        lastResult = null;
        status.set(RunStatus.IDLE);
    }

    public RunStatus getStatus() {
        return status.get();
    }

    public RunState getRunState() {
        return runState;
    }

    /**
     * @return The result of the latest finished run, or {@code null}.
     */
    public RunResult getLastResult() {
        return lastResult;
    }

    private void recordDelegateStates() {
        if (environment instanceof CompositeEnvironment composite) {
            runState.updateDelegateStates(composite.delegateStates());
        }
    }

    private Set<String> eligibleAgentIds(Map<String, Observation> observations) {
        if (environment instanceof CompositeEnvironment composite) {
            return composite.activeAgentIds();
        }
        return observations.keySet();
    }

    private void notifyCommitted(Plan plan) {
        for (IAgent agent : coordinator.getAgents()) {
            if (!plan.committedAgentIds().contains(agent.id())) {
                continue;
            }
            try {
                agent.onCommitted(plan);
            } catch (RuntimeException e) {
                LOG.warn("Agent '{}' failed to process its commit: {}", agent.id(), e.getMessage());
            }
        }
    }

    private void publish(TelemetryRecord record) {
        try {
            telemetrySink.accept(record);
        } catch (RuntimeException e) {
            LOG.warn("Telemetry sink rejected step {}: {}", record.stepIndex(), e.getMessage());
        }
    }

    private void deliverFeedback(Transition transition) {
        for (IAgent agent : coordinator.getAgents()) {
            try {
                agent.feedback(transition);
            } catch (RuntimeException e) {
                LOG.warn("Agent '{}' failed to process feedback: {}", agent.id(), e.getMessage());
            }
        }
    }

    private RunResult complete(CompletionReason reason) {
        RunResult result = RunResult.completed(reason, runState.getStepIndex());
        lastResult = result;
        status.set(RunStatus.COMPLETED);
        LOG.info("Run completed after {} step(s): {}", result.stepsExecuted(), reason);
        return result;
    }

    private RunResult abort(RuntimeException error) {
        RunResult result = RunResult.aborted(error, runState.getStepIndex());
        lastResult = result;
        status.set(RunStatus.ABORTED);
        LOG.error("Run aborted after {} step(s): {}", result.stepsExecuted(), error.getMessage());
        LOG.debug("Exception details:", error);
        return result;
    }
}
