package org.netcoord.runtime.environment;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.netcoord.runtime.ConfigurationException;
import org.netcoord.runtime.model.Action;
import org.netcoord.runtime.model.DelegateSpec;
import org.netcoord.runtime.model.Observation;
import org.netcoord.runtime.model.Transition;
import org.netcoord.runtime.models.ModelResolver;
import org.netcoord.runtime.registry.CapabilityRegistry;
import org.netcoord.runtime.spi.IFadingModel;
import org.netcoord.runtime.spi.IFadingModelHost;
import org.netcoord.runtime.spi.IMobilityModel;
import org.netcoord.runtime.spi.IMobilityModelHost;
import org.netcoord.runtime.spi.ISimulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps one {@link ISimulator} behind the uniform delegate contract.
 * <p>
 * The wrapper adds no reordering of its own. It restricts actions to the delegate's agent ids,
 * tracks the {@link DelegateState} lifecycle and, once the simulator reports {@code done},
 * replays the last transition instead of invoking the simulator again (stale-hold).
 * <p>
 * When a step timeout is configured, each {@code step} call runs on a dedicated daemon thread and
 * an overrun is reported as {@link DelegateTimeoutException}.
 * <p>
 * Not thread-safe; driven by the orchestrator thread only.
 */
public class DelegateSimulator implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DelegateSimulator.class);

    private final String name;
    private final Set<String> agentIds;
    private final ISimulator simulator;
    private final OptionalLong seed;
    private final Optional<Duration> stepTimeout;
    private final DelegateFailurePolicy failurePolicy;
    private final Set<String> reportedForeignKeys = ConcurrentHashMap.newKeySet();

    private ExecutorService stepExecutor;
    private DelegateState state = DelegateState.ACTIVE;
    private long stepCount;
    private Transition lastTransition;

    public DelegateSimulator(String name, Set<String> agentIds, ISimulator simulator, OptionalLong seed,
                             Optional<Duration> stepTimeout, DelegateFailurePolicy failurePolicy) {
        this.name = name;
        this.agentIds = Set.copyOf(agentIds);
        this.simulator = simulator;
        this.seed = seed;
        this.stepTimeout = stepTimeout;
        this.failurePolicy = failurePolicy;
    }

    /**
     * Builds the simulator described by {@code spec} and injects its model overrides.
     *
     * @param spec The delegate's build instructions.
     * @param registry Registry used to locate the simulator class.
     * @param resolver Resolver for fading and mobility overrides.
     * @return The ready delegate; call {@link #reset(long)} before stepping.
     * @throws ConfigurationException if the simulator cannot be built or does not accept the
     *                                declared overrides.
     */
    public static DelegateSimulator create(DelegateSpec spec, CapabilityRegistry registry, ModelResolver resolver) {
        ISimulator simulator = registry.create(spec.className(),
                registry.getRandomProvider().deriveFor("delegate:" + spec.name(), 0),
                spec.options(), ISimulator.class);

        Map<String, IFadingModel> fading = resolver.resolveFadingOverrides(spec.fadingOverrides());
        if (!fading.isEmpty()) {
            if (!(simulator instanceof IFadingModelHost host)) {
                throw new ConfigurationException(String.format(
                        "Delegate '%s' declares fading models but %s does not accept them",
                        spec.name(), simulator.getClass().getName()));
            }
            fading.forEach(host::registerFadingModel);
        }

        Map<String, IMobilityModel> mobility = resolver.resolveMobilityOverrides(spec.mobilityOverrides());
        if (!mobility.isEmpty()) {
            if (!(simulator instanceof IMobilityModelHost host)) {
                throw new ConfigurationException(String.format(
                        "Delegate '%s' declares mobility models but %s does not accept them",
                        spec.name(), simulator.getClass().getName()));
            }
            mobility.forEach(host::registerMobilityModel);
        }

        LOG.info("Delegate '{}' built: simulator={}, agents={}, fadingModels={}, mobilityModels={}",
                spec.name(), simulator.getClass().getSimpleName(), spec.agentIds(),
                fading.keySet(), mobility.keySet());
        return new DelegateSimulator(spec.name(), spec.agentIds(), simulator, spec.seed(),
                spec.stepTimeout(), spec.failurePolicy());
    }

    /**
     * Starts a new episode.
     *
     * @param fallbackSeed Seed used when the delegate has no seed of its own.
     * @return The initial observations of the delegate's agents.
     * @throws DelegateStepException if the simulator fails to reset.
     */
    public Map<String, Observation> reset(long fallbackSeed) {
        long effectiveSeed = seed.orElse(fallbackSeed);
        Transition initial;
        try {
            initial = simulator.reset(effectiveSeed);
        } catch (RuntimeException e) {
            throw new DelegateStepException(name, 0, e);
        }
        state = DelegateState.ACTIVE;
        stepCount = 0;
        lastTransition = restrict(initial);
        LOG.debug("Delegate '{}' reset with seed {}", name, effectiveSeed);
        return lastTransition.observations();
    }

    /**
     * Advances the delegate by one step, or replays the held transition when it is no longer
     * active.
     *
     * @param actions Actions keyed by agent id; entries for other agents are ignored.
     * @return The delegate's transition for this step.
     * @throws IllegalStateException if called before {@link #reset(long)}.
     * @throws DelegateStepException if the simulator throws and the policy is {@code FAIL}.
     * @throws DelegateTimeoutException if the step overruns its deadline.
     */
    public Transition step(Map<String, Action> actions) {
        if (lastTransition == null) {
            throw new IllegalStateException("Delegate '" + name + "' must be reset before stepping");
        }
        switch (state) {
            case DONE -> {
                state = DelegateState.HELD;
                LOG.debug("Delegate '{}' finished, holding its last transition", name);
                return lastTransition;
            }
            case HELD, SKIPPED -> {
                return lastTransition;
            }
            default -> {
                // ACTIVE: invoke the simulator below
            }
        }

        Transition transition;
        try {
            transition = invoke(ownActions(actions));
        } catch (DelegateTimeoutException | DelegateStepException e) {
            throw e;
        } catch (RuntimeException e) {
            if (failurePolicy == DelegateFailurePolicy.SKIP) {
                LOG.error("Delegate '{}' failed at step {} ({}); skipping it for the rest of the episode",
                        name, stepCount, e.getMessage());
                LOG.debug("Exception details:", e);
                state = DelegateState.SKIPPED;
                return lastTransition;
            }
            throw new DelegateStepException(name, stepCount, e);
        }

        stepCount++;
        lastTransition = restrict(transition);
        if (lastTransition.done()) {
            state = DelegateState.DONE;
            LOG.debug("Delegate '{}' reported done after {} steps", name, stepCount);
        }
        return lastTransition;
    }

    public boolean isDone() {
        return state == DelegateState.DONE || state == DelegateState.HELD;
    }

    public DelegateState getState() {
        return state;
    }

    public String getName() {
        return name;
    }

    public Set<String> getAgentIds() {
        return agentIds;
    }

    /**
     * @return Number of steps the simulator has actually executed this episode.
     */
    public long getStepCount() {
        return stepCount;
    }

    /**
     * @return The latest transition (initial transition right after reset), or {@code null}
     *         before the first reset.
     */
    public Transition getLastTransition() {
        return lastTransition;
    }

    ISimulator getSimulator() {
        return simulator;
    }

    @Override
    public void close() {
        if (stepExecutor != null) {
            stepExecutor.shutdownNow();
            stepExecutor = null;
        }
    }

    private Map<String, Action> ownActions(Map<String, Action> actions) {
        Map<String, Action> own = new LinkedHashMap<>();
        for (String agentId : agentIds) {
            Action action = actions.get(agentId);
            if (action != null) {
                own.put(agentId, action);
            }
        }
        return own;
    }

    private Transition invoke(Map<String, Action> actions) {
        if (stepTimeout.isEmpty()) {
            return simulator.step(actions);
        }
        Duration deadline = stepTimeout.get();
        Future<Transition> future = executor().submit(() -> simulator.step(actions));
        try {
            return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new DelegateTimeoutException(name, stepCount, deadline);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new DelegateStepException(name, stepCount, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new DelegateStepException(name, stepCount, e);
        }
    }

    private ExecutorService executor() {
        if (stepExecutor == null) {
            stepExecutor = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable, "delegate-" + name);
                thread.setDaemon(true);
                return thread;
            });
        }
        return stepExecutor;
    }

    /**
     * Drops observation and reward entries for agents this delegate does not own, so that merged
     * keys stay unique across delegates.
     */
    private Transition restrict(Transition transition) {
        if (agentIds.containsAll(transition.observations().keySet())
                && agentIds.containsAll(transition.rewards().keySet())) {
            return transition;
        }
        Map<String, Observation> observations = new LinkedHashMap<>();
        transition.observations().forEach((agentId, observation) -> {
            if (agentIds.contains(agentId)) {
                observations.put(agentId, observation);
            } else {
                reportForeignKey(agentId);
            }
        });
        Map<String, Double> rewards = new LinkedHashMap<>();
        transition.rewards().forEach((agentId, reward) -> {
            if (agentIds.contains(agentId)) {
                rewards.put(agentId, reward);
            } else {
                reportForeignKey(agentId);
            }
        });
        return new Transition(observations, rewards, transition.done(), transition.info());
    }

    private void reportForeignKey(String agentId) {
        if (reportedForeignKeys.add(agentId)) {
            LOG.warn("Delegate '{}' reported agent '{}' which it does not declare; entry dropped", name, agentId);
        }
    }
}
