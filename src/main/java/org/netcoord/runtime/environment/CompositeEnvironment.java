package org.netcoord.runtime.environment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.netcoord.runtime.ConfigurationException;
import org.netcoord.runtime.model.Action;
import org.netcoord.runtime.model.DelegateSpec;
import org.netcoord.runtime.model.Observation;
import org.netcoord.runtime.model.Transition;
import org.netcoord.runtime.models.ModelResolver;
import org.netcoord.runtime.registry.CapabilityRegistry;
import org.netcoord.runtime.spi.ISimulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Presents several delegate simulators as one {@link ISimulator}.
 * <p>
 * Every step partitions the incoming actions by delegate, advances each delegate in configuration
 * order and merges the results. The merged transition is {@code done} as soon as any delegate is
 * done (first-done-wins). The merged {@code info} maps each delegate name to that delegate's own
 * info payload.
 * <p>
 * Agent ids must be disjoint across delegates; this is checked once when the composite is built.
 */
public class CompositeEnvironment implements ISimulator, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CompositeEnvironment.class);

    private final List<DelegateSimulator> delegates;
    private final Map<String, DelegateSimulator> ownerByAgent;
    private final long seed;

    /**
     * @param delegates Delegates in configuration order.
     * @param seed Seed used by {@link #reset()} and by delegates without a seed of their own.
     * @throws ConfigurationException on duplicate delegate names.
     * @throws AgentIdCollisionException when two delegates declare the same agent id.
     */
    public CompositeEnvironment(List<DelegateSimulator> delegates, long seed) {
        this.delegates = List.copyOf(delegates);
        this.seed = seed;

        Set<String> names = new HashSet<>();
        Map<String, DelegateSimulator> owners = new LinkedHashMap<>();
        for (DelegateSimulator delegate : this.delegates) {
            if (!names.add(delegate.getName())) {
                throw new ConfigurationException("Duplicate delegate name '" + delegate.getName() + "'");
            }
            for (String agentId : delegate.getAgentIds()) {
                DelegateSimulator previous = owners.putIfAbsent(agentId, delegate);
                if (previous != null) {
                    Set<String> overlap = new LinkedHashSet<>(previous.getAgentIds());
                    overlap.retainAll(delegate.getAgentIds());
                    throw new AgentIdCollisionException(previous.getName(), delegate.getName(), overlap);
                }
            }
        }
        this.ownerByAgent = Collections.unmodifiableMap(owners);
    }

    /**
     * Validates the specs, then builds one {@link DelegateSimulator} per spec.
     * <p>
     * Name and agent-id checks run before any simulator is constructed. If a later delegate fails
     * to build, the ones already built are closed.
     *
     * @param specs Delegate specs in configuration order.
     * @param registry Registry used to build simulators.
     * @param resolver Resolver for model overrides.
     * @param seed Composite seed.
     * @return The assembled environment; call {@link #reset()} before stepping.
     */
    public static CompositeEnvironment build(List<DelegateSpec> specs, CapabilityRegistry registry,
                                             ModelResolver resolver, long seed) {
        validate(specs);
        List<DelegateSimulator> built = new ArrayList<>(specs.size());
        try {
            for (DelegateSpec spec : specs) {
                built.add(DelegateSimulator.create(spec, registry, resolver));
            }
        } catch (RuntimeException e) {
            built.forEach(DelegateSimulator::close);
            throw e;
        }
        LOG.info("Composite environment assembled with {} delegate(s)", built.size());
        return new CompositeEnvironment(built, seed);
    }

    static void validate(List<DelegateSpec> specs) {
        Set<String> names = new HashSet<>();
        Map<String, String> ownerByAgent = new LinkedHashMap<>();
        for (DelegateSpec spec : specs) {
            if (!names.add(spec.name())) {
                throw new ConfigurationException("Duplicate delegate name '" + spec.name() + "'");
            }
            Set<String> overlap = new LinkedHashSet<>();
            String firstOwner = null;
            for (String agentId : spec.agentIds()) {
                String owner = ownerByAgent.putIfAbsent(agentId, spec.name());
                if (owner != null) {
                    firstOwner = firstOwner == null ? owner : firstOwner;
                    if (owner.equals(firstOwner)) {
                        overlap.add(agentId);
                    }
                }
            }
            if (!overlap.isEmpty()) {
                throw new AgentIdCollisionException(firstOwner, spec.name(), overlap);
            }
        }
    }

    /**
     * Resets every delegate with this environment's seed.
     *
     * @return Merged initial observations.
     */
    public Map<String, Observation> reset() {
        return reset(seed).observations();
    }

    @Override
    public Transition reset(long seed) {
        List<Transition> initial = new ArrayList<>(delegates.size());
        for (DelegateSimulator delegate : delegates) {
            delegate.reset(seed);
            initial.add(delegate.getLastTransition());
        }
        LOG.debug("Composite environment reset with seed {}", seed);
        return merge(initial);
    }

    @Override
    public Transition step(Map<String, Action> actions) {
        for (String agentId : actions.keySet()) {
            if (!ownerByAgent.containsKey(agentId)) {
                LOG.debug("Ignoring action for agent '{}' which no delegate owns", agentId);
            }
        }
        List<Transition> transitions = new ArrayList<>(delegates.size());
        for (DelegateSimulator delegate : delegates) {
            transitions.add(delegate.step(actions));
        }
        return merge(transitions);
    }

    private Transition merge(List<Transition> transitions) {
        Map<String, Observation> observations = new LinkedHashMap<>();
        Map<String, Double> rewards = new LinkedHashMap<>();
        Map<String, Object> info = new LinkedHashMap<>();
        boolean done = false;
        for (int i = 0; i < transitions.size(); i++) {
            Transition transition = transitions.get(i);
            observations.putAll(transition.observations());
            rewards.putAll(transition.rewards());
            info.put(delegates.get(i).getName(), transition.info());
            done |= transition.done();
        }
        return new Transition(observations, rewards, done, info);
    }

    /**
     * @return Agent ids of delegates that are still {@link DelegateState#ACTIVE}, in
     *         configuration order.
     */
    public Set<String> activeAgentIds() {
        Set<String> active = new LinkedHashSet<>();
        for (DelegateSimulator delegate : delegates) {
            if (delegate.getState() == DelegateState.ACTIVE) {
                active.addAll(delegate.getAgentIds());
            }
        }
        return active;
    }

    public List<DelegateSimulator> delegates() {
        return delegates;
    }

    /**
     * @return Snapshot of each delegate's lifecycle state keyed by delegate name.
     */
    public Map<String, DelegateState> delegateStates() {
        Map<String, DelegateState> states = new LinkedHashMap<>();
        delegates.forEach(delegate -> states.put(delegate.getName(), delegate.getState()));
        return Collections.unmodifiableMap(states);
    }

    public long getSeed() {
        return seed;
    }

    @Override
    public void close() {
        delegates.forEach(DelegateSimulator::close);
    }
}
