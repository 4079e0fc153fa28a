package org.netcoord.runtime.coordination;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.netcoord.runtime.model.Action;
import org.netcoord.runtime.model.Observation;
import org.netcoord.runtime.model.Plan;
import org.netcoord.runtime.model.ProposalResult;
import org.netcoord.runtime.registry.CapabilityRegistry;
import org.netcoord.runtime.spi.IAgent;
import org.netcoord.runtime.spi.IRankingPolicy;
import org.netcoord.runtime.spi.ITool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the merged observation of a step into a {@link Plan}.
 * <p>
 * Every registered agent is asked for a proposal. Only agents that are both observed and eligible
 * (their delegate takes an action this step) can win or receive an action; every other agent
 * abstains. Among the eligible, the successful proposals are ranked and the best one is
 * committed, the rest receive the default action. A failing agent is excluded from ranking for
 * that step but still receives the default action.
 * <p>
 * When an optimizer tool is configured it is called once per step with the ranked utilities; its
 * result lands in the plan telemetry under {@value #TELEMETRY_OPTIMIZER}. A failing tool is logged
 * and the step goes on without it.
 * <p>
 * The coordinator does not mutate agent state. Agent order is the registry's enumeration order,
 * read once at construction.
 */
public class Coordinator implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(Coordinator.class);

    public static final String TELEMETRY_SELECTED = "selected";
    public static final String TELEMETRY_SCORE = "score";
    public static final String TELEMETRY_RANKING = "ranking";
    public static final String TELEMETRY_UTILITIES = "utilities";
    public static final String TELEMETRY_FAILURES = "failures";
    public static final String TELEMETRY_OPTIMIZER = "optimizer";

    private final List<IAgent> agents;
    private final IRankingPolicy rankingPolicy;
    private final Action defaultAction;
    private final ProposalCollector collector;
    private final ITool optimizerTool;

    public Coordinator(CapabilityRegistry registry, IRankingPolicy rankingPolicy, Action defaultAction,
                       ProposalCollector collector) {
        this(registry, rankingPolicy, defaultAction, collector, null);
    }

    /**
     * @param registry Registry whose agents take part, in {@link CapabilityRegistry#listAgents()} order.
     * @param rankingPolicy Policy ordering successful proposals.
     * @param defaultAction Action dispatched to non-winning agents.
     * @param collector Collector used to gather proposals; closed with this coordinator.
     * @param optimizerTool Tool called with the step's utilities, or {@code null}.
     */
    public Coordinator(CapabilityRegistry registry, IRankingPolicy rankingPolicy, Action defaultAction,
                       ProposalCollector collector, ITool optimizerTool) {
        List<IAgent> resolved = new ArrayList<>();
        for (String agentId : registry.listAgents()) {
            resolved.add(registry.agent(agentId));
        }
        this.agents = List.copyOf(resolved);
        this.rankingPolicy = rankingPolicy;
        this.defaultAction = defaultAction == null ? Action.noop() : defaultAction;
        this.collector = collector;
        this.optimizerTool = optimizerTool;
    }

    /**
     * Sequential coordinator with the max-utility policy and no-op defaults.
     */
    public Coordinator(CapabilityRegistry registry) {
        this(registry, new MaxUtilityRankingPolicy(), Action.noop(), new ProposalCollector(1));
    }

    /**
     * Builds the plan for one step, treating every observed agent as eligible.
     *
     * @param observations Merged observation keyed by agent id.
     * @return The committed plan; all-default when no agent produced a usable proposal.
     */
    public Plan step(Map<String, Observation> observations) {
        return step(observations, observations.keySet());
    }

    /**
     * Builds the plan for one step.
     *
     * @param observations Merged observation keyed by agent id.
     * @param eligibleAgentIds Agents whose delegate takes an action this step. Agents outside
     *                         this set or absent from {@code observations} are neither ranked
     *                         nor given an action.
     * @return The committed plan; its action keys are always a subset of the observed ids.
     */
    public Plan step(Map<String, Observation> observations, Set<String> eligibleAgentIds) {
        List<ProposalResult> results = collector.collect(agents, observations);

        List<ProposalResult.Success> successes = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (ProposalResult result : results) {
            if (!isDispatchable(result.agentId(), observations, eligibleAgentIds)) {
                LOG.debug("Agent '{}' is not observed or not eligible this step; it abstains", result.agentId());
            } else if (result instanceof ProposalResult.Success success) {
                successes.add(success);
            } else if (result instanceof ProposalResult.Failure failure) {
                failures.put(failure.agentId(), failure.cause().getMessage());
            }
        }

        List<IRankingPolicy.Ranked> ranking = rankingPolicy.rank(successes);
        IRankingPolicy.Ranked winner = ranking.isEmpty() ? null : ranking.get(0);
        String selected = winner == null ? null : winner.result().agentId();

        Map<String, Action> actions = new LinkedHashMap<>();
        for (IAgent agent : agents) {
            String agentId = agent.id();
            if (agentId.equals(selected)) {
                actions.put(agentId, winner.result().proposal().action());
            } else if (isDispatchable(agentId, observations, eligibleAgentIds)) {
                actions.put(agentId, defaultAction);
            }
        }

        List<String> rankedIds = new ArrayList<>(ranking.size());
        Map<String, Double> utilities = new LinkedHashMap<>();
        for (IRankingPolicy.Ranked ranked : ranking) {
            rankedIds.add(ranked.result().agentId());
        }
        for (ProposalResult.Success success : successes) {
            utilities.put(success.agentId(), success.proposal().utility());
        }

        Map<String, Object> telemetry = new LinkedHashMap<>();
        telemetry.put(TELEMETRY_SELECTED, selected);
        telemetry.put(TELEMETRY_SCORE, winner == null ? null : winner.score());
        telemetry.put(TELEMETRY_RANKING, rankedIds);
        telemetry.put(TELEMETRY_UTILITIES, utilities);
        telemetry.put(TELEMETRY_FAILURES, failures);
        if (optimizerTool != null) {
            telemetry.put(TELEMETRY_OPTIMIZER, callOptimizer(utilities, selected));
        }

        if (selected == null) {
            LOG.debug("No usable proposal from {} agent(s); dispatching defaults", agents.size());
        } else {
            LOG.debug("Selected agent '{}' with score {} (ranking {})", selected, winner.score(), rankedIds);
        }
        return new Plan(selected == null ? List.of() : List.of(selected), actions, telemetry);
    }

    private static boolean isDispatchable(String agentId, Map<String, Observation> observations,
                                          Set<String> eligibleAgentIds) {
        return observations.containsKey(agentId) && eligibleAgentIds.contains(agentId);
    }

    private Map<String, Object> callOptimizer(Map<String, Double> utilities, String selected) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("utilities", Collections.unmodifiableMap(utilities));
        args.put("selected", selected);
        try {
            return optimizerTool.call(args);
        } catch (RuntimeException e) {
            LOG.warn("Optimizer tool '{}' failed: {}", optimizerTool.name(), e.getMessage());
            return null;
        }
    }

    /**
     * @return Participating agents in registry order.
     */
    public List<IAgent> getAgents() {
        return agents;
    }

    public IRankingPolicy getRankingPolicy() {
        return rankingPolicy;
    }

    /**
     * @return The configured optimizer tool, or {@code null}.
     */
    public ITool getOptimizerTool() {
        return optimizerTool;
    }

    @Override
    public void close() {
        collector.close();
    }
}
