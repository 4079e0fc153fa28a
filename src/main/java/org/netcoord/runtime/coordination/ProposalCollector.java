package org.netcoord.runtime.coordination;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.netcoord.runtime.model.Observation;
import org.netcoord.runtime.model.Proposal;
import org.netcoord.runtime.model.ProposalResult;
import org.netcoord.runtime.spi.IAgent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks every agent for its proposal and returns the outcomes in registry order.
 * <p>
 * Parallelism follows the runtime convention: {@code 0} = auto (available processors minus two,
 * at least one), {@code 1} = sequential on the calling thread, {@code N} = a fixed pool of N
 * daemon threads. Whatever the evaluation order, result {@code i} always belongs to agent
 * {@code i}.
 * <p>
 * Agent failures never escape: a throwing agent, a {@code null} proposal, a proposal carrying
 * another agent's id or a non-finite utility all become {@link ProposalResult.Failure}.
 */
public class ProposalCollector implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ProposalCollector.class);

    private final int effectiveParallelism;
    private final ExecutorService pool;

    /**
     * @param parallelism 0 = auto, 1 = sequential, N &gt; 1 = exactly N worker threads.
     * @throws IllegalArgumentException if {@code parallelism < 0}.
     */
    public ProposalCollector(int parallelism) {
        this.effectiveParallelism = resolveParallelism(parallelism);
        if (effectiveParallelism > 1) {
            AtomicInteger counter = new AtomicInteger();
            this.pool = Executors.newFixedThreadPool(effectiveParallelism, runnable -> {
                Thread thread = new Thread(runnable, "proposal-worker-" + counter.getAndIncrement());
                thread.setDaemon(true);
                return thread;
            });
        } else {
            this.pool = null;
        }
    }

    /**
     * @param agents Agents in registry order.
     * @param observations Merged observation of the current step.
     * @return One result per agent, at the agent's registry index.
     */
    public List<ProposalResult> collect(List<IAgent> agents, Map<String, Observation> observations) {
        if (pool == null || agents.size() < 2) {
            List<ProposalResult> results = new ArrayList<>(agents.size());
            for (int i = 0; i < agents.size(); i++) {
                IAgent agent = agents.get(i);
                results.add(evaluate(i, agent, observations.getOrDefault(agent.id(), Observation.empty())));
            }
            return results;
        }

        List<Callable<ProposalResult>> tasks = new ArrayList<>(agents.size());
        for (int i = 0; i < agents.size(); i++) {
            int index = i;
            IAgent agent = agents.get(i);
            Observation slice = observations.getOrDefault(agent.id(), Observation.empty());
            tasks.add(() -> evaluate(index, agent, slice));
        }

        try {
            List<Future<ProposalResult>> futures = pool.invokeAll(tasks);
            List<ProposalResult> results = new ArrayList<>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(futures.get(i), i, agents.get(i).id()));
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while collecting proposals", e);
        }
    }

    public int getEffectiveParallelism() {
        return effectiveParallelism;
    }

    @Override
    public void close() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    static ProposalResult evaluate(int index, IAgent agent, Observation observation) {
        String agentId = agent.id();
        Proposal proposal;
        try {
            proposal = agent.propose(observation);
        } catch (RuntimeException e) {
            return failure(index, agentId, new ProposalException(agentId,
                    "propose() threw " + e.getClass().getSimpleName() + ": " + e.getMessage(), e));
        }
        if (proposal == null) {
            return failure(index, agentId, new ProposalException(agentId, "propose() returned null"));
        }
        if (!agentId.equals(proposal.agentId())) {
            return failure(index, agentId, new ProposalException(agentId,
                    "proposal carries agent id '" + proposal.agentId() + "'"));
        }
        if (!Double.isFinite(proposal.utility())) {
            return failure(index, agentId, new ProposalException(agentId,
                    "proposal utility is not finite: " + proposal.utility()));
        }
        return new ProposalResult.Success(index, proposal);
    }

    private static ProposalResult failure(int index, String agentId, ProposalException cause) {
        LOG.warn("Agent '{}' excluded from ranking: {}", agentId, cause.getMessage());
        return new ProposalResult.Failure(index, agentId, cause);
    }

    private static ProposalResult await(Future<ProposalResult> future, int index, String agentId) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Error error) {
                throw error;
            }
            return failure(index, agentId, new ProposalException(agentId, String.valueOf(cause), cause));
        }
    }

    private static int resolveParallelism(int configured) {
        if (configured < 0) {
            throw new IllegalArgumentException("coordinator.parallelism must be >= 0, got " + configured);
        }
        if (configured == 0) {
            return Math.max(1, Runtime.getRuntime().availableProcessors() - 2);
        }
        return configured;
    }
}
