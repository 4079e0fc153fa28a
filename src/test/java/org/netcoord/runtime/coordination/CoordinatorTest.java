package org.netcoord.runtime.coordination;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.netcoord.runtime.internal.services.SeededRandomProvider;
import org.netcoord.runtime.model.Action;
import org.netcoord.runtime.model.Observation;
import org.netcoord.runtime.model.Plan;
import org.netcoord.runtime.model.Proposal;
import org.netcoord.runtime.registry.CapabilityRegistry;
import org.netcoord.runtime.spi.IAgent;
import org.netcoord.runtime.spi.ITool;
import org.netcoord.tools.PowerAllocatorTool;
import org.netcoord.test.utils.ScriptedAgent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
@DisplayName("Coordinator")
class CoordinatorTest {

    private static final Observation OBS = new Observation(Map.of("SNR", 10.0));

    private CapabilityRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new CapabilityRegistry(new SeededRandomProvider(0L));
    }

    @Test
    @DisplayName("Commits the best proposal and defaults every other observed agent")
    void winnerAndDefaults() {
        registry.registerAgent(new ScriptedAgent("a1", 0.3));
        registry.registerAgent(new ScriptedAgent("a2", 0.8));
        registry.registerAgent(new ScriptedAgent("a3", 0.5));
        Action hold = Action.of("power", 1.0);
        Coordinator coordinator = new Coordinator(registry, new MaxUtilityRankingPolicy(), hold, new ProposalCollector(1));

        Plan plan = coordinator.step(Map.of("a1", OBS, "a2", OBS));

        assertThat(plan.selectedAgentId()).isEqualTo("a2");
        assertThat(plan.actions()).containsOnlyKeys("a1", "a2");
        assertThat(plan.actions().get("a2")).isEqualTo(Action.of("from", "a2"));
        assertThat(plan.actions().get("a1")).isEqualTo(hold);
        assertThat(plan.telemetry())
                .containsEntry(Coordinator.TELEMETRY_SELECTED, "a2")
                .containsEntry(Coordinator.TELEMETRY_SCORE, 0.8)
                .containsEntry(Coordinator.TELEMETRY_RANKING, List.of("a2", "a3", "a1"));
        assertThat(plan.summary()).isEqualTo("selected=a2 actions=2");
    }

    @Test
    @DisplayName("A failing agent is left out of the ranking but still gets the default action")
    void failingAgent_excludedButDefaulted() {
        registry.registerAgent(new ScriptedAgent("a1", 0.9).throwOnCall(1));
        registry.registerAgent(new ScriptedAgent("a2", 0.1));
        Coordinator coordinator = new Coordinator(registry);

        Plan plan = coordinator.step(Map.of("a1", OBS, "a2", OBS));

        assertThat(plan.selectedAgentId()).isEqualTo("a2");
        assertThat(plan.actions().get("a1")).isEqualTo(Action.noop());
        @SuppressWarnings("unchecked")
        Map<String, String> failures = (Map<String, String>) plan.telemetry().get(Coordinator.TELEMETRY_FAILURES);
        assertThat(failures).containsOnlyKeys("a1");
        assertThat((List<Object>) plan.telemetry().get(Coordinator.TELEMETRY_RANKING)).containsExactly("a2");
    }

    @Test
    @DisplayName("No usable proposal yields an all-default plan")
    void noSuccess_allDefaults() {
        registry.registerAgent(new ScriptedAgent("a1", 1.0).throwOnCall(1));
        registry.registerAgent(new ScriptedAgent("a2", call -> null));
        Coordinator coordinator = new Coordinator(registry);

        Plan plan = coordinator.step(Map.of("a1", OBS, "a2", OBS));

        assertThat(plan.selectedAgentId()).isNull();
        assertThat(plan.committedAgentIds()).isEmpty();
        assertThat(plan.actions()).containsOnlyKeys("a1", "a2").allSatisfy((id, action) -> assertThat(action.isNoop()).isTrue());
        assertThat(plan.telemetry()).containsEntry(Coordinator.TELEMETRY_SELECTED, null);
        assertThat(plan.summary()).isEqualTo("selected=<none> actions=2");
    }

    @Test
    @DisplayName("An unobserved agent abstains even with the best utility")
    void unobservedAgent_neverCommitted() {
        registry.registerAgent(new ScriptedAgent("a1", 0.3));
        registry.registerAgent(new ScriptedAgent("a2", 0.5));
        registry.registerAgent(new ScriptedAgent("a3", 0.9));
        Coordinator coordinator = new Coordinator(registry);
        Map<String, Observation> observed = Map.of("a1", OBS, "a2", OBS);

        Plan plan = coordinator.step(observed);

        assertThat(observed.keySet()).containsAll(plan.actions().keySet());
        assertThat(plan.selectedAgentId()).isEqualTo("a2");
        assertThat(plan.actions().get("a2")).isEqualTo(Action.of("from", "a2"));
        assertThat(plan.actions().get("a1")).isEqualTo(Action.noop());
        assertThat((List<Object>) plan.telemetry().get(Coordinator.TELEMETRY_RANKING)).containsExactly("a2", "a1");
    }

    @Test
    @DisplayName("Observed agents outside the eligible set are neither ranked nor dispatched")
    void ineligibleAgent_abstains() {
        registry.registerAgent(new ScriptedAgent("held", 9.0));
        registry.registerAgent(new ScriptedAgent("live", 1.0));
        Coordinator coordinator = new Coordinator(registry);

        Plan plan = coordinator.step(Map.of("held", OBS, "live", OBS), Set.of("live"));

        assertThat(plan.selectedAgentId()).isEqualTo("live");
        assertThat(plan.actions()).containsOnlyKeys("live");
        @SuppressWarnings("unchecked")
        Map<String, Double> utilities = (Map<String, Double>) plan.telemetry().get(Coordinator.TELEMETRY_UTILITIES);
        assertThat(utilities).containsOnlyKeys("live");
    }

    @Test
    @DisplayName("Equal utilities: the agent registered first wins")
    void tie_registryOrderWins() {
        registry.registerAgent(new ScriptedAgent("b", 1.0));
        registry.registerAgent(new ScriptedAgent("a", 1.0));
        Coordinator coordinator = new Coordinator(registry);

        for (int i = 0; i < 5; i++) {
            assertThat(coordinator.step(Map.of("a", OBS, "b", OBS)).selectedAgentId()).isEqualTo("b");
        }
    }

    @Test
    @DisplayName("The coordinator never feeds back to agents")
    void step_doesNotCallFeedback() {
        IAgent agent = mock(IAgent.class);
        when(agent.id()).thenReturn("m");
        when(agent.propose(any())).thenReturn(new Proposal("m", Action.noop(), 1.0));
        registry.registerAgent(agent);

        new Coordinator(registry).step(Map.of("m", OBS));

        verify(agent).propose(OBS);
        verify(agent, never()).feedback(any());
        verify(agent, never()).onCommitted(any());
    }

    @Nested
    @DisplayName("Optimizer tool")
    class OptimizerTool {

        @Test
        @DisplayName("Is called with the ranked utilities and its result lands in the telemetry")
        void resultInTelemetry() {
            registry.registerAgent(new ScriptedAgent("a1", 1.0));
            registry.registerAgent(new ScriptedAgent("a2", 3.0));
            ITool allocator = new PowerAllocatorTool(ConfigFactory.parseString("total_power = 8.0"));
            Coordinator coordinator = new Coordinator(registry, new MaxUtilityRankingPolicy(), Action.noop(),
                    new ProposalCollector(1), allocator);

            Plan plan = coordinator.step(Map.of("a1", OBS, "a2", OBS));

            assertThat(plan.selectedAgentId()).isEqualTo("a2");
            @SuppressWarnings("unchecked")
            Map<String, Object> optimizer = (Map<String, Object>) plan.telemetry().get(Coordinator.TELEMETRY_OPTIMIZER);
            assertThat(optimizer).containsEntry("total_power", 8.0);
            assertThat(optimizer.get("allocation")).isEqualTo(Map.of("a1", 2.0, "a2", 6.0));
        }

        @Test
        @DisplayName("A failing tool leaves the plan intact")
        void failureIsNotFatal() {
            registry.registerAgent(new ScriptedAgent("a1", 1.0));
            ITool broken = mock(ITool.class);
            when(broken.name()).thenReturn("broken");
            when(broken.call(any())).thenThrow(new IllegalStateException("solver diverged"));
            Coordinator coordinator = new Coordinator(registry, new MaxUtilityRankingPolicy(), Action.noop(),
                    new ProposalCollector(1), broken);

            Plan plan = coordinator.step(Map.of("a1", OBS));

            assertThat(plan.selectedAgentId()).isEqualTo("a1");
            assertThat(plan.telemetry()).containsEntry(Coordinator.TELEMETRY_OPTIMIZER, null);
            verify(broken).call(any());
        }

        @Test
        @DisplayName("Without a tool the telemetry carries no optimizer entry")
        void absentWithoutTool() {
            registry.registerAgent(new ScriptedAgent("a1", 1.0));

            Plan plan = new Coordinator(registry).step(Map.of("a1", OBS));

            assertThat(plan.telemetry()).doesNotContainKey(Coordinator.TELEMETRY_OPTIMIZER);
        }
    }
}
