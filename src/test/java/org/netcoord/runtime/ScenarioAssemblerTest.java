package org.netcoord.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.netcoord.agents.SnrSeekingAgent;
import org.netcoord.runtime.coordination.Coordinator;
import org.netcoord.runtime.coordination.WeightedMetricRankingPolicy;
import org.netcoord.runtime.environment.AgentIdCollisionException;
import org.netcoord.runtime.environment.DelegateFailurePolicy;
import org.netcoord.runtime.environment.DelegateState;
import org.netcoord.runtime.model.DelegateSpec;
import org.netcoord.runtime.registry.ResolutionException;
import org.netcoord.runtime.registry.UnknownCapabilityException;
import org.netcoord.runtime.telemetry.InMemoryTelemetrySink;
import org.netcoord.runtime.telemetry.Slf4jTelemetrySink;
import org.netcoord.test.utils.ScriptedAgent;
import org.netcoord.test.utils.ScriptedSimulator;
import org.netcoord.tools.PowerAllocatorTool;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

@Tag("integration")
@DisplayName("ScenarioAssembler")
class ScenarioAssemblerTest {

    private static final String SIMULATOR = ScriptedSimulator.class.getName();
    private static final String AGENT = ScriptedAgent.class.getName();

    private static Config scenario(String body) {
        return ConfigFactory.parseString(body).resolve();
    }

    @Nested
    @DisplayName("Assembly")
    class Assembly {

        @Test
        @DisplayName("Agents, delegates and sink are built from class names")
        void buildsFromClassNames() {
            Config config = scenario("""
                    max-steps = 3
                    seed = 5
                    agents = [
                      { id = "a1", className = "%1$s", options { utility = 2.0 } }
                      { id = "a2", className = "%1$s" }
                    ]
                    delegates = [
                      { name = "d1", className = "%2$s", agents = ["a1"], options { horizon = 0 } }
                      { name = "d2", className = "%2$s", agents = ["a2"], seed = 99 }
                    ]
                    telemetry { sink = "memory" }
                    """.formatted(AGENT, SIMULATOR));

            try (Scenario scenario = ScenarioAssembler.assemble(config)) {
                assertThat(scenario.maxSteps()).isEqualTo(3);
                assertThat(scenario.seed()).isEqualTo(5);
                assertThat(scenario.registry().listAgents()).containsExactly("a1", "a2");
                assertThat(scenario.coordinator().getAgents()).extracting(agent -> agent.id())
                        .containsExactly("a1", "a2");
                assertThat(scenario.environment().delegates()).hasSize(2);
                assertThat(scenario.telemetrySink()).isInstanceOf(InMemoryTelemetrySink.class);

                RunResult result = scenario.newOrchestrator().run(scenario.maxSteps());

                assertThat(result.isCompleted()).isTrue();
                assertThat(result.stepsExecuted()).isEqualTo(3);
                assertThat(((InMemoryTelemetrySink) scenario.telemetrySink()).getRecords())
                        .allSatisfy(record -> assertThat(record.rewards()).containsOnlyKeys("a1", "a2"))
                        .allSatisfy(record -> assertThat(record.planSummary()).startsWith("selected=a1"));
                assertThat(scenario.environment().delegateStates()).containsValues(DelegateState.ACTIVE);
            }
        }

        @Test
        @DisplayName("Built-in aliases assemble the toy radio scenario")
        void builtinAliases() {
            Config config = scenario("""
                    max-steps = 4
                    seed = 42
                    agents = [ { id = "ue1", className = "snr_seeking", options { target_snr = 14.0 } } ]
                    delegates = [
                      {
                        name = "cell"
                        className = "toy_radio"
                        agents = ["ue1"]
                        options { agents = [ { id = "ue1", initial_pos = [3.0, 4.0] } ] }
                        fading-models = [ { channel_id = "mmwave", type = "rician", params { k_factor = 3.0 } } ]
                        mobility-models = [ { agent_id = "ue1", type = "random_walk" } ]
                      }
                    ]
                    telemetry { sink = "log" }
                    """);

            try (Scenario scenario = ScenarioAssembler.assemble(config)) {
                assertThat(scenario.coordinator().getAgents().get(0)).isInstanceOf(SnrSeekingAgent.class);
                assertThat(scenario.telemetrySink()).isInstanceOf(Slf4jTelemetrySink.class);

                RunResult result = scenario.newOrchestrator().run(scenario.maxSteps());

                assertThat(result.isCompleted()).isTrue();
                assertThat(result.stepsExecuted()).isEqualTo(4);
            }
        }

        @Test
        @DisplayName("The weighted-metrics policy is configured from its weights block")
        void weightedPolicy() {
            Config config = scenario("""
                    max-steps = 1
                    agents = [ { id = "a1", className = "%s" } ]
                    coordinator {
                      ranking { policy = "weighted-metrics", weights { energy = 1.0, latency = 3.0 } }
                      default-action { power = 0.0 }
                    }
                    delegates = []
                    telemetry { sink = "memory" }
                    """.formatted(AGENT));

            try (Scenario scenario = ScenarioAssembler.assemble(config)) {
                assertThat(scenario.coordinator().getRankingPolicy()).isInstanceOf(WeightedMetricRankingPolicy.class);
                WeightedMetricRankingPolicy policy = (WeightedMetricRankingPolicy) scenario.coordinator().getRankingPolicy();
                assertThat(policy.getWeights()).containsOnlyKeys("energy", "latency");
                assertThat(policy.getWeights().get("latency")).isEqualTo(0.75);
            }
        }

        @Test
        @DisplayName("A capability alias can serve as the coordinator's optimizer tool")
        void optimizerTool() {
            Config config = scenario("""
                    max-steps = 2
                    capabilities { budget { className = "power_allocator", options { total_power = 4.0 } } }
                    agents = [
                      { id = "a1", className = "%1$s", options { utility = 1.0 } }
                      { id = "a2", className = "%1$s", options { utility = 3.0 } }
                    ]
                    coordinator { optimizer-tool = "budget" }
                    delegates = [
                      { name = "d1", className = "%2$s", agents = ["a1"] }
                      { name = "d2", className = "%2$s", agents = ["a2"] }
                    ]
                    telemetry { sink = "memory" }
                    """.formatted(AGENT, SIMULATOR));

            try (Scenario scenario = ScenarioAssembler.assemble(config)) {
                assertThat(scenario.coordinator().getOptimizerTool()).isInstanceOf(PowerAllocatorTool.class);
                Orchestrator orchestrator = scenario.newOrchestrator();

                orchestrator.run(scenario.maxSteps());

                assertThat(orchestrator.getRunState().getHistory()).hasSize(2).allSatisfy(record -> {
                    @SuppressWarnings("unchecked")
                    Map<String, Object> optimizer = (Map<String, Object>) record.plan().telemetry()
                            .get(Coordinator.TELEMETRY_OPTIMIZER);
                    assertThat(optimizer.get("allocation")).isEqualTo(Map.of("a1", 1.0, "a2", 3.0));
                });
            }
        }

        @Test
        @DisplayName("Delegate options receive the delegate's agent ids")
        void parsesDelegates() {
            List<DelegateSpec> specs = ScenarioAssembler.parseDelegates(scenario("""
                    delegates = [ { name = "d", className = "x", agents = ["u1", "u2"], step-timeout = 250ms,
                                    failure-policy = "skip", options { agent_ids = ["ignored"] } }
                                  { name = "e", className = "x", agents = ["u3"] } ]
                    """).getConfigList("delegates"));

            assertThat(specs).hasSize(2);
            DelegateSpec first = specs.get(0);
            assertThat(first.agentIds()).containsExactly("u1", "u2");
            assertThat(first.stepTimeout()).contains(Duration.ofMillis(250));
            assertThat(first.failurePolicy()).isEqualTo(DelegateFailurePolicy.SKIP);
            assertThat(first.options().getStringList("agent_ids")).containsExactly("ignored");
            assertThat(specs.get(1).options().getStringList("agent_ids")).containsExactly("u3");
            assertThat(specs.get(1).failurePolicy()).isEqualTo(DelegateFailurePolicy.FAIL);
        }
    }

    @Nested
    @DisplayName("Rejection")
    class Rejection {

        @Test
        @DisplayName("Overlapping agent ids between delegates are rejected")
        void collision() {
            Config config = scenario("""
                    max-steps = 1
                    delegates = [
                      { name = "d1", className = "%1$s", agents = ["a1", "a2"] }
                      { name = "d2", className = "%1$s", agents = ["a2"] }
                    ]
                    telemetry { sink = "memory" }
                    """.formatted(SIMULATOR));

            assertThatThrownBy(() -> ScenarioAssembler.assemble(config))
                    .isInstanceOf(AgentIdCollisionException.class)
                    .satisfies(e -> assertThat(((AgentIdCollisionException) e).getCollidingIds()).containsExactly("a2"));
        }

        @Test
        @DisplayName("An unknown simulator alias is a configuration error")
        void unknownAlias() {
            Config config = scenario("""
                    max-steps = 1
                    delegates = [ { name = "d1", className = "no_such_simulator" } ]
                    """);

            assertThatThrownBy(() -> ScenarioAssembler.assemble(config))
                    .isInstanceOf(UnknownCapabilityException.class);
        }

        @Test
        @DisplayName("An optimizer tool that is not a tool is rejected")
        void optimizerToolOfWrongType() {
            Config config = scenario("""
                    max-steps = 1
                    agents = [ { id = "a1", className = "%s" } ]
                    coordinator { optimizer-tool = "a1" }
                    delegates = []
                    """.formatted(AGENT));

            assertThatThrownBy(() -> ScenarioAssembler.assemble(config))
                    .isInstanceOf(ResolutionException.class)
                    .hasMessageContaining("ITool");
        }

        @Test
        @DisplayName("Missing max-steps is reported as ConfigurationException")
        void missingMaxSteps() {
            assertThatThrownBy(() -> ScenarioAssembler.assemble(scenario("delegates = []")))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("max-steps");
        }

        @Test
        @DisplayName("A negative max-steps is rejected")
        void negativeMaxSteps() {
            assertThatThrownBy(() -> ScenarioAssembler.assemble(scenario("max-steps = -1\ndelegates = []")))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("A model entry without type or className is rejected")
        void modelWithoutReference() {
            Config config = scenario("""
                    max-steps = 1
                    delegates = [ { name = "d", className = "%s", agents = ["a"],
                                    fading-models = [ { channel_id = "c" } ] } ]
                    """.formatted(SIMULATOR));

            assertThatThrownBy(() -> ScenarioAssembler.assemble(config))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("fading-models");
        }
    }

    @Nested
    @DisplayName("ScenarioRunner")
    class Runner {

        @Test
        @DisplayName("Assembly failures are reported as an aborted result")
        void assemblyFailure_isAborted() {
            RunResult result = new ScenarioRunner().run(ConfigFactory.parseString("other { x = 1 }"));

            assertThat(result.status()).isEqualTo(RunStatus.ABORTED);
            assertThat(result.stepsExecuted()).isZero();
            assertThat(result.error()).isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("A valid scenario runs to completion")
        void runsScenario() {
            Config config = ConfigFactory.parseString("""
                    netcoord {
                      max-steps = 2
                      agents = [ { id = "a1", className = "%s" } ]
                      delegates = [ { name = "d", className = "%s", agents = ["a1"] } ]
                      telemetry { sink = "memory" }
                    }
                    """.formatted(AGENT, SIMULATOR));

            RunResult result = new ScenarioRunner().run(config);

            assertThat(result.isCompleted()).isTrue();
            assertThat(result.reason()).isEqualTo(CompletionReason.HORIZON_EXHAUSTED);
            assertThat(result.stepsExecuted()).isEqualTo(2);
        }
    }
}
