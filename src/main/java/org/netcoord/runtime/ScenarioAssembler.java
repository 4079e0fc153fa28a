package org.netcoord.runtime;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

import org.netcoord.agents.SnrSeekingAgent;
import org.netcoord.runtime.coordination.Coordinator;
import org.netcoord.runtime.coordination.MaxUtilityRankingPolicy;
import org.netcoord.runtime.coordination.ProposalCollector;
import org.netcoord.runtime.coordination.WeightedMetricRankingPolicy;
import org.netcoord.runtime.environment.CompositeEnvironment;
import org.netcoord.runtime.environment.DelegateFailurePolicy;
import org.netcoord.runtime.internal.services.SeededRandomProvider;
import org.netcoord.runtime.model.Action;
import org.netcoord.runtime.model.DelegateSpec;
import org.netcoord.runtime.model.ModelSpec;
import org.netcoord.runtime.models.ModelResolver;
import org.netcoord.runtime.registry.CapabilityRegistry;
import org.netcoord.runtime.spi.IAgent;
import org.netcoord.runtime.spi.ICapabilityFactory;
import org.netcoord.runtime.spi.IRankingPolicy;
import org.netcoord.runtime.spi.ITelemetrySink;
import org.netcoord.runtime.spi.ITool;
import org.netcoord.runtime.telemetry.InMemoryTelemetrySink;
import org.netcoord.runtime.telemetry.Slf4jTelemetrySink;
import org.netcoord.simulators.ToyRadioSimulator;
import org.netcoord.tools.PowerAllocatorTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;

/**
 * Binds a {@code netcoord} configuration block into a runnable {@link Scenario}.
 * <p>
 * Assembly order: registry with built-in aliases, extra capabilities, agents (in list order),
 * coordinator (with its optional {@code optimizer-tool}), delegate specs, composite environment,
 * telemetry sink. Any malformed input is reported as {@link ConfigurationException}; nothing is
 * left running when assembly fails.
 * <p>
 * Every simulator receives its delegate's agent ids under the {@code agent_ids} option unless the
 * options already set it.
 */
public final class ScenarioAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(ScenarioAssembler.class);

    public static final String ROOT_PATH = "netcoord";

    private ScenarioAssembler() {
    }

    /**
     * Assembles the scenario under {@value #ROOT_PATH} of a full configuration.
     *
     * @param config Resolved application configuration.
     * @return The assembled scenario.
     * @throws ConfigurationException if the block is missing or invalid.
     */
    public static Scenario assembleFrom(Config config) {
        if (!config.hasPath(ROOT_PATH)) {
            throw new ConfigurationException("Configuration has no '" + ROOT_PATH + "' block");
        }
        return assemble(config.getConfig(ROOT_PATH));
    }

    /**
     * Assembles a scenario from the contents of a {@code netcoord} block.
     *
     * @param scenario The scenario block.
     * @return The assembled scenario.
     * @throws ConfigurationException on malformed input or unresolvable references.
     */
    public static Scenario assemble(Config scenario) {
        try {
            return doAssemble(scenario);
        } catch (ConfigException e) {
            throw new ConfigurationException("Invalid scenario configuration: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid scenario configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Registers the aliases that ship with netcoord.
     */
    public static void registerBuiltins(CapabilityRegistry registry) {
        registry.register(ToyRadioSimulator.ALIAS, (random, options) -> new ToyRadioSimulator(options));
        registry.register(SnrSeekingAgent.ALIAS, (random, options) -> new SnrSeekingAgent(options));
        registry.register(PowerAllocatorTool.ALIAS, (random, options) -> new PowerAllocatorTool(options));
    }

    private static Scenario doAssemble(Config scenario) {
        long seed = scenario.hasPath("seed") ? scenario.getLong("seed") : 0L;
        long maxSteps = scenario.getLong("max-steps");
        if (maxSteps < 0) {
            throw new ConfigurationException("max-steps must be >= 0, got " + maxSteps);
        }

        CapabilityRegistry registry = new CapabilityRegistry(new SeededRandomProvider(seed));
        registerBuiltins(registry);
        if (scenario.hasPath("capabilities")) {
            registerCapabilities(registry, scenario.getConfig("capabilities"));
        }
        if (scenario.hasPath("agents")) {
            registerAgents(registry, scenario.getConfigList("agents"));
        }

        Config coordinatorConfig = scenario.hasPath("coordinator") ? scenario.getConfig("coordinator") : ConfigFactory.empty();
        List<DelegateSpec> delegateSpecs = parseDelegates(scenario.getConfigList("delegates"));
        ITelemetrySink sink = createSink(registry,
                scenario.hasPath("telemetry") ? scenario.getConfig("telemetry") : ConfigFactory.empty());

        Coordinator coordinator = createCoordinator(registry, coordinatorConfig);
        CompositeEnvironment environment;
        try {
            verifyAgentIds(registry, coordinator);
            warnUnownedAgents(registry, delegateSpecs);
            environment = CompositeEnvironment.build(delegateSpecs, registry, new ModelResolver(registry), seed);
        } catch (RuntimeException e) {
            coordinator.close();
            throw e;
        }

        LOG.info("Scenario assembled: {} delegate(s), {} agent(s), maxSteps={}, seed={}",
                delegateSpecs.size(), coordinator.getAgents().size(), maxSteps, seed);
        return new Scenario(registry, environment, coordinator, sink, maxSteps, seed);
    }

    private static void registerCapabilities(CapabilityRegistry registry, Config capabilities) {
        for (String name : capabilities.root().keySet()) {
            Config entry = capabilities.getConfig(name);
            String className = entry.getString("className");
            Config options = entry.hasPath("options") ? entry.getConfig("options") : ConfigFactory.empty();
            registry.register(name, delegatingFactory(registry, className, options));
        }
    }

    private static void registerAgents(CapabilityRegistry registry, List<? extends Config> agents) {
        for (Config entry : agents) {
            String agentId = entry.getString("id");
            String className = entry.getString("className");
            Config options = (entry.hasPath("options") ? entry.getConfig("options") : ConfigFactory.empty())
                    .withValue("id", ConfigValueFactory.fromAnyRef(agentId));
            registry.registerAgent(agentId, delegatingFactory(registry, className, options));
        }
    }

    /**
     * A factory that builds {@code reference} with the configured options layered over whatever
     * options the caller passes.
     */
    private static ICapabilityFactory delegatingFactory(CapabilityRegistry registry, String reference, Config options) {
        return (random, callerOptions) -> registry.create(reference, random,
                options.withFallback(callerOptions), Object.class);
    }

    private static void verifyAgentIds(CapabilityRegistry registry, Coordinator coordinator) {
        List<String> registered = registry.listAgents();
        for (int i = 0; i < registered.size(); i++) {
            IAgent agent = coordinator.getAgents().get(i);
            if (!registered.get(i).equals(agent.id())) {
                throw new ConfigurationException(String.format(
                        "Agent registered as '%s' reports id '%s'", registered.get(i), agent.id()));
            }
        }
    }

    private static void warnUnownedAgents(CapabilityRegistry registry, List<DelegateSpec> delegateSpecs) {
        Set<String> owned = new HashSet<>();
        delegateSpecs.forEach(spec -> owned.addAll(spec.agentIds()));
        for (String agentId : registry.listAgents()) {
            if (!owned.contains(agentId)) {
                LOG.warn("Agent '{}' belongs to no delegate; it will never be observed and always abstains", agentId);
            }
        }
    }

    static Coordinator createCoordinator(CapabilityRegistry registry, Config coordinator) {
        IRankingPolicy policy = createRankingPolicy(registry,
                coordinator.hasPath("ranking") ? coordinator.getConfig("ranking") : ConfigFactory.empty());
        Action defaultAction = coordinator.hasPath("default-action")
                ? new Action(coordinator.getConfig("default-action").root().unwrapped())
                : Action.noop();
        int parallelism = coordinator.hasPath("parallelism") ? coordinator.getInt("parallelism") : 1;
        ITool optimizerTool = coordinator.hasPath("optimizer-tool")
                ? registry.tool(coordinator.getString("optimizer-tool"))
                : null;
        return new Coordinator(registry, policy, defaultAction, new ProposalCollector(parallelism), optimizerTool);
    }

    static IRankingPolicy createRankingPolicy(CapabilityRegistry registry, Config ranking) {
        String policy = ranking.hasPath("policy") ? ranking.getString("policy") : "max-utility";
        return switch (policy) {
            case "max-utility" -> new MaxUtilityRankingPolicy();
            case "weighted-metrics" -> WeightedMetricRankingPolicy.fromConfig(
                    ranking.hasPath("weights") ? ranking.getConfig("weights") : ConfigFactory.empty());
            default -> registry.create(policy, registry.getRandomProvider().deriveFor("ranking", 0),
                    ranking.hasPath("options") ? ranking.getConfig("options") : ConfigFactory.empty(),
                    IRankingPolicy.class);
        };
    }

    static List<DelegateSpec> parseDelegates(List<? extends Config> delegates) {
        List<DelegateSpec> specs = new ArrayList<>(delegates.size());
        for (Config delegate : delegates) {
            String name = delegate.getString("name");
            List<String> agentIds = delegate.hasPath("agents") ? delegate.getStringList("agents") : List.of();
            Config options = (delegate.hasPath("options") ? delegate.getConfig("options") : ConfigFactory.empty())
                    .withFallback(ConfigFactory.empty().withValue("agent_ids", ConfigValueFactory.fromIterable(agentIds)));
            OptionalLong seed = delegate.hasPath("seed") ? OptionalLong.of(delegate.getLong("seed")) : OptionalLong.empty();
            Optional<Duration> stepTimeout = delegate.hasPath("step-timeout")
                    ? Optional.of(delegate.getDuration("step-timeout"))
                    : Optional.empty();
            DelegateFailurePolicy failurePolicy = delegate.hasPath("failure-policy")
                    ? DelegateFailurePolicy.parse(delegate.getString("failure-policy"))
                    : DelegateFailurePolicy.FAIL;

            specs.add(new DelegateSpec(name, delegate.getString("className"), new LinkedHashSet<>(agentIds),
                    options, seed,
                    parseModels(delegate, "fading-models", "channel_id"),
                    parseModels(delegate, "mobility-models", "agent_id"),
                    stepTimeout, failurePolicy));
        }
        return specs;
    }

    private static List<ModelSpec> parseModels(Config delegate, String path, String targetKey) {
        if (!delegate.hasPath(path)) {
            return List.of();
        }
        List<ModelSpec> models = new ArrayList<>();
        for (Config model : delegate.getConfigList(path)) {
            String reference;
            if (model.hasPath("className")) {
                reference = model.getString("className");
            } else if (model.hasPath("type")) {
                reference = model.getString("type");
            } else {
                throw new ConfigurationException(String.format(
                        "Entry in '%s' for '%s' needs a 'type' or 'className'", path, model.getString(targetKey)));
            }
            Config params = model.hasPath("params") ? model.getConfig("params") : ConfigFactory.empty();
            models.add(ModelSpec.of(model.getString(targetKey), reference, params));
        }
        return models;
    }

    private static ITelemetrySink createSink(CapabilityRegistry registry, Config telemetry) {
        String sink = telemetry.hasPath("sink") ? telemetry.getString("sink") : "log";
        return switch (sink) {
            case "log" -> new Slf4jTelemetrySink();
            case "memory" -> new InMemoryTelemetrySink();
            default -> registry.create(sink, registry.getRandomProvider().deriveFor("telemetry", 0),
                    telemetry.hasPath("options") ? telemetry.getConfig("options") : ConfigFactory.empty(),
                    ITelemetrySink.class);
        };
    }
}
