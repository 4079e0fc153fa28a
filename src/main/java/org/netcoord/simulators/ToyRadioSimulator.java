package org.netcoord.simulators;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.netcoord.runtime.ConfigurationException;
import org.netcoord.runtime.model.Action;
import org.netcoord.runtime.model.LinkState;
import org.netcoord.runtime.model.Observation;
import org.netcoord.runtime.model.Position;
import org.netcoord.runtime.model.Transition;
import org.netcoord.runtime.spi.IFadingModel;
import org.netcoord.runtime.spi.IFadingModelHost;
import org.netcoord.runtime.spi.IMobilityModel;
import org.netcoord.runtime.spi.IMobilityModelHost;
import org.netcoord.runtime.spi.ISimulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Small radio simulator with a log-distance path-loss model over one or more radio access
 * technologies (RATs).
 * <p>
 * Each agent is a transmitter on the plane with a transmit power. Its SNR is the average over all
 * RATs of {@code base_snr - pathloss_exponent * log10(1 + d)} plus any fading sampled for that
 * RAT, plus the transmit power in dB. Fading models are attached per channel, where the channel
 * id is the RAT name; mobility models are attached per agent.
 * <p>
 * Options:
 * <ul>
 *   <li><b>agent_ids:</b> agents starting at the origin with power 1.0.</li>
 *   <li><b>agents:</b> list of {@code {id, initial_pos = [x, y], initial_power}}; overrides
 *       {@code agent_ids} entries with the same id.</li>
 *   <li><b>rats:</b> list of {@code {name, base_snr, pathloss_exponent}}; defaults to mmwave and sub6.</li>
 *   <li><b>time_step:</b> seconds per step (default 0.1).</li>
 *   <li><b>max_steps:</b> episode length, 0 for unlimited (default 0).</li>
 *   <li><b>energy_weight:</b> reward penalty per unit of energy (default 1.0).</li>
 * </ul>
 * {@link #reset(long)} reseeds every attached model, so two episodes reset with the same seed
 * and driven by the same actions produce the same transitions.
 * <p>
 * Actions understand {@code delta_x}, {@code delta_y} and {@code power}; a missing action holds.
 * Observations carry {@code SNR}, {@code x}, {@code y}, {@code power} and {@code energy_cost}.
 */
public class ToyRadioSimulator implements ISimulator, IFadingModelHost, IMobilityModelHost {

    private static final Logger LOG = LoggerFactory.getLogger(ToyRadioSimulator.class);

    public static final String ALIAS = "toy_radio";
    private static final double MIN_POWER = 1e-6;
    private static final double MIN_DISTANCE = 1e-6;

    /** Radio access technology parameters. */
    record Rat(String name, double baseSnr, double pathlossExponent) {
    }

    private record AgentDefaults(Position position, double power) {
    }

    private static final class AgentState {
        Position position;
        double power;
        double energyCost;

        AgentState(AgentDefaults defaults) {
            this.position = defaults.position();
            this.power = defaults.power();
        }
    }

    private final List<Rat> rats;
    private final Map<String, AgentDefaults> defaults;
    private final double timeStep;
    private final long maxSteps;
    private final double energyWeight;
    private final Map<String, IFadingModel> fadingModels = new LinkedHashMap<>();
    private final Map<String, IMobilityModel> mobilityModels = new LinkedHashMap<>();

    private final Map<String, AgentState> agents = new LinkedHashMap<>();
    private long stepCount;

    public ToyRadioSimulator(Config options) {
        this.rats = parseRats(options);
        this.defaults = parseAgents(options);
        this.timeStep = options.hasPath("time_step") ? options.getDouble("time_step") : 0.1;
        this.maxSteps = options.hasPath("max_steps") ? options.getLong("max_steps") : 0L;
        this.energyWeight = options.hasPath("energy_weight") ? options.getDouble("energy_weight") : 1.0;
        if (timeStep <= 0.0) {
            throw new ConfigurationException("toy_radio: time_step must be > 0, got " + timeStep);
        }
        if (maxSteps < 0) {
            throw new ConfigurationException("toy_radio: max_steps must be >= 0, got " + maxSteps);
        }
    }

    @Override
    public void registerFadingModel(String channelId, IFadingModel model) {
        if (rats.stream().noneMatch(rat -> rat.name().equals(channelId))) {
            LOG.warn("Fading model for unknown channel '{}' will never be sampled (channels: {})",
                    channelId, rats.stream().map(Rat::name).toList());
        }
        fadingModels.put(channelId, model);
    }

    @Override
    public void registerMobilityModel(String agentId, IMobilityModel model) {
        mobilityModels.put(agentId, model);
    }

    @Override
    public Transition reset(long seed) {
        stepCount = 0;
        fadingModels.values().forEach(model -> model.reseed(seed));
        mobilityModels.values().forEach(model -> model.reseed(seed));
        agents.clear();
        defaults.forEach((agentId, agentDefaults) -> agents.put(agentId, new AgentState(agentDefaults)));
        return snapshot(false);
    }

    @Override
    public Transition step(Map<String, Action> actions) {
        stepCount++;
        for (Map.Entry<String, AgentState> entry : agents.entrySet()) {
            AgentState state = entry.getValue();
            Action action = actions.getOrDefault(entry.getKey(), Action.noop());

            state.position = state.position.translate(action.getDouble("delta_x", 0.0), action.getDouble("delta_y", 0.0));
            IMobilityModel mobility = mobilityModels.get(entry.getKey());
            if (mobility != null) {
                state.position = mobility.advance(state.position, timeStep);
            }
            state.power = Math.max(action.getDouble("power", state.power), MIN_POWER);
            state.energyCost = state.power * timeStep;
        }
        return snapshot(maxSteps > 0 && stepCount >= maxSteps);
    }

    public long getStepCount() {
        return stepCount;
    }

    List<Rat> getRats() {
        return rats;
    }

    Map<String, IFadingModel> getFadingModels() {
        return fadingModels;
    }

    Map<String, IMobilityModel> getMobilityModels() {
        return mobilityModels;
    }

    private Transition snapshot(boolean done) {
        Map<String, Observation> observations = new LinkedHashMap<>();
        Map<String, Double> rewards = new LinkedHashMap<>();
        for (Map.Entry<String, AgentState> entry : agents.entrySet()) {
            AgentState state = entry.getValue();
            double snr = computeSnr(state);
            Map<String, Object> values = new LinkedHashMap<>();
            values.put("SNR", snr);
            values.put("x", state.position.x());
            values.put("y", state.position.y());
            values.put("power", state.power);
            values.put("energy_cost", state.energyCost);
            observations.put(entry.getKey(), new Observation(values));
            rewards.put(entry.getKey(), snr - energyWeight * state.energyCost);
        }
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("step", stepCount);
        info.put("time", stepCount * timeStep);
        return new Transition(observations, rewards, done, info);
    }

    private double computeSnr(AgentState state) {
        double distance = state.position.distanceToOrigin() + MIN_DISTANCE;
        double sum = 0.0;
        for (Rat rat : rats) {
            double snr = rat.baseSnr() - rat.pathlossExponent() * Math.log10(1.0 + distance);
            IFadingModel fading = fadingModels.get(rat.name());
            if (fading != null) {
                snr += fading.sample(new LinkState(rat.name(), stepCount, snr, distance));
            }
            sum += snr;
        }
        double average = rats.isEmpty() ? 0.0 : sum / rats.size();
        return average + 10.0 * Math.log10(Math.max(state.power, MIN_POWER));
    }

    private static List<Rat> parseRats(Config options) {
        if (!options.hasPath("rats")) {
            return List.of(new Rat("mmwave", 18.0, 2.2), new Rat("sub6", 12.0, 2.0));
        }
        List<Rat> rats = new ArrayList<>();
        for (Config rat : options.getConfigList("rats")) {
            rats.add(new Rat(
                    rat.getString("name"),
                    rat.hasPath("base_snr") ? rat.getDouble("base_snr") : 10.0,
                    rat.hasPath("pathloss_exponent") ? rat.getDouble("pathloss_exponent") : 2.0));
        }
        return List.copyOf(rats);
    }

    private static Map<String, AgentDefaults> parseAgents(Config options) {
        Map<String, AgentDefaults> parsed = new LinkedHashMap<>();
        if (options.hasPath("agent_ids")) {
            for (String agentId : options.getStringList("agent_ids")) {
                parsed.put(agentId, new AgentDefaults(Position.ORIGIN, 1.0));
            }
        }
        if (options.hasPath("agents")) {
            for (Config agent : options.getConfigList("agents")) {
                Position position = Position.ORIGIN;
                if (agent.hasPath("initial_pos")) {
                    List<Double> coordinates = agent.getDoubleList("initial_pos");
                    if (coordinates.size() != 2) {
                        throw new ConfigurationException(
                                "toy_radio: initial_pos must have two elements, got " + coordinates);
                    }
                    position = new Position(coordinates.get(0), coordinates.get(1));
                }
                double power = agent.hasPath("initial_power") ? agent.getDouble("initial_power") : 1.0;
                parsed.put(agent.getString("id"), new AgentDefaults(position, power));
            }
        }
        return parsed;
    }
}
