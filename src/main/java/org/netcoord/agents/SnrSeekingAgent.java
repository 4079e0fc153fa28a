package org.netcoord.agents;

import java.util.LinkedHashMap;
import java.util.Map;

import org.netcoord.runtime.ConfigurationException;
import org.netcoord.runtime.model.Action;
import org.netcoord.runtime.model.Observation;
import org.netcoord.runtime.model.Proposal;
import org.netcoord.runtime.spi.IAgent;

import com.typesafe.config.Config;

/**
 * Heuristic agent that steers its transmit power toward a target SNR.
 * <p>
 * Each step it proposes a power change of at most {@code max_step_db} toward
 * {@code target_snr}. The utility is the expected reduction of the distance to the target in dB,
 * so an agent far from its target outbids one that is almost there. Proposals also carry metric
 * estimates ({@code energy}, {@code latency}, {@code fairness}) for weighted ranking.
 * <p>
 * Options: {@code id} (required), {@code target_snr} (15.0), {@code max_step_db} (3.0),
 * {@code tolerance_db} (0.5), {@code min_power} (0.1), {@code max_power} (10.0).
 */
public class SnrSeekingAgent implements IAgent {

    public static final String ALIAS = "snr_seeking";

    private final String id;
    private final double targetSnr;
    private final double maxStepDb;
    private final double toleranceDb;
    private final double minPower;
    private final double maxPower;

    public SnrSeekingAgent(Config options) {
        if (!options.hasPath("id")) {
            throw new ConfigurationException("snr_seeking agent requires an 'id' option");
        }
        this.id = options.getString("id");
        this.targetSnr = options.hasPath("target_snr") ? options.getDouble("target_snr") : 15.0;
        this.maxStepDb = options.hasPath("max_step_db") ? options.getDouble("max_step_db") : 3.0;
        this.toleranceDb = options.hasPath("tolerance_db") ? options.getDouble("tolerance_db") : 0.5;
        this.minPower = options.hasPath("min_power") ? options.getDouble("min_power") : 0.1;
        this.maxPower = options.hasPath("max_power") ? options.getDouble("max_power") : 10.0;
        if (maxStepDb <= 0.0 || minPower <= 0.0 || maxPower < minPower) {
            throw new ConfigurationException(String.format(
                    "Agent '%s': need max_step_db > 0 and 0 < min_power <= max_power", id));
        }
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Proposal propose(Observation observation) {
        if (!(observation.get("SNR") instanceof Number snrValue)) {
            return new Proposal(id, Action.noop(), 0.0);
        }
        double snr = snrValue.doubleValue();
        double power = Math.max(observation.getDouble("power", 1.0), 1e-6);
        double gap = targetSnr - snr;
        if (Math.abs(gap) <= toleranceDb) {
            return new Proposal(id, Action.noop(), 0.0, estimates(0.0, 0.0));
        }

        double requestedDb = Math.max(-maxStepDb, Math.min(maxStepDb, gap));
        double newPower = clamp(power * Math.pow(10.0, requestedDb / 10.0));
        double appliedDb = 10.0 * Math.log10(newPower / power);
        double improvement = Math.abs(gap) - Math.abs(gap - appliedDb);

        return new Proposal(id, Action.of("power", newPower), improvement,
                estimates(power - newPower, improvement));
    }

    private Map<String, Object> estimates(double energySaving, double snrGain) {
        Map<String, Object> estimates = new LinkedHashMap<>();
        estimates.put("energy", energySaving);
        estimates.put("latency", snrGain);
        estimates.put("fairness", 0.0);
        return Map.of("estimates", estimates);
    }

    private double clamp(double power) {
        return Math.max(minPower, Math.min(maxPower, power));
    }
}
