package org.netcoord.runtime.coordination;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.netcoord.runtime.model.Proposal;
import org.netcoord.runtime.model.ProposalResult;
import org.netcoord.runtime.spi.IRankingPolicy;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

/**
 * Ranks proposals by a weighted sum of the metric estimates they carry.
 * <p>
 * Agents report estimates as a map under the {@value #ESTIMATES_KEY} metadata key, for example
 * {@code {energy: 0.8, latency: 0.2}}. Non-positive weights are dropped and the remaining ones are
 * normalised to sum to one; a metric the proposal does not estimate counts as zero. A proposal
 * without estimates is scored by its own utility. Ties go to the lower registry index.
 */
public class WeightedMetricRankingPolicy implements IRankingPolicy {

    public static final String ESTIMATES_KEY = "estimates";

    /** Used when no weights are configured. */
    public static final Map<String, Double> DEFAULT_WEIGHTS;

    static {
        Map<String, Double> defaults = new LinkedHashMap<>();
        defaults.put("energy", 0.4);
        defaults.put("fairness", 0.3);
        defaults.put("latency", 0.3);
        DEFAULT_WEIGHTS = Collections.unmodifiableMap(defaults);
    }

    private final Map<String, Double> weights;

    public WeightedMetricRankingPolicy(Map<String, Double> weights) {
        this.weights = normalize(weights == null || weights.isEmpty() ? DEFAULT_WEIGHTS : weights);
    }

    /**
     * @param weights Metric name to weight, e.g. the {@code coordinator.ranking.weights} block.
     */
    public static WeightedMetricRankingPolicy fromConfig(Config weights) {
        Map<String, Double> parsed = new LinkedHashMap<>();
        for (Map.Entry<String, ConfigValue> entry : weights.root().entrySet()) {
            parsed.put(entry.getKey(), weights.getDouble(entry.getKey()));
        }
        return new WeightedMetricRankingPolicy(parsed);
    }

    /**
     * @return The normalised weights in effect.
     */
    public Map<String, Double> getWeights() {
        return weights;
    }

    @Override
    public List<Ranked> rank(List<ProposalResult.Success> successes) {
        List<Ranked> ranked = new ArrayList<>(successes.size());
        for (ProposalResult.Success success : successes) {
            ranked.add(new Ranked(success, score(success.proposal())));
        }
        ranked.sort(MaxUtilityRankingPolicy.ORDER);
        return ranked;
    }

    double score(Proposal proposal) {
        if (!(proposal.metadata().get(ESTIMATES_KEY) instanceof Map<?, ?> estimates) || estimates.isEmpty()) {
            return proposal.utility();
        }
        double score = 0.0;
        for (Map.Entry<String, Double> weight : weights.entrySet()) {
            if (estimates.get(weight.getKey()) instanceof Number value) {
                score += weight.getValue() * value.doubleValue();
            }
        }
        return score;
    }

    static Map<String, Double> normalize(Map<String, Double> raw) {
        Map<String, Double> kept = new LinkedHashMap<>();
        double total = 0.0;
        for (Map.Entry<String, Double> entry : raw.entrySet()) {
            double value = entry.getValue() == null ? 0.0 : entry.getValue();
            if (value > 0.0) {
                kept.put(entry.getKey(), value);
                total += value;
            }
        }
        if (total <= 0.0) {
            return Map.of();
        }
        Map<String, Double> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : kept.entrySet()) {
            normalized.put(entry.getKey(), entry.getValue() / total);
        }
        return Collections.unmodifiableMap(normalized);
    }
}
