package org.netcoord.tools;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.netcoord.runtime.ConfigurationException;
import org.netcoord.runtime.spi.ITool;

import com.typesafe.config.Config;

/**
 * Splits a power budget in proportion to non-negative weights.
 * <p>
 * Accepts either {@code weights} (a list of numbers, answered with a list) or {@code utilities}
 * (agent id to number, answered with a map keyed the same way). Negative inputs count as zero;
 * when every input is zero the allocation is all zeros. {@code total_power} in the arguments
 * overrides the configured budget for one call.
 * <p>
 * Options: {@code total_power} (1.0).
 */
public class PowerAllocatorTool implements ITool {

    public static final String ALIAS = "power_allocator";

    private final double totalPower;

    public PowerAllocatorTool(Config options) {
        this.totalPower = options.hasPath("total_power") ? options.getDouble("total_power") : 1.0;
        if (totalPower < 0.0 || !Double.isFinite(totalPower)) {
            throw new ConfigurationException("power_allocator: total_power must be a finite value >= 0, got " + totalPower);
        }
    }

    @Override
    public String name() {
        return "allocator.power";
    }

    @Override
    public Map<String, Object> call(Map<String, Object> args) {
        double budget = args.get("total_power") instanceof Number number ? number.doubleValue() : totalPower;
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("total_power", budget);

        if (args.get("utilities") instanceof Map<?, ?> utilities) {
            double sum = 0.0;
            for (Object value : utilities.values()) {
                sum += weightOf(value);
            }
            Map<String, Double> allocation = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : utilities.entrySet()) {
                allocation.put(String.valueOf(entry.getKey()), share(weightOf(entry.getValue()), sum, budget));
            }
            result.put("allocation", allocation);
            return result;
        }

        if (args.get("weights") instanceof List<?> weights) {
            if (weights.isEmpty()) {
                throw new IllegalArgumentException("power_allocator: 'weights' must not be empty");
            }
            double sum = 0.0;
            for (Object value : weights) {
                sum += weightOf(value);
            }
            List<Double> allocation = new ArrayList<>(weights.size());
            for (Object value : weights) {
                allocation.add(share(weightOf(value), sum, budget));
            }
            result.put("allocation", allocation);
            return result;
        }

        throw new IllegalArgumentException("power_allocator expects 'utilities' or 'weights'");
    }

    private static double weightOf(Object value) {
        if (!(value instanceof Number number)) {
            throw new IllegalArgumentException("power_allocator: weight is not a number: " + value);
        }
        return Math.max(0.0, number.doubleValue());
    }

    private static double share(double weight, double sum, double budget) {
        return sum == 0.0 ? 0.0 : weight / sum * budget;
    }
}
