package org.netcoord.runtime.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

import org.netcoord.runtime.environment.DelegateFailurePolicy;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Build instructions for one delegate simulator. Consumed once when the composite environment
 * is assembled and never mutated afterwards.
 *
 * @param name Unique delegate name; keys the delegate's info payload.
 * @param className Alias or class name of the {@code ISimulator} to construct.
 * @param agentIds Agent ids owned by this delegate, in declaration order.
 * @param options Constructor options handed to the simulator.
 * @param seed Delegate-specific seed; when empty the composite seed is used.
 * @param fadingOverrides Fading models to inject, keyed by channel id (last wins).
 * @param mobilityOverrides Mobility models to inject, keyed by agent id (last wins).
 * @param stepTimeout Optional per-call deadline for {@code step}.
 * @param failurePolicy What to do when the simulator throws.
 */
public record DelegateSpec(
        String name,
        String className,
        Set<String> agentIds,
        Config options,
        OptionalLong seed,
        List<ModelSpec> fadingOverrides,
        List<ModelSpec> mobilityOverrides,
        Optional<Duration> stepTimeout,
        DelegateFailurePolicy failurePolicy
) {

    public DelegateSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(className, "className");
        agentIds = agentIds == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(agentIds));
        options = options == null ? ConfigFactory.empty() : options;
        seed = seed == null ? OptionalLong.empty() : seed;
        fadingOverrides = fadingOverrides == null ? List.of() : List.copyOf(fadingOverrides);
        mobilityOverrides = mobilityOverrides == null ? List.of() : List.copyOf(mobilityOverrides);
        stepTimeout = stepTimeout == null ? Optional.empty() : stepTimeout;
        failurePolicy = failurePolicy == null ? DelegateFailurePolicy.FAIL : failurePolicy;
    }

    /**
     * Minimal spec without overrides, seed or deadline.
     */
    public static DelegateSpec of(String name, String className, Set<String> agentIds, Config options) {
        return new DelegateSpec(name, className, agentIds, options, OptionalLong.empty(),
                List.of(), List.of(), Optional.empty(), DelegateFailurePolicy.FAIL);
    }
}
