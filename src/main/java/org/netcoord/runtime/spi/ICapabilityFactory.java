package org.netcoord.runtime.spi;

import com.typesafe.config.Config;

/**
 * Builds a capability instance (simulator, agent, model, tool) from its options.
 */
@FunctionalInterface
public interface ICapabilityFactory {

    /**
     * @param random Random provider derived for the instance being built.
     * @param options Constructor options; never {@code null}.
     * @return The new instance.
     * @throws Exception if construction fails; the registry wraps it in a resolution failure.
     */
    Object create(IRandomProvider random, Config options) throws Exception;
}
