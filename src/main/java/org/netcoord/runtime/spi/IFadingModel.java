package org.netcoord.runtime.spi;

import org.netcoord.runtime.model.LinkState;

/**
 * Small-scale fading applied to one channel.
 * <p>
 * Custom implementations are referenced by class name and are constructed like simulators,
 * preferably through a {@code (IRandomProvider, Config)} constructor.
 */
@FunctionalInterface
public interface IFadingModel {

    /**
     * Draws the fading gain for the current step.
     *
     * @param link The link being sampled.
     * @return Gain in dB to add to {@link LinkState#baseSnrDb()}.
     */
    double sample(LinkState link);

    /**
     * Restarts the model's random stream for a new episode. The same seed must yield the same
     * sequence of samples. Default: stateless, nothing to do.
     */
    default void reseed(long seed) {
    }
}
