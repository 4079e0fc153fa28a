package org.netcoord.runtime.spi;

import java.util.Random;

/**
 * Source of randomness handed to simulators and models.
 * <p>
 * Every stochastic component draws from its own provider obtained through
 * {@link #deriveFor(String, long)}, so that adding or removing one component never shifts the
 * random stream of another.
 */
public interface IRandomProvider {

    /**
     * @return A {@link Random} view backed by this provider's stream.
     */
    Random asJavaRandom();

    double nextDouble();

    int nextInt(int bound);

    /**
     * @return A standard normal sample.
     */
    double nextGaussian();

    /**
     * Derives an independent, reproducible provider for a named context.
     * The same context and salt always yield the same stream for a given parent seed.
     *
     * @param context Stable name of the consumer (for example {@code "fading:ch0"}).
     * @param salt Additional discriminator.
     * @return A new provider.
     */
    IRandomProvider deriveFor(String context, long salt);
}
