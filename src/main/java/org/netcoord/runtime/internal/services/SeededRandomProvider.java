package org.netcoord.runtime.internal.services;

import java.nio.charset.StandardCharsets;
import java.util.Random;

import org.netcoord.runtime.spi.IRandomProvider;

/**
 * {@link IRandomProvider} backed by {@link Random} with a fixed seed.
 * <p>
 * Derived providers get a seed computed from the parent seed, the context name and the salt
 * through a SplitMix64 finaliser, so derivation is reproducible and does not consume values from
 * the parent stream.
 */
public class SeededRandomProvider implements IRandomProvider {

    private final long seed;
    private final Random random;

    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    public long getSeed() {
        return seed;
    }

    @Override
    public Random asJavaRandom() {
        return random;
    }

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }

    @Override
    public int nextInt(int bound) {
        return random.nextInt(bound);
    }

    @Override
    public double nextGaussian() {
        return random.nextGaussian();
    }

    @Override
    public IRandomProvider deriveFor(String context, long salt) {
        long h = seed;
        for (byte b : context.getBytes(StandardCharsets.UTF_8)) {
            h = mix(h ^ b);
        }
        return new SeededRandomProvider(mix(h ^ salt));
    }

    private static long mix(long z) {
        z += 0x9E3779B97F4A7C15L;
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
