package org.netcoord.runtime.models;

import org.netcoord.runtime.model.LinkState;
import org.netcoord.runtime.spi.IFadingModel;
import org.netcoord.runtime.spi.IRandomProvider;

import com.typesafe.config.Config;

/**
 * Rician fading for line-of-sight dominated links.
 * <ul>
 *   <li><b>k_factor:</b> ratio of line-of-sight to scattered power (default 5.0, {@code >= 0}).</li>
 *   <li><b>sigma:</b> standard deviation of the scattered component in dB (default 2.0, {@code > 0}).</li>
 * </ul>
 */
public class RicianFadingModel implements IFadingModel {

    static final String ALIAS = "rician";

    private final IRandomProvider baseRandom;
    private IRandomProvider random;
    private final double kFactor;
    private final double sigma;
    private final double losWeight;
    private final double scatterWeight;

    public RicianFadingModel(IRandomProvider random, Config parameters) {
        this.baseRandom = random;
        this.random = random;
        this.kFactor = ModelParameters.requireNonNegative(ALIAS, "k_factor",
                ModelParameters.optionalDouble(parameters, ALIAS, "k_factor", 5.0));
        this.sigma = ModelParameters.requirePositive(ALIAS, "sigma",
                ModelParameters.optionalDouble(parameters, ALIAS, "sigma", 2.0));
        this.losWeight = Math.sqrt(kFactor / (kFactor + 1.0));
        this.scatterWeight = Math.sqrt(1.0 / (kFactor + 1.0));
    }

    @Override
    public void reseed(long seed) {
        random = baseRandom.deriveFor("episode", seed);
    }

    @Override
    public double sample(LinkState link) {
        return losWeight + scatterWeight * random.nextGaussian() * sigma;
    }

    public double getKFactor() {
        return kFactor;
    }

    public double getSigma() {
        return sigma;
    }
}
