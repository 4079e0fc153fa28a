package org.netcoord.runtime.models;

import org.netcoord.runtime.model.LinkState;
import org.netcoord.runtime.spi.IFadingModel;
import org.netcoord.runtime.spi.IRandomProvider;

import com.typesafe.config.Config;

/**
 * Rayleigh fading for rich-scattering links without a line-of-sight path.
 * <ul>
 *   <li><b>sigma:</b> standard deviation of the dB offset (default 6.0, {@code > 0}).</li>
 * </ul>
 */
public class RayleighFadingModel implements IFadingModel {

    static final String ALIAS = "rayleigh";

    private final IRandomProvider baseRandom;
    private IRandomProvider random;
    private final double sigma;

    public RayleighFadingModel(IRandomProvider random, Config parameters) {
        this.baseRandom = random;
        this.random = random;
        this.sigma = ModelParameters.requirePositive(ALIAS, "sigma",
                ModelParameters.optionalDouble(parameters, ALIAS, "sigma", 6.0));
    }

    @Override
    public void reseed(long seed) {
        random = baseRandom.deriveFor("episode", seed);
    }

    @Override
    public double sample(LinkState link) {
        return random.nextGaussian() * sigma;
    }

    public double getSigma() {
        return sigma;
    }
}
