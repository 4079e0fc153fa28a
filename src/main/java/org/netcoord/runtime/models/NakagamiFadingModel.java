package org.netcoord.runtime.models;

import org.netcoord.runtime.model.LinkState;
import org.netcoord.runtime.spi.IFadingModel;
import org.netcoord.runtime.spi.IRandomProvider;

import com.typesafe.config.Config;

/**
 * Nakagami-m fading. The power gain follows a Gamma distribution with shape {@code m} and scale
 * {@code omega / m}; the sample is returned in dB.
 * <ul>
 *   <li><b>m_factor:</b> shape, required, {@code > 0}.</li>
 *   <li><b>omega:</b> spread (mean power), required, {@code > 0}.</li>
 * </ul>
 */
public class NakagamiFadingModel implements IFadingModel {

    static final String ALIAS = "nakagami";
    private static final double MIN_GAIN = 1e-9;

    private final IRandomProvider baseRandom;
    private IRandomProvider random;
    private final double mFactor;
    private final double omega;

    public NakagamiFadingModel(IRandomProvider random, Config parameters) {
        this.baseRandom = random;
        this.random = random;
        this.mFactor = ModelParameters.requirePositive(ALIAS, "m_factor",
                ModelParameters.requireDouble(parameters, ALIAS, "m_factor"));
        this.omega = ModelParameters.requirePositive(ALIAS, "omega",
                ModelParameters.requireDouble(parameters, ALIAS, "omega"));
    }

    @Override
    public void reseed(long seed) {
        random = baseRandom.deriveFor("episode", seed);
    }

    @Override
    public double sample(LinkState link) {
        double gain = nextGamma(mFactor) * (omega / mFactor);
        return 10.0 * Math.log10(Math.max(gain, MIN_GAIN));
    }

    public double getMFactor() {
        return mFactor;
    }

    public double getOmega() {
        return omega;
    }

    /**
     * Marsaglia-Tsang sampler for Gamma(shape, 1). Shapes below one use the
     * {@code Gamma(shape + 1) * U^(1/shape)} boost.
     */
    private double nextGamma(double shape) {
        if (shape < 1.0) {
            double u = random.nextDouble();
            return nextGamma(shape + 1.0) * Math.pow(u, 1.0 / shape);
        }
        double d = shape - 1.0 / 3.0;
        double c = 1.0 / Math.sqrt(9.0 * d);
        while (true) {
            double x;
            double v;
            do {
                x = random.nextGaussian();
                v = 1.0 + c * x;
            } while (v <= 0.0);
            v = v * v * v;
            double u = random.nextDouble();
            if (u < 1.0 - 0.0331 * x * x * x * x) {
                return d * v;
            }
            if (Math.log(u) < 0.5 * x * x + d * (1.0 - v + Math.log(v))) {
                return d * v;
            }
        }
    }
}
