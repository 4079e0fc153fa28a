package org.netcoord.runtime.models;

import org.netcoord.runtime.model.Position;
import org.netcoord.runtime.spi.IMobilityModel;
import org.netcoord.runtime.spi.IRandomProvider;

import com.typesafe.config.Config;

/**
 * Two-dimensional random walk.
 * <ul>
 *   <li><b>step_size:</b> maximum displacement per axis per unit of time (default 0.5, {@code >= 0}).</li>
 * </ul>
 */
public class RandomWalkMobility implements IMobilityModel {

    static final String ALIAS = "random_walk";

    private final IRandomProvider baseRandom;
    private IRandomProvider random;
    private final double stepSize;

    public RandomWalkMobility(IRandomProvider random, Config parameters) {
        this.baseRandom = random;
        this.random = random;
        this.stepSize = ModelParameters.requireNonNegative(ALIAS, "step_size",
                ModelParameters.optionalDouble(parameters, ALIAS, "step_size", 0.5));
    }

    @Override
    public void reseed(long seed) {
        random = baseRandom.deriveFor("episode", seed);
    }

    @Override
    public Position advance(Position position, double dt) {
        double dx = (random.nextDouble() * 2.0 - 1.0) * stepSize * dt;
        double dy = (random.nextDouble() * 2.0 - 1.0) * stepSize * dt;
        return position.translate(dx, dy);
    }

    public double getStepSize() {
        return stepSize;
    }
}
