package org.netcoord.runtime.spi;

import org.netcoord.runtime.model.Position;

/**
 * Moves one agent across the simulation plane.
 */
@FunctionalInterface
public interface IMobilityModel {

    /**
     * @param position Current position.
     * @param dt Elapsed time since the previous update.
     * @return The new position.
     */
    Position advance(Position position, double dt);

    /**
     * Restarts the model's random stream for a new episode. Default: nothing to do.
     */
    default void reseed(long seed) {
    }
}
