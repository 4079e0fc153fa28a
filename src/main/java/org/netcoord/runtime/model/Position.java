package org.netcoord.runtime.model;

/**
 * A point on the simulation plane.
 */
public record Position(double x, double y) {

    public static final Position ORIGIN = new Position(0.0, 0.0);

    public Position translate(double dx, double dy) {
        return new Position(x + dx, y + dy);
    }

    public double distanceToOrigin() {
        return Math.hypot(x, y);
    }
}
