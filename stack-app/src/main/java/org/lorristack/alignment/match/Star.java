package org.lorristack.alignment.match;

import java.io.Serializable;

/**
 * Centroid of a star (or any other point feature) in frame pixel coordinates.
 */
public class Star
        implements Serializable {

    private final double x;
    private final double y;

    public Star(final double x,
                final double y) {
        this.x = x;
        this.y = y;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double distanceTo(final Star that) {
        final double dx = this.x - that.x;
        final double dy = this.y - that.y;
        return Math.sqrt((dx * dx) + (dy * dy));
    }

    @Override
    public String toString() {
        return String.format("(%.2f, %.2f)", x, y);
    }
}
