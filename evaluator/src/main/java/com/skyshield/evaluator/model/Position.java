package com.skyshield.evaluator.model;

/**
 * A point in the 2D map coordinate space shared by tracks and the protected point.
 */
public record Position(double x, double y) {

    public Position {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException("Position coordinates must be finite: (" + x + ", " + y + ")");
        }
    }

    /**
     * Euclidean distance to {@code other}.
     */
    public double distanceTo(Position other) {
        return Math.hypot(x - other.x, y - other.y);
    }
}
