package com.skyfinal.state;

import java.util.Collection;
import java.util.Optional;

/**
 * Min/max coordinates observed across all players of one game snapshot.
 *
 * Region labels are only meaningful relative to the bounds they were computed
 * against, so every player of a snapshot must share the same instance.
 */
public class MapBounds {

    private static final double MIN_SPAN = 1e-6;

    private final double minX;
    private final double maxX;
    private final double minY;
    private final double maxY;

    public MapBounds(double minX, double maxX, double minY, double maxY) {
        this.minX = minX;
        this.maxX = maxX;
        this.minY = minY;
        this.maxY = maxY;
    }

    /**
     * Computes bounds from a set of coordinate pairs ({@code double[]{x, y}}).
     * Returns empty when no pair is available. A flat axis is widened by one
     * unit so every point still lands in a valid cell.
     */
    public static Optional<MapBounds> of(Collection<double[]> points) {
        if (points.isEmpty()) {
            return Optional.empty();
        }

        double minX = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (double[] p : points) {
            minX = Math.min(minX, p[0]);
            maxX = Math.max(maxX, p[0]);
            minY = Math.min(minY, p[1]);
            maxY = Math.max(maxY, p[1]);
        }

        if (Math.abs(maxX - minX) < MIN_SPAN) {
            maxX = minX + 1.0;
        }
        if (Math.abs(maxY - minY) < MIN_SPAN) {
            maxY = minY + 1.0;
        }
        return Optional.of(new MapBounds(minX, maxX, minY, maxY));
    }

    public double getMinX() {
        return minX;
    }

    public double getMaxX() {
        return maxX;
    }

    public double getMinY() {
        return minY;
    }

    public double getMaxY() {
        return maxY;
    }

    public double getMidX() {
        return (minX + maxX) / 2.0;
    }

    public double getMidY() {
        return (minY + maxY) / 2.0;
    }

    @Override
    public String toString() {
        return "MapBounds{" +
                "x=[" + minX + ", " + maxX + "]" +
                ", y=[" + minY + ", " + maxY + "]" +
                '}';
    }
}
