package com.skyfinal.state;

/**
 * A player's coordinates plus the coarse labels derived from them.
 *
 * Labels come from an N x N grid laid over the game's {@link MapBounds}:
 * {@code R<row>C<col>} for the cell, {@code B<n>} for each band, and a compass
 * quadrant relative to the bounds' midpoint. Everything reads "Unknown" when
 * either the coordinates or the bounds are missing.
 */
public class Position {

    public static final String UNKNOWN = "Unknown";
    public static final int DEFAULT_GRID_SIZE = 8;

    private static final Position UNKNOWN_POSITION =
            new Position(null, null, UNKNOWN, UNKNOWN, UNKNOWN, UNKNOWN);

    private final Double x;
    private final Double y;
    private final String region;
    private final String xBand;
    private final String yBand;
    private final String quadrant;

    private Position(Double x, Double y, String region, String xBand, String yBand, String quadrant) {
        this.x = x;
        this.y = y;
        this.region = region;
        this.xBand = xBand;
        this.yBand = yBand;
        this.quadrant = quadrant;
    }

    public static Position unknown() {
        return UNKNOWN_POSITION;
    }

    public static Position locate(Double x, Double y, MapBounds bounds) {
        return locate(x, y, bounds, DEFAULT_GRID_SIZE);
    }

    public static Position locate(Double x, Double y, MapBounds bounds, int gridSize) {
        if (x == null || y == null || bounds == null) {
            return new Position(x, y, UNKNOWN, UNKNOWN, UNKNOWN, UNKNOWN);
        }

        int col = binIndex(x, bounds.getMinX(), bounds.getMaxX(), gridSize);
        int row = binIndex(y, bounds.getMinY(), bounds.getMaxY(), gridSize);

        boolean east = x >= bounds.getMidX();
        boolean north = y >= bounds.getMidY();
        String quadrant = (north ? "N" : "S") + (east ? "E" : "W");

        return new Position(x, y,
                "R" + (row + 1) + "C" + (col + 1),
                "B" + (col + 1),
                "B" + (row + 1),
                quadrant);
    }

    private static int binIndex(double v, double min, double max, int n) {
        double ratio = Math.abs(max - min) > 1e-12 ? (v - min) / (max - min) : 0.0;
        ratio = Math.min(Math.max(ratio, 0.0), 0.999999);
        return (int) (ratio * n);
    }

    public Double getX() {
        return x;
    }

    public Double getY() {
        return y;
    }

    public String getRegion() {
        return region;
    }

    public String getXBand() {
        return xBand;
    }

    public String getYBand() {
        return yBand;
    }

    public String getQuadrant() {
        return quadrant;
    }

    public boolean isKnown() {
        return !UNKNOWN.equals(region);
    }

    /**
     * Region with its quadrant, e.g. {@code "R2C7 (NE)"}.
     */
    public String describe() {
        return region + " (" + quadrant + ")";
    }

    @Override
    public String toString() {
        return "Position{" +
                "x=" + x +
                ", y=" + y +
                ", region='" + region + '\'' +
                ", quadrant='" + quadrant + '\'' +
                '}';
    }
}
