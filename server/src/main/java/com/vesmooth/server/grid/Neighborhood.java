package com.vesmooth.server.grid;

/**
 * Neighbor lookups shared by the stages. Only in-bounds neighbors take part;
 * nothing is padded or wrapped.
 */
public final class Neighborhood {

    // up, down, left, right
    static final int[][] CARDINAL = { { -1, 0 }, { 1, 0 }, { 0, -1 }, { 0, 1 } };
    // up-left, up-right, down-left, down-right
    static final int[][] DIAGONAL = { { -1, -1 }, { -1, 1 }, { 1, -1 }, { 1, 1 } };

    private Neighborhood() {
    }

    /**
     * Largest absolute difference between the cell and its in-bounds cardinal
     * neighbors, 0 when it has none.
     */
    public static double maxCardinalDifference(Grid g, int r, int c) {
        double center = g.getValue(r, c);
        double maxDiff = 0.0;
        for (int[] d : CARDINAL) {
            int nr = r + d[0];
            int nc = c + d[1];
            if (g.contains(nr, nc)) {
                maxDiff = Math.max(maxDiff, Math.abs(center - g.getValue(nr, nc)));
            }
        }
        return maxDiff;
    }

    /**
     * Population standard deviation of the cell and its in-bounds cardinal
     * neighbors.
     */
    public static double localStdDev(Grid g, int r, int c) {
        double[] values = new double[5];
        int n = 0;
        values[n++] = g.getValue(r, c);
        for (int[] d : CARDINAL) {
            int nr = r + d[0];
            int nc = c + d[1];
            if (g.contains(nr, nc)) {
                values[n++] = g.getValue(nr, nc);
            }
        }

        double sum = 0.0;
        for (int i = 0; i < n; i++)
            sum += values[i];
        double mean = sum / n;

        double var = 0.0;
        for (int i = 0; i < n; i++)
            var += (values[i] - mean) * (values[i] - mean);
        return Math.sqrt(var / n);
    }

    /**
     * Weighted mean of the 3x3 neighborhood. The center weight is always
     * present, so the denominator is never zero.
     * Evaluated as center + sum(w * (v - center)) / sum(w), which equals
     * sum(w * v) / sum(w) and returns the center exactly on flat input.
     */
    public static double weightedMean(Grid g, int r, int c, double centerWeight, double cardinalWeight,
            double diagonalWeight) {
        double center = g.getValue(r, c);
        double totalWeight = centerWeight;
        double weightedDelta = 0.0;

        for (int[] d : CARDINAL) {
            int nr = r + d[0];
            int nc = c + d[1];
            if (g.contains(nr, nc)) {
                weightedDelta += cardinalWeight * (g.getValue(nr, nc) - center);
                totalWeight += cardinalWeight;
            }
        }
        for (int[] d : DIAGONAL) {
            int nr = r + d[0];
            int nc = c + d[1];
            if (g.contains(nr, nc)) {
                weightedDelta += diagonalWeight * (g.getValue(nr, nc) - center);
                totalWeight += diagonalWeight;
            }
        }
        return center + weightedDelta / totalWeight;
    }

    /**
     * Linear interpolation from a toward b by fraction t.
     */
    public static double lerp(double a, double b, double t) {
        return a + t * (b - a);
    }
}
