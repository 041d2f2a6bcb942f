package com.vesmooth.server.grid.pipeline;

import com.vesmooth.server.grid.Grid;
import com.vesmooth.server.grid.InvalidGridException;

public class GridMetrics {

    public static class Summary {
        private final double min;
        private final double max;
        private final double mean;
        private final double roughness;
        private final double maxAbsDelta;
        private final double energy;

        public Summary(double min, double max, double mean, double roughness, double maxAbsDelta, double energy) {
            this.min = min;
            this.max = max;
            this.mean = mean;
            this.roughness = roughness;
            this.maxAbsDelta = maxAbsDelta;
            this.energy = energy;
        }

        public double getMin() {
            return min;
        }

        public double getMax() {
            return max;
        }

        public double getMean() {
            return mean;
        }

        public double getRoughness() {
            return roughness;
        }

        public double getMaxAbsDelta() {
            return maxAbsDelta;
        }

        public double getEnergy() {
            return energy;
        }

        @Override
        public String toString() {
            return String.format("min=%.4f max=%.4f mean=%.4f roughness=%.4f maxAbsDelta=%.4f energy=%.4f", min, max,
                    mean, roughness, maxAbsDelta, energy);
        }
    }

    /**
     * Summarizes a grid, comparing it against a reference grid of the same
     * shape (usually the raw input).
     */
    public static Summary summarize(Grid grid, Grid reference) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double sum = 0.0;
        for (int r = 0; r < grid.getRows(); r++) {
            for (int c = 0; c < grid.getCols(); c++) {
                double v = grid.getValue(r, c);
                if (v < min)
                    min = v;
                if (v > max)
                    max = v;
                sum += v;
            }
        }
        double mean = sum / (grid.getRows() * grid.getCols());
        return new Summary(min, max, mean, roughness(grid), maxAbsDelta(grid, reference), energy(grid, reference));
    }

    /**
     * Mean absolute difference over all horizontally and vertically adjacent
     * cell pairs. 0 for a 1x1 grid.
     */
    public static double roughness(Grid grid) {
        double total = 0.0;
        int pairs = 0;
        for (int r = 0; r < grid.getRows(); r++) {
            for (int c = 0; c < grid.getCols(); c++) {
                if (c + 1 < grid.getCols()) {
                    total += Math.abs(grid.getValue(r, c) - grid.getValue(r, c + 1));
                    pairs++;
                }
                if (r + 1 < grid.getRows()) {
                    total += Math.abs(grid.getValue(r, c) - grid.getValue(r + 1, c));
                    pairs++;
                }
            }
        }
        return pairs == 0 ? 0.0 : total / pairs;
    }

    /**
     * Computes the maximum absolute difference between two grids.
     */
    public static double maxAbsDelta(Grid a, Grid b) {
        requireSameShape(a, b);
        double maxDelta = 0.0;
        for (int r = 0; r < a.getRows(); r++) {
            for (int c = 0; c < a.getCols(); c++) {
                double delta = Math.abs(a.getValue(r, c) - b.getValue(r, c));
                if (delta > maxDelta) {
                    maxDelta = delta;
                }
            }
        }
        return maxDelta;
    }

    /**
     * Sum of absolute corrections applied relative to the reference grid.
     */
    public static double energy(Grid grid, Grid reference) {
        requireSameShape(grid, reference);
        double energy = 0.0;
        for (int r = 0; r < grid.getRows(); r++) {
            for (int c = 0; c < grid.getCols(); c++) {
                energy += Math.abs(grid.getValue(r, c) - reference.getValue(r, c));
            }
        }
        return energy;
    }

    private static void requireSameShape(Grid a, Grid b) {
        if (!a.sameShape(b)) {
            throw new InvalidGridException("metrics", "Grids must have same shape: " + a + " vs " + b);
        }
    }
}
