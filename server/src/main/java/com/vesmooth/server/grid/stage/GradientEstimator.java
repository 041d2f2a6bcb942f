package com.vesmooth.server.grid.stage;

import com.vesmooth.server.grid.Grid;
import com.vesmooth.server.grid.Neighborhood;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stage 1: marks discontinuities. Each cell's gradient is the largest
 * absolute difference to its direct (up, down, left, right) neighbors in the
 * input grid. Values and the other diagnostics are carried through.
 */
public class GradientEstimator {
    private static final Logger logger = LoggerFactory.getLogger(GradientEstimator.class);

    public static final String STAGE_NAME = "gradient";

    public Grid estimate(Grid grid) {
        if (grid == null) {
            throw new IllegalArgumentException("grid must not be null");
        }
        Grid result = grid.copy();

        double maxGradient = 0.0;
        for (int r = 0; r < grid.getRows(); r++) {
            for (int c = 0; c < grid.getCols(); c++) {
                double g = Neighborhood.maxCardinalDifference(grid, r, c);
                result.getCell(r, c).setGradient(g);
                if (g > maxGradient)
                    maxGradient = g;
            }
        }

        logger.debug("GradientEstimator: {} maxGradient={}", grid, String.format("%.4f", maxGradient));
        return result;
    }
}
