package com.vesmooth.server.grid.stage;

import com.vesmooth.server.grid.Grid;
import com.vesmooth.server.grid.Neighborhood;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stage 4: two fixed-strength polishing sweeps for cell-to-cell continuity.
 * Not noise adaptive.
 */
public class CoverageWeightedRefiner {
    private static final Logger logger = LoggerFactory.getLogger(CoverageWeightedRefiner.class);

    public static final String STAGE_NAME = "refinement";

    // first sweep stronger, second gentler
    static final double[] PASS_ALPHAS = { 0.35, 0.25 };

    static final double CENTER_WEIGHT = 1.4;
    static final double CARDINAL_WEIGHT = 1.0;
    static final double DIAGONAL_WEIGHT = 0.4;

    public Grid refine(Grid grid) {
        if (grid == null) {
            throw new IllegalArgumentException("grid must not be null");
        }

        Grid result = grid.copy();
        for (double alpha : PASS_ALPHAS) {
            Grid passResult = result.copy();
            for (int r = 0; r < result.getRows(); r++) {
                for (int c = 0; c < result.getCols(); c++) {
                    double center = result.getValue(r, c);
                    double mean = Neighborhood.weightedMean(result, r, c, CENTER_WEIGHT, CARDINAL_WEIGHT,
                            DIAGONAL_WEIGHT);
                    passResult.getCell(r, c).setValue(Neighborhood.lerp(center, mean, alpha));
                }
            }
            result = passResult;
        }

        logger.debug("CoverageWeightedRefiner: {} passes over {}", PASS_ALPHAS.length, grid);
        return result;
    }
}
