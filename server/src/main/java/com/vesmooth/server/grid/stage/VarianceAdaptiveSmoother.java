package com.vesmooth.server.grid.stage;

import com.vesmooth.server.grid.Cell;
import com.vesmooth.server.grid.Grid;
import com.vesmooth.server.grid.InvalidGridException;
import com.vesmooth.server.grid.Neighborhood;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stage 2: iterative smoothing whose strength follows the local standard
 * deviation. Cells that disagree with their neighbors are pulled in hard,
 * flat regions are left almost untouched.
 *
 * Each sweep reads only the previous sweep's complete grid and writes into a
 * fresh copy.
 */
public class VarianceAdaptiveSmoother {
    private static final Logger logger = LoggerFactory.getLogger(VarianceAdaptiveSmoother.class);

    public static final String STAGE_NAME = "adaptive_smoothing";
    public static final int DEFAULT_PASSES = 2;

    static final double HIGH_VARIANCE = 3.0;
    static final double LOW_VARIANCE = 1.0;
    static final double MAX_WEIGHT = 0.65;
    static final double MIN_WEIGHT = 0.15;

    static final double CENTER_WEIGHT = 1.2;
    static final double CARDINAL_WEIGHT = 1.0;
    static final double DIAGONAL_WEIGHT = 0.6;

    public Grid smooth(Grid grid) {
        return smooth(grid, DEFAULT_PASSES);
    }

    public Grid smooth(Grid grid, int passes) {
        if (grid == null) {
            throw new IllegalArgumentException("grid must not be null");
        }
        if (passes < 0) {
            throw new InvalidGridException(STAGE_NAME, "passes must be >= 0, got " + passes);
        }

        Grid result = grid.copy();
        for (int pass = 0; pass < passes; pass++) {
            Grid passResult = result.copy();
            int aggressive = 0;

            for (int r = 0; r < result.getRows(); r++) {
                for (int c = 0; c < result.getCols(); c++) {
                    double center = result.getValue(r, c);
                    double localVar = Neighborhood.localStdDev(result, r, c);
                    double w = smoothingWeight(localVar);
                    if (w == MAX_WEIGHT)
                        aggressive++;

                    double mean = Neighborhood.weightedMean(result, r, c, CENTER_WEIGHT, CARDINAL_WEIGHT,
                            DIAGONAL_WEIGHT);

                    Cell out = passResult.getCell(r, c);
                    out.setAdaptivePasses(Math.round(w * 10));
                    out.setValue(Neighborhood.lerp(center, mean, w));
                }
            }

            logger.debug("VarianceAdaptiveSmoother pass {}/{}: {} of {} cells at max weight", pass + 1, passes,
                    aggressive, result.getRows() * result.getCols());
            result = passResult;
        }
        return result;
    }

    /**
     * Maps local standard deviation to a smoothing weight. Strictly above 3.0
     * is treated as a noise spike, strictly below 1.0 as real structure, and
     * the closed range [1.0, 3.0] is interpolated from 0.15 to 0.65.
     */
    public static double smoothingWeight(double localVar) {
        if (localVar > HIGH_VARIANCE) {
            return MAX_WEIGHT;
        } else if (localVar < LOW_VARIANCE) {
            return MIN_WEIGHT;
        }
        return MIN_WEIGHT + (localVar - LOW_VARIANCE) / 2.0 * 0.5;
    }
}
