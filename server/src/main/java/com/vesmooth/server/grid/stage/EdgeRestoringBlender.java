package com.vesmooth.server.grid.stage;

import com.vesmooth.server.grid.Cell;
import com.vesmooth.server.grid.Grid;
import com.vesmooth.server.grid.InvalidGridException;
import com.vesmooth.server.grid.Neighborhood;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stage 3: puts back part of the original value where the pre-smoothing
 * gradient was above the threshold, in proportion to how far above it was.
 * Reversion is capped at 85%.
 */
public class EdgeRestoringBlender {
    private static final Logger logger = LoggerFactory.getLogger(EdgeRestoringBlender.class);

    public static final String STAGE_NAME = "edge_blending";
    public static final double DEFAULT_GRADIENT_THRESHOLD = 2.5;
    public static final double MAX_BLEND = 0.85;

    public Grid blend(Grid originalGrid, Grid smoothedGrid) {
        return blend(originalGrid, smoothedGrid, DEFAULT_GRADIENT_THRESHOLD);
    }

    /**
     * @param originalGrid  grid holding the reference gradients and the
     *                      pre-smoothing values
     * @param smoothedGrid  grid holding the post-smoothing values
     * @param gradientThreshold strictly positive threshold
     */
    public Grid blend(Grid originalGrid, Grid smoothedGrid, double gradientThreshold) {
        if (originalGrid == null || smoothedGrid == null) {
            throw new IllegalArgumentException("grids must not be null");
        }
        if (!originalGrid.sameShape(smoothedGrid)) {
            throw new InvalidGridException(STAGE_NAME, "Shape mismatch: original " + originalGrid + " vs smoothed "
                    + smoothedGrid);
        }
        if (!(gradientThreshold > 0.0) || Double.isInfinite(gradientThreshold)) {
            throw new InvalidGridException(STAGE_NAME,
                    "gradientThreshold must be positive and finite, got " + gradientThreshold);
        }

        Grid result = smoothedGrid.copy();
        int restored = 0;

        for (int r = 0; r < result.getRows(); r++) {
            for (int c = 0; c < result.getCols(); c++) {
                double originalVal = originalGrid.getValue(r, c);
                double smoothedVal = smoothedGrid.getValue(r, c);
                double gradient = originalGrid.getCell(r, c).getGradient();
                Cell out = result.getCell(r, c);

                if (gradient > gradientThreshold) {
                    double blendFactor = blendFactor(gradient, gradientThreshold);
                    out.setValue(Neighborhood.lerp(smoothedVal, originalVal, blendFactor));
                    out.setBlendFactor(blendFactor);
                    restored++;
                } else {
                    out.setBlendFactor(0.0);
                }
            }
        }

        logger.debug("EdgeRestoringBlender: threshold={}, restored {} of {} cells", gradientThreshold, restored,
                result.getRows() * result.getCols());
        return result;
    }

    public static double blendFactor(double gradient, double gradientThreshold) {
        if (gradient <= gradientThreshold) {
            return 0.0;
        }
        return Math.min(MAX_BLEND, (gradient - gradientThreshold) / (gradientThreshold * 1.5));
    }
}
