package com.vesmooth.server.grid.stage;

import com.vesmooth.server.grid.Grid;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class GradientEstimatorTest {

    private final GradientEstimator estimator = new GradientEstimator();

    @Test
    public void testCenterSpike() {
        Grid raw = Grid.fromValues(new double[][] { { 50, 50, 50 }, { 50, 90, 50 }, { 50, 50, 50 } });
        Grid out = estimator.estimate(raw);

        assertEquals(40.0, out.getCell(1, 1).getGradient());
        // edge midpoints see the center
        assertEquals(40.0, out.getCell(0, 1).getGradient());
        assertEquals(40.0, out.getCell(1, 0).getGradient());
        assertEquals(40.0, out.getCell(1, 2).getGradient());
        assertEquals(40.0, out.getCell(2, 1).getGradient());
        // corners only see 50-valued neighbors
        assertEquals(0.0, out.getCell(0, 0).getGradient());
        assertEquals(0.0, out.getCell(0, 2).getGradient());
        assertEquals(0.0, out.getCell(2, 0).getGradient());
        assertEquals(0.0, out.getCell(2, 2).getGradient());

        // values untouched, input untouched
        assertArrayEquals(raw.toValues(), out.toValues());
        assertEquals(0.0, raw.getCell(1, 1).getGradient());
    }

    @Test
    public void testUniformGridHasZeroGradient() {
        Grid raw = Grid.fromValues(new double[][] { { 3.3, 3.3, 3.3 }, { 3.3, 3.3, 3.3 } });
        Grid out = estimator.estimate(raw);
        for (int r = 0; r < out.getRows(); r++) {
            for (int c = 0; c < out.getCols(); c++) {
                assertEquals(0.0, out.getCell(r, c).getGradient());
            }
        }
    }

    @Test
    public void testSingleCellAndSingleRow() {
        assertEquals(0.0, estimator.estimate(Grid.fromValues(new double[][] { { 12.0 } })).getCell(0, 0).getGradient());

        Grid row = estimator.estimate(Grid.fromValues(new double[][] { { 1.0, 4.0, 2.0 } }));
        assertEquals(3.0, row.getCell(0, 0).getGradient());
        assertEquals(3.0, row.getCell(0, 1).getGradient());
        assertEquals(2.0, row.getCell(0, 2).getGradient());

        Grid col = estimator.estimate(Grid.fromValues(new double[][] { { -1.0 }, { 1.0 } }));
        assertEquals(2.0, col.getCell(0, 0).getGradient());
        assertEquals(2.0, col.getCell(1, 0).getGradient());
    }

    @Test
    public void testCarriesDiagnostics() {
        Grid raw = Grid.fromValues(new double[][] { { 1.0, 2.0 } });
        raw.getCell(0, 0).setAdaptivePasses(4.0);
        raw.getCell(0, 1).setBlendFactor(0.3);

        Grid out = estimator.estimate(raw);
        assertEquals(4.0, out.getCell(0, 0).getAdaptivePasses());
        assertEquals(0.3, out.getCell(0, 1).getBlendFactor());
    }
}
