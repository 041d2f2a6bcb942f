package com.vesmooth.server.grid.pipeline;

import com.vesmooth.server.grid.Grid;
import com.vesmooth.server.grid.InvalidGridException;
import com.vesmooth.server.grid.stage.CoverageWeightedRefiner;
import com.vesmooth.server.grid.stage.EdgeRestoringBlender;
import com.vesmooth.server.grid.stage.GradientEstimator;
import com.vesmooth.server.grid.stage.VarianceAdaptiveSmoother;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Threads a grid through the four stages in fixed order and keeps every
 * intermediate grid. Does no numeric work itself.
 *
 * The gradient threshold is required here on purpose; the blender's own
 * default (2.5) is not used by the pipeline.
 */
public class SmoothingPipeline {
    private static final Logger logger = LoggerFactory.getLogger(SmoothingPipeline.class);

    private final GradientEstimator gradientEstimator = new GradientEstimator();
    private final VarianceAdaptiveSmoother smoother = new VarianceAdaptiveSmoother();
    private final EdgeRestoringBlender blender = new EdgeRestoringBlender();
    private final CoverageWeightedRefiner refiner = new CoverageWeightedRefiner();

    private final int smoothingPasses;
    private final double gradientThreshold;

    public SmoothingPipeline(int smoothingPasses, double gradientThreshold) {
        if (smoothingPasses < 0) {
            throw new InvalidGridException(VarianceAdaptiveSmoother.STAGE_NAME,
                    "smoothingPasses must be >= 0, got " + smoothingPasses);
        }
        if (!(gradientThreshold > 0.0) || Double.isInfinite(gradientThreshold)) {
            throw new InvalidGridException(EdgeRestoringBlender.STAGE_NAME,
                    "gradientThreshold must be positive and finite, got " + gradientThreshold);
        }
        this.smoothingPasses = smoothingPasses;
        this.gradientThreshold = gradientThreshold;
    }

    public int getSmoothingPasses() {
        return smoothingPasses;
    }

    public double getGradientThreshold() {
        return gradientThreshold;
    }

    /**
     * Key identifying the parameters of this pipeline, used to tell cached
     * runs with different settings apart.
     */
    public String paramsKey() {
        return "passes=" + smoothingPasses + ";threshold=" + Double.toString(gradientThreshold);
    }

    public PipelineResult run(double[][] values) {
        return run(Grid.fromValues(values));
    }

    public PipelineResult run(Grid rawGrid) {
        if (rawGrid == null) {
            throw new InvalidGridException(PipelineStage.RAW.getId(), "Grid must not be null");
        }
        rawGrid.requireFinite(PipelineStage.RAW.getId());

        long start = System.nanoTime();

        List<Grid> stages = new ArrayList<>(PipelineStage.values().length);
        Grid grid0 = rawGrid.copy();
        Grid grid1 = gradientEstimator.estimate(grid0);
        Grid grid2 = smoother.smooth(grid1, smoothingPasses);
        Grid grid3 = blender.blend(grid1, grid2, gradientThreshold);
        Grid grid4 = refiner.refine(grid3);

        stages.add(grid0);
        stages.add(grid1);
        stages.add(grid2);
        stages.add(grid3);
        stages.add(grid4);

        logger.info("Smoothing pipeline finished: grid={}, passes={}, threshold={}, elapsed={} us", rawGrid,
                smoothingPasses, gradientThreshold, (System.nanoTime() - start) / 1000);

        if (logger.isTraceEnabled()) {
            for (PipelineStage stage : PipelineStage.values()) {
                logger.trace("Stage {} metrics: {}", stage.getId(),
                        GridMetrics.summarize(stages.get(stage.index()), grid0));
            }
        }

        return new PipelineResult(stages, smoothingPasses, gradientThreshold);
    }
}
