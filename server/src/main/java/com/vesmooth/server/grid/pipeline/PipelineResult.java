package com.vesmooth.server.grid.pipeline;

import com.vesmooth.server.grid.Grid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Snapshots of one pipeline run: the raw grid followed by one grid per stage.
 */
public class PipelineResult {
    private final List<Grid> stages;
    private final int smoothingPasses;
    private final double gradientThreshold;

    public PipelineResult(List<Grid> stages, int smoothingPasses, double gradientThreshold) {
        if (stages == null || stages.size() != PipelineStage.values().length) {
            throw new IllegalArgumentException("Expected " + PipelineStage.values().length + " stage grids");
        }
        this.stages = Collections.unmodifiableList(new ArrayList<>(stages));
        this.smoothingPasses = smoothingPasses;
        this.gradientThreshold = gradientThreshold;
    }

    public List<Grid> getStages() {
        return stages;
    }

    public Grid getStage(PipelineStage stage) {
        return stages.get(stage.index());
    }

    public Grid getRaw() {
        return getStage(PipelineStage.RAW);
    }

    public Grid getFinal() {
        return getStage(PipelineStage.REFINEMENT);
    }

    public int getSmoothingPasses() {
        return smoothingPasses;
    }

    public double getGradientThreshold() {
        return gradientThreshold;
    }

    @Override
    public String toString() {
        return "PipelineResult{" +
                "shape=" + getRaw() +
                ", smoothingPasses=" + smoothingPasses +
                ", gradientThreshold=" + gradientThreshold +
                '}';
    }
}
