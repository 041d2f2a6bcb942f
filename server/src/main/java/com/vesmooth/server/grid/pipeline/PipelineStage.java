package com.vesmooth.server.grid.pipeline;

/**
 * The five snapshots retained by a pipeline run, in execution order.
 */
public enum PipelineStage {
    RAW("raw", "Raw table"),
    GRADIENT("gradient", "Gradient detection"),
    ADAPTIVE_SMOOTHING("adaptive_smoothing", "Adaptive smoothing"),
    EDGE_BLENDING("edge_blending", "Gradient blending"),
    REFINEMENT("refinement", "Final refinement");

    private final String id;
    private final String title;

    PipelineStage(String id, String title) {
        this.id = id;
        this.title = title;
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public int index() {
        return ordinal();
    }
}
