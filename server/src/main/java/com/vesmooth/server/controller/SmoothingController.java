package com.vesmooth.server.controller;

import com.vesmooth.server.grid.Cell;
import com.vesmooth.server.grid.Grid;
import com.vesmooth.server.grid.InvalidGridException;
import com.vesmooth.server.grid.pipeline.GridMetrics;
import com.vesmooth.server.grid.pipeline.PipelineResult;
import com.vesmooth.server.grid.pipeline.PipelineStage;
import com.vesmooth.server.grid.pipeline.SmoothingPipeline;
import com.vesmooth.server.service.GridSmoothingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
public class SmoothingController {

    private static final Logger logger = LoggerFactory.getLogger(SmoothingController.class);
    private final GridSmoothingService smoothingService;

    public SmoothingController(GridSmoothingService smoothingService) {
        this.smoothingService = smoothingService;
    }

    public static class SmoothingRequest {
        public double[][] values;
        // optional overrides of the configured pipeline parameters
        public Integer smoothingPasses;
        public Double gradientThreshold;
    }

    public static class StageView {
        public String stage;
        public String title;
        public Cell[][] grid;
        public GridMetrics.Summary metrics;
    }

    public static class SmoothingResponse {
        public int rows;
        public int cols;
        public int smoothingPasses;
        public double gradientThreshold;
        public List<StageView> stages;
    }

    @PostMapping("/smooth-grid")
    public ResponseEntity<SmoothingResponse> smooth(@RequestBody SmoothingRequest request) {
        if (request == null) {
            throw new InvalidGridException("input", "Missing request body");
        }
        PipelineResult result = smoothingService.smooth(request.values, request.smoothingPasses,
                request.gradientThreshold);
        logger.info("Smoothed {} grid with passes={}, threshold={}", result.getRaw(), result.getSmoothingPasses(),
                result.getGradientThreshold());
        return ResponseEntity.ok(toResponse(result));
    }

    @GetMapping("/smoothing-config")
    public Map<String, Object> config() {
        SmoothingPipeline pipeline = smoothingService.getDefaultPipeline();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("smoothingPasses", pipeline.getSmoothingPasses());
        body.put("gradientThreshold", pipeline.getGradientThreshold());
        body.put("cacheEnabled", smoothingService.isCacheEnabled());
        return body;
    }

    @ExceptionHandler(InvalidGridException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidGrid(InvalidGridException e) {
        logger.warn("Rejected smoothing request: {}", e.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("stage", e.getStage());
        if (e.getRow() >= 0) {
            body.put("row", e.getRow());
            body.put("col", e.getCol());
        }
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException e) {
        logger.warn("Rejected unreadable smoothing request: {}", e.getMostSpecificCause().getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Malformed request body: " + e.getMostSpecificCause().getMessage());
        body.put("stage", "input");
        return ResponseEntity.badRequest().body(body);
    }

    static SmoothingResponse toResponse(PipelineResult result) {
        Grid raw = result.getRaw();
        SmoothingResponse response = new SmoothingResponse();
        response.rows = raw.getRows();
        response.cols = raw.getCols();
        response.smoothingPasses = result.getSmoothingPasses();
        response.gradientThreshold = result.getGradientThreshold();
        response.stages = new ArrayList<>();
        for (PipelineStage stage : PipelineStage.values()) {
            Grid g = result.getStage(stage);
            StageView view = new StageView();
            view.stage = stage.getId();
            view.title = stage.getTitle();
            view.grid = g.getCells();
            view.metrics = GridMetrics.summarize(g, raw);
            response.stages.add(view);
        }
        return response;
    }
}
