package com.vesmooth.server.controller;

import com.vesmooth.server.grid.InvalidGridException;
import com.vesmooth.server.grid.pipeline.PipelineConfigLoader;
import com.vesmooth.server.service.GridSmoothingService;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SmoothingControllerTest {

    private final SmoothingController controller = new SmoothingController(
            new GridSmoothingService(new PipelineConfigLoader.ConfigRoot(), null));

    @Test
    public void testSmoothReturnsAllStages() {
        SmoothingController.SmoothingRequest request = new SmoothingController.SmoothingRequest();
        request.values = new double[][] { { 50, 50, 50 }, { 50, 90, 50 }, { 50, 50, 50 } };
        request.gradientThreshold = 2.5;

        ResponseEntity<SmoothingController.SmoothingResponse> response = controller.smooth(request);
        assertEquals(HttpStatus.OK, response.getStatusCode());

        SmoothingController.SmoothingResponse body = response.getBody();
        assertNotNull(body);
        assertEquals(3, body.rows);
        assertEquals(3, body.cols);
        assertEquals(2, body.smoothingPasses);
        assertEquals(2.5, body.gradientThreshold);
        assertEquals(5, body.stages.size());
        assertEquals("raw", body.stages.get(0).stage);
        assertEquals("refinement", body.stages.get(4).stage);
        assertEquals(40.0, body.stages.get(1).grid[1][1].getGradient());
        assertEquals(0.0, body.stages.get(0).metrics.getEnergy());
        assertTrue(body.stages.get(4).metrics.getRoughness() < body.stages.get(0).metrics.getRoughness());
    }

    @Test
    public void testInvalidGridMapsToBadRequest() {
        SmoothingController.SmoothingRequest request = new SmoothingController.SmoothingRequest();
        request.values = new double[][] { { 1.0, Double.NaN } };

        InvalidGridException e = assertThrows(InvalidGridException.class, () -> controller.smooth(request));
        ResponseEntity<Map<String, Object>> response = controller.handleInvalidGrid(e);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("input", response.getBody().get("stage"));
        assertEquals(0, response.getBody().get("row"));
        assertEquals(1, response.getBody().get("col"));
    }

    @Test
    public void testConfigEndpoint() {
        Map<String, Object> config = controller.config();
        assertEquals(2, config.get("smoothingPasses"));
        assertEquals(1.0, config.get("gradientThreshold"));
        assertEquals(false, config.get("cacheEnabled"));
    }
}
