package com.vesmooth.server.service;

import com.vesmooth.server.grid.InvalidGridException;
import com.vesmooth.server.grid.pipeline.PipelineConfigLoader;
import com.vesmooth.server.grid.pipeline.PipelineResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class GridSmoothingServiceTest {

    @TempDir
    Path tempDir;

    private static final double[][] SPIKE = { { 50, 50, 50 }, { 50, 90, 50 }, { 50, 50, 50 } };

    private static PipelineConfigLoader.ConfigRoot config(String json) throws Exception {
        return PipelineConfigLoader.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void testUsesClasspathConfigByDefault() {
        GridSmoothingService service = new GridSmoothingService();
        // test smoothing_config.json: passes 3, threshold 1.5, cache off
        assertEquals(3, service.getDefaultPipeline().getSmoothingPasses());
        assertEquals(1.5, service.getDefaultPipeline().getGradientThreshold());
        assertFalse(service.isCacheEnabled());

        PipelineResult result = service.smooth(SPIKE);
        assertEquals(3, result.getSmoothingPasses());
        assertEquals(5, result.getStages().size());
    }

    @Test
    public void testRequestOverrides() throws Exception {
        GridSmoothingService service = new GridSmoothingService(config("{}"), null);

        PipelineResult result = service.smooth(SPIKE, 2, 2.5);
        assertEquals(2, result.getSmoothingPasses());
        assertEquals(2.5, result.getGradientThreshold());
        assertEquals(71.438009694721, result.getFinal().getValue(1, 1), 1e-9);

        result = service.smooth(SPIKE, null, 4.0);
        assertEquals(2, result.getSmoothingPasses());
        assertEquals(4.0, result.getGradientThreshold());
    }

    @Test
    public void testCachedServiceMatchesDirect() throws Exception {
        Path db = tempDir.resolve("service_cache.db");
        GridSmoothingService cached = new GridSmoothingService(config("{\"cache\": {\"enabled\": true}}"),
                db.toString());
        GridSmoothingService direct = new GridSmoothingService(config("{}"), null);

        assertTrue(cached.isCacheEnabled());
        assertTrue(Files.exists(db));

        double[][] a = cached.smooth(SPIKE).getFinal().toValues();
        double[][] b = cached.smooth(SPIKE).getFinal().toValues();
        double[][] c = direct.smooth(SPIKE).getFinal().toValues();
        assertArrayEquals(c, a);
        assertArrayEquals(c, b);
    }

    @Test
    public void testInvalidInput() throws Exception {
        GridSmoothingService service = new GridSmoothingService(config("{}"), null);
        assertThrows(InvalidGridException.class, () -> service.smooth(new double[][] { { 1.0, 2.0 }, { 3.0 } }));
        assertThrows(InvalidGridException.class, () -> service.smooth(SPIKE, -2, null));
        assertThrows(InvalidGridException.class, () -> service.smooth(SPIKE, null, -1.0));
    }
}
