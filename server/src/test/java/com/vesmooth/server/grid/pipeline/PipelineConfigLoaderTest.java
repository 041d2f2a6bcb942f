package com.vesmooth.server.grid.pipeline;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class PipelineConfigLoaderTest {

    private static InputStream json(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testLoadsClasspathConfig() {
        InputStream is = getClass().getResourceAsStream("/smoothing_config.json");
        assertNotNull(is, "smoothing_config.json not found in test classpath");

        PipelineConfigLoader.ConfigRoot config = PipelineConfigLoader.loadDefault();
        // values from the test copy of smoothing_config.json
        assertEquals(3, config.smoothingPassesOrDefault());
        assertEquals(1.5, config.gradientThresholdOrDefault());
        assertFalse(config.cacheEnabled());
    }

    @Test
    public void testDefaultsForMissingSections() throws Exception {
        PipelineConfigLoader.ConfigRoot config = PipelineConfigLoader.load(json("{}"));
        assertEquals(PipelineConfigLoader.DEFAULT_SMOOTHING_PASSES, config.smoothingPassesOrDefault());
        assertEquals(PipelineConfigLoader.DEFAULT_GRADIENT_THRESHOLD, config.gradientThresholdOrDefault());
        assertFalse(config.cacheEnabled());

        config = PipelineConfigLoader.load(json("{\"pipeline\": {\"gradientThreshold\": 2.5}}"));
        assertEquals(2, config.smoothingPassesOrDefault());
        assertEquals(2.5, config.gradientThresholdOrDefault());
    }

    @Test
    public void testCreatePipeline() throws Exception {
        PipelineConfigLoader.ConfigRoot config = PipelineConfigLoader.load(json(
                "{\"pipeline\": {\"smoothingPasses\": 4, \"gradientThreshold\": 0.75}, \"cache\": {\"enabled\": true}}"));
        SmoothingPipeline pipeline = PipelineConfigLoader.createPipeline(config);
        assertEquals(4, pipeline.getSmoothingPasses());
        assertEquals(0.75, pipeline.getGradientThreshold());
        assertTrue(config.cacheEnabled());

        assertEquals(1.0, PipelineConfigLoader.createPipeline(null).getGradientThreshold());
    }
}
