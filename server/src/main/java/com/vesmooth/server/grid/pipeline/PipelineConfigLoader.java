package com.vesmooth.server.grid.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

public class PipelineConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(PipelineConfigLoader.class);

    public static final String CONFIG_RESOURCE = "/smoothing_config.json";

    public static final int DEFAULT_SMOOTHING_PASSES = 2;
    // Threshold the pipeline runs with when nothing is configured. Lower than
    // the blender's documented 2.5.
    public static final double DEFAULT_GRADIENT_THRESHOLD = 1.0;

    public static class PipelineSection {
        public Integer smoothingPasses;
        public Double gradientThreshold;
    }

    public static class CacheSection {
        public Boolean enabled;
        public String dbFileName;
    }

    public static class ConfigRoot {
        public String smoothing_data_directory;
        public PipelineSection pipeline;
        public CacheSection cache;

        public int smoothingPassesOrDefault() {
            if (pipeline == null || pipeline.smoothingPasses == null) {
                return DEFAULT_SMOOTHING_PASSES;
            }
            return pipeline.smoothingPasses;
        }

        public double gradientThresholdOrDefault() {
            if (pipeline == null || pipeline.gradientThreshold == null) {
                return DEFAULT_GRADIENT_THRESHOLD;
            }
            return pipeline.gradientThreshold;
        }

        public boolean cacheEnabled() {
            return cache != null && Boolean.TRUE.equals(cache.enabled);
        }
    }

    public static ConfigRoot load(InputStream jsonStream) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        ConfigRoot config = mapper.readValue(jsonStream, ConfigRoot.class);
        return config != null ? config : new ConfigRoot();
    }

    /**
     * Reads {@value #CONFIG_RESOURCE} from the classpath. A missing or
     * unreadable file yields an empty config, i.e. all defaults.
     */
    public static ConfigRoot loadDefault() {
        try (InputStream is = PipelineConfigLoader.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (is == null) {
                logger.warn("{} not found on classpath, using defaults", CONFIG_RESOURCE);
                return new ConfigRoot();
            }
            ConfigRoot config = load(is);
            logger.info("Loaded smoothing config: passes={}, threshold={}, cache={}",
                    config.smoothingPassesOrDefault(), config.gradientThresholdOrDefault(), config.cacheEnabled());
            return config;
        } catch (IOException e) {
            logger.warn("Failed to read {}, using defaults: {}", CONFIG_RESOURCE, e.getMessage());
            return new ConfigRoot();
        }
    }

    public static SmoothingPipeline createPipeline(ConfigRoot config) {
        ConfigRoot cfg = config != null ? config : new ConfigRoot();
        return new SmoothingPipeline(cfg.smoothingPassesOrDefault(), cfg.gradientThresholdOrDefault());
    }
}
