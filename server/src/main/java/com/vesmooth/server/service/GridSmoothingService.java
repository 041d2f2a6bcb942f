package com.vesmooth.server.service;

import com.vesmooth.db.GridInputDao;
import com.vesmooth.db.SqliteInitializer;
import com.vesmooth.db.StageSnapshotDao;
import com.vesmooth.server.grid.Grid;
import com.vesmooth.server.grid.pipeline.CachedSmoothingPipeline;
import com.vesmooth.server.grid.pipeline.PipelineConfigLoader;
import com.vesmooth.server.grid.pipeline.PipelineResult;
import com.vesmooth.server.grid.pipeline.SmoothingPipeline;
import com.vesmooth.server.util.DataPathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.sql.SQLException;

@Service
public class GridSmoothingService {

    private static final Logger logger = LoggerFactory.getLogger(GridSmoothingService.class);

    private final PipelineConfigLoader.ConfigRoot config;
    private final SmoothingPipeline defaultPipeline;

    // null when caching is disabled
    private final GridInputDao inputDao;
    private final StageSnapshotDao snapshotDao;

    public GridSmoothingService() {
        this(PipelineConfigLoader.loadDefault(), null);
    }

    /**
     * @param dbPath cache database location, resolved from the data directory
     *               when null
     */
    public GridSmoothingService(PipelineConfigLoader.ConfigRoot config, String dbPath) {
        this.config = config != null ? config : new PipelineConfigLoader.ConfigRoot();
        this.defaultPipeline = PipelineConfigLoader.createPipeline(this.config);

        if (this.config.cacheEnabled()) {
            String path = dbPath != null ? dbPath
                    : DataPathResolver.resolveDbPath(this.config.cache.dbFileName);
            try {
                SqliteInitializer.initialize(path);
                logger.info("Initialized SQLite smoothing cache at {}", path);
            } catch (SQLException e) {
                logger.error("Failed to initialize SQLite", e);
                throw new RuntimeException(e);
            }
            this.inputDao = new GridInputDao(path);
            this.snapshotDao = new StageSnapshotDao(path);
        } else {
            this.inputDao = null;
            this.snapshotDao = null;
        }

        logger.info("GridSmoothingService ready: passes={}, threshold={}, cacheEnabled={}",
                defaultPipeline.getSmoothingPasses(), defaultPipeline.getGradientThreshold(), isCacheEnabled());
    }

    public boolean isCacheEnabled() {
        return inputDao != null;
    }

    public SmoothingPipeline getDefaultPipeline() {
        return defaultPipeline;
    }

    public PipelineResult smooth(double[][] values) {
        return smooth(values, null, null);
    }

    /**
     * Runs the pipeline, overriding the configured pass count and gradient
     * threshold where the arguments are non-null.
     */
    public PipelineResult smooth(double[][] values, Integer smoothingPasses, Double gradientThreshold) {
        Grid raw = Grid.fromValues(values);
        SmoothingPipeline pipeline = pipelineFor(smoothingPasses, gradientThreshold);

        if (isCacheEnabled()) {
            return new CachedSmoothingPipeline(pipeline, inputDao, snapshotDao).run(raw);
        }
        return pipeline.run(raw);
    }

    private SmoothingPipeline pipelineFor(Integer smoothingPasses, Double gradientThreshold) {
        if (smoothingPasses == null && gradientThreshold == null) {
            return defaultPipeline;
        }
        int passes = smoothingPasses != null ? smoothingPasses : defaultPipeline.getSmoothingPasses();
        double threshold = gradientThreshold != null ? gradientThreshold : defaultPipeline.getGradientThreshold();
        return new SmoothingPipeline(passes, threshold);
    }
}
