package com.vesmooth.server.service;

import com.vesmooth.db.SqliteInitializer;
import com.vesmooth.db.StageSnapshotDao;
import com.vesmooth.server.grid.pipeline.PipelineConfigLoader;
import com.vesmooth.server.grid.pipeline.SmoothingPipeline;
import com.vesmooth.server.util.DataPathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.sql.SQLException;

@Service
public class CacheControlService {

    private static final Logger logger = LoggerFactory.getLogger(CacheControlService.class);

    private final String dbPath;
    private final StageSnapshotDao snapshotDao;

    public CacheControlService() {
        this(DataPathResolver.resolveDbPath(configuredDbFileName()));
    }

    public CacheControlService(String dbPath) {
        this.dbPath = dbPath;
        this.snapshotDao = new StageSnapshotDao(dbPath);
    }

    private static String configuredDbFileName() {
        PipelineConfigLoader.ConfigRoot config = PipelineConfigLoader.loadDefault();
        return config.cache != null ? config.cache.dbFileName : null;
    }

    /**
     * Clears all cached snapshots produced with the given parameters.
     * Use this when a parameter set is retired.
     */
    public int clearParams(int smoothingPasses, double gradientThreshold) {
        String paramsKey = new SmoothingPipeline(smoothingPasses, gradientThreshold).paramsKey();
        try {
            SqliteInitializer.initialize(dbPath);
            int deleted = snapshotDao.deleteByParams(paramsKey);
            logger.info("Cleared {} cached snapshots for {}", deleted, paramsKey);
            return deleted;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to clear smoothing cache for " + paramsKey, e);
        }
    }

    /**
     * Clears every cached snapshot. Use this when the algorithm changes.
     */
    public int clearAll() {
        try {
            SqliteInitializer.initialize(dbPath);
            int deleted = snapshotDao.deleteAll();
            logger.info("Cleared {} cached snapshots", deleted);
            return deleted;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to clear smoothing cache at " + dbPath, e);
        }
    }
}
