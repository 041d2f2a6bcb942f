package com.vesmooth.server.grid.pipeline;

import com.vesmooth.db.GridInput;
import com.vesmooth.db.GridInputDao;
import com.vesmooth.db.StageSnapshotDao;
import com.vesmooth.server.grid.Cell;
import com.vesmooth.server.grid.Grid;
import com.vesmooth.server.grid.InvalidGridException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wraps a {@link SmoothingPipeline} with a SQLite backed cache of stage
 * snapshots, keyed by a hash of the input values and the pipeline
 * parameters. Falls back to direct computation on database errors.
 */
public class CachedSmoothingPipeline {

    private static final Logger logger = LoggerFactory.getLogger(CachedSmoothingPipeline.class);

    // value, gradient, adaptivePasses, blendFactor
    static final int FIELDS_PER_CELL = 4;

    private final SmoothingPipeline delegate;
    private final GridInputDao inputDao;
    private final StageSnapshotDao snapshotDao;

    public CachedSmoothingPipeline(SmoothingPipeline delegate, GridInputDao inputDao, StageSnapshotDao snapshotDao) {
        this.delegate = delegate;
        this.inputDao = inputDao;
        this.snapshotDao = snapshotDao;
    }

    public PipelineResult run(Grid rawGrid) {
        if (rawGrid == null) {
            throw new InvalidGridException(PipelineStage.RAW.getId(), "Grid must not be null");
        }
        // invalid input must never reach the cache
        rawGrid.requireFinite(PipelineStage.RAW.getId());

        String paramsKey = delegate.paramsKey();
        String hash = hashValues(rawGrid);
        try {
            GridInput input = inputDao.getOrCreateByHash(hash, rawGrid.getRows(), rawGrid.getCols());

            Map<Integer, double[]> stored = snapshotDao.loadSnapshots(input.getId(), paramsKey);
            List<Grid> cached = decodeAll(stored, rawGrid.getRows(), rawGrid.getCols());
            if (cached != null) {
                logger.debug("Cache HIT for grid {} params {}", hash, paramsKey);
                return new PipelineResult(cached, delegate.getSmoothingPasses(), delegate.getGradientThreshold());
            }

            logger.debug("Cache MISS for grid {} params {}", hash, paramsKey);
            PipelineResult result = delegate.run(rawGrid);

            Map<Integer, double[]> snapshots = new LinkedHashMap<>();
            for (PipelineStage stage : PipelineStage.values()) {
                snapshots.put(stage.index(), encode(result.getStage(stage)));
            }
            snapshotDao.upsertAll(input.getId(), paramsKey, snapshots);

            return result;

        } catch (SQLException e) {
            logger.error("Database error in CachedSmoothingPipeline, falling back to direct computation", e);
            return delegate.run(rawGrid);
        }
    }

    private static List<Grid> decodeAll(Map<Integer, double[]> stored, int rows, int cols) {
        int expected = rows * cols * FIELDS_PER_CELL;
        List<Grid> grids = new ArrayList<>();
        for (PipelineStage stage : PipelineStage.values()) {
            double[] cells = stored.get(stage.index());
            if (cells == null || cells.length != expected) {
                return null;
            }
            grids.add(decode(cells, rows, cols));
        }
        return grids;
    }

    static double[] encode(Grid grid) {
        double[] out = new double[grid.getRows() * grid.getCols() * FIELDS_PER_CELL];
        int i = 0;
        for (int r = 0; r < grid.getRows(); r++) {
            for (int c = 0; c < grid.getCols(); c++) {
                Cell cell = grid.getCell(r, c);
                out[i++] = cell.getValue();
                out[i++] = cell.getGradient();
                out[i++] = cell.getAdaptivePasses();
                out[i++] = cell.getBlendFactor();
            }
        }
        return out;
    }

    static Grid decode(double[] cells, int rows, int cols) {
        double[][] values = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                values[r][c] = cells[(r * cols + c) * FIELDS_PER_CELL];
            }
        }
        Grid grid = Grid.fromValues(values);
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                int base = (r * cols + c) * FIELDS_PER_CELL;
                Cell cell = grid.getCell(r, c);
                cell.setGradient(cells[base + 1]);
                cell.setAdaptivePasses(cells[base + 2]);
                cell.setBlendFactor(cells[base + 3]);
            }
        }
        return grid;
    }

    /**
     * SHA-256 over the shape and the exact bits of every value.
     */
    public static String hashValues(Grid grid) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            ByteBuffer buf = ByteBuffer.allocate(Long.BYTES);
            digest.update(buf.putInt(0, grid.getRows()).putInt(4, grid.getCols()).array());
            for (int r = 0; r < grid.getRows(); r++) {
                for (int c = 0; c < grid.getCols(); c++) {
                    buf.clear();
                    buf.putLong(0, Double.doubleToLongBits(grid.getValue(r, c)));
                    digest.update(buf.array());
                }
            }
            byte[] hash = digest.digest();
            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1)
                    hexString.append('0');
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
