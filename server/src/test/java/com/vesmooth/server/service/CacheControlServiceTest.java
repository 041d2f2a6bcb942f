package com.vesmooth.server.service;

import com.vesmooth.db.GridInput;
import com.vesmooth.db.GridInputDao;
import com.vesmooth.db.SqliteInitializer;
import com.vesmooth.db.StageSnapshotDao;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class CacheControlServiceTest {

    @TempDir
    Path tempDir;

    @Test
    public void testClearParamsAndClearAll() throws Exception {
        String dbPath = tempDir.resolve("control.db").toString();
        SqliteInitializer.initialize(dbPath);
        GridInput in = new GridInputDao(dbPath).getOrCreateByHash("h", 1, 1);
        StageSnapshotDao snapshots = new StageSnapshotDao(dbPath);
        snapshots.upsertSnapshot(in.getId(), "passes=2;threshold=1.0", 0, new double[] { 1, 0, 0, 0 });
        snapshots.upsertSnapshot(in.getId(), "passes=2;threshold=2.5", 0, new double[] { 1, 0, 0, 0 });

        CacheControlService control = new CacheControlService(dbPath);
        assertEquals(1, control.clearParams(2, 1.0));
        assertTrue(snapshots.loadSnapshots(in.getId(), "passes=2;threshold=1.0").isEmpty());
        assertEquals(1, snapshots.loadSnapshots(in.getId(), "passes=2;threshold=2.5").size());

        assertEquals(1, control.clearAll());
    }

    @Test
    public void testClearOnFreshDatabase() {
        CacheControlService control = new CacheControlService(tempDir.resolve("fresh.db").toString());
        assertEquals(0, control.clearAll());
    }
}
