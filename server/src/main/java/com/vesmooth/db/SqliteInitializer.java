package com.vesmooth.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class SqliteInitializer {

    public static void initialize(String dbPath) throws SQLException {
        String url = "jdbc:sqlite:" + dbPath;
        try (Connection conn = DriverManager.getConnection(url)) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA journal_mode = WAL;");

                // One row per distinct input grid
                stmt.execute("CREATE TABLE IF NOT EXISTS grid_input (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                        "input_hash TEXT NOT NULL UNIQUE, " +
                        "row_count INTEGER NOT NULL, " +
                        "col_count INTEGER NOT NULL, " +
                        "created_ts INTEGER NOT NULL" +
                        ");");

                // One row per (input, parameters, stage)
                stmt.execute("CREATE TABLE IF NOT EXISTS stage_snapshot (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                        "input_id INTEGER NOT NULL, " +
                        "params_key TEXT NOT NULL, " +
                        "stage_index INTEGER NOT NULL, " +
                        "cells_blob BLOB NOT NULL, " +
                        "created_ts INTEGER NOT NULL, " +
                        "UNIQUE (input_id, params_key, stage_index), " +
                        "FOREIGN KEY (input_id) REFERENCES grid_input(id) ON DELETE CASCADE" +
                        ");");

                stmt.execute("CREATE INDEX IF NOT EXISTS idx_snapshot_lookup " +
                        "ON stage_snapshot (params_key, input_id, stage_index);");
            }
        }
    }
}
