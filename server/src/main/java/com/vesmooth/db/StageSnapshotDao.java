package com.vesmooth.db;

import com.vesmooth.util.DoubleArrayCodec;

import java.sql.*;
import java.util.Map;
import java.util.TreeMap;

public class StageSnapshotDao {

    private final String dbPath;

    public StageSnapshotDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    /**
     * Returns the stored snapshots for one input and parameter set, keyed by
     * stage index in ascending order. Empty if nothing is stored.
     */
    public Map<Integer, double[]> loadSnapshots(long inputId, String paramsKey) throws SQLException {
        String sql = "SELECT stage_index, cells_blob FROM stage_snapshot " +
                "WHERE input_id = ? AND params_key = ? ORDER BY stage_index";
        Map<Integer, double[]> snapshots = new TreeMap<>();
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, inputId);
            ps.setString(2, paramsKey);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    snapshots.put(rs.getInt("stage_index"), DoubleArrayCodec.fromBytes(rs.getBytes("cells_blob")));
                }
            }
        }
        return snapshots;
    }

    public void upsertSnapshot(long inputId, String paramsKey, int stageIndex, double[] cells) throws SQLException {
        byte[] blob = DoubleArrayCodec.toBytes(cells);
        long now = System.currentTimeMillis();
        String sql = "INSERT INTO stage_snapshot (input_id, params_key, stage_index, cells_blob, created_ts) " +
                "VALUES (?, ?, ?, ?, ?) " +
                "ON CONFLICT(input_id, params_key, stage_index) DO UPDATE SET " +
                "cells_blob = excluded.cells_blob, created_ts = excluded.created_ts";

        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, inputId);
            ps.setString(2, paramsKey);
            ps.setInt(3, stageIndex);
            ps.setBytes(4, blob);
            ps.setLong(5, now);
            ps.executeUpdate();
        }
    }

    /**
     * Stores all snapshots of one run in a single transaction.
     */
    public void upsertAll(long inputId, String paramsKey, Map<Integer, double[]> snapshots) throws SQLException {
        String sql = "INSERT INTO stage_snapshot (input_id, params_key, stage_index, cells_blob, created_ts) " +
                "VALUES (?, ?, ?, ?, ?) " +
                "ON CONFLICT(input_id, params_key, stage_index) DO UPDATE SET " +
                "cells_blob = excluded.cells_blob, created_ts = excluded.created_ts";
        long now = System.currentTimeMillis();

        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                for (Map.Entry<Integer, double[]> e : snapshots.entrySet()) {
                    ps.setLong(1, inputId);
                    ps.setString(2, paramsKey);
                    ps.setInt(3, e.getKey());
                    ps.setBytes(4, DoubleArrayCodec.toBytes(e.getValue()));
                    ps.setLong(5, now);
                    ps.addBatch();
                }
                ps.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        }
    }

    public int deleteByParams(String paramsKey) throws SQLException {
        String sql = "DELETE FROM stage_snapshot WHERE params_key = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, paramsKey);
            return ps.executeUpdate();
        }
    }

    public int deleteByInput(long inputId) throws SQLException {
        String sql = "DELETE FROM stage_snapshot WHERE input_id = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, inputId);
            return ps.executeUpdate();
        }
    }

    public int deleteAll() throws SQLException {
        try (Connection conn = connect();
                Statement stmt = conn.createStatement()) {
            return stmt.executeUpdate("DELETE FROM stage_snapshot");
        }
    }
}
