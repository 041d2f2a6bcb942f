package com.vesmooth.db;

import java.sql.*;
import java.util.Optional;

public class GridInputDao {

    private final String dbPath;

    public GridInputDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    public GridInput getOrCreateByHash(String inputHash, int rows, int cols) throws SQLException {
        try (Connection conn = connect()) {
            Optional<GridInput> existing = findByHashInternal(conn, inputHash);
            if (existing.isPresent()) {
                return existing.get();
            }

            long now = System.currentTimeMillis();
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO grid_input (input_hash, row_count, col_count, created_ts) VALUES (?, ?, ?, ?)",
                    Statement.RETURN_GENERATED_KEYS)) {
                ps.setString(1, inputHash);
                ps.setInt(2, rows);
                ps.setInt(3, cols);
                ps.setLong(4, now);
                ps.executeUpdate();

                try (ResultSet rs = ps.getGeneratedKeys()) {
                    if (rs.next()) {
                        return new GridInput(rs.getLong(1), inputHash, rows, cols, now);
                    } else {
                        throw new SQLException("Creating grid_input failed, no ID obtained.");
                    }
                }
            } catch (SQLException e) {
                // Another writer inserted the same hash in between
                if (e.getMessage() != null && e.getMessage().contains("UNIQUE constraint failed")) {
                    return findByHashInternal(conn, inputHash)
                            .orElseThrow(() -> new SQLException(
                                    "Failed to find grid input after UNIQUE constraint violation", e));
                }
                throw e;
            }
        }
    }

    public Optional<GridInput> findByHash(String inputHash) throws SQLException {
        try (Connection conn = connect()) {
            return findByHashInternal(conn, inputHash);
        }
    }

    private Optional<GridInput> findByHashInternal(Connection conn, String inputHash) throws SQLException {
        String sql = "SELECT id, input_hash, row_count, col_count, created_ts FROM grid_input WHERE input_hash = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, inputHash);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new GridInput(
                            rs.getLong("id"),
                            rs.getString("input_hash"),
                            rs.getInt("row_count"),
                            rs.getInt("col_count"),
                            rs.getLong("created_ts")));
                }
            }
        }
        return Optional.empty();
    }
}
