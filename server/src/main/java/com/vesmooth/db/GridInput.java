package com.vesmooth.db;

public class GridInput {
    private final long id;
    private final String inputHash;
    private final int rows;
    private final int cols;
    private final long createdTs;

    public GridInput(long id, String inputHash, int rows, int cols, long createdTs) {
        this.id = id;
        this.inputHash = inputHash;
        this.rows = rows;
        this.cols = cols;
        this.createdTs = createdTs;
    }

    public long getId() {
        return id;
    }

    public String getInputHash() {
        return inputHash;
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    public long getCreatedTs() {
        return createdTs;
    }

    @Override
    public String toString() {
        return "GridInput{id=" + id + ", shape=" + rows + "x" + cols + "}";
    }
}
