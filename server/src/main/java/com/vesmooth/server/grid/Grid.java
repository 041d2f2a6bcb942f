package com.vesmooth.server.grid;

/**
 * Dense, fixed-size, row-major matrix of {@link Cell}s.
 * Rows are engine speed bins and columns are load bins; the shape never
 * changes once the grid is built.
 */
public class Grid {

    private final int rows;
    private final int cols;
    private final Cell[][] cells;

    private Grid(Cell[][] cells) {
        this.rows = cells.length;
        this.cols = cells[0].length;
        this.cells = cells;
    }

    /**
     * Builds a grid from raw values. Rejects empty, ragged and non-finite
     * input without coercing anything.
     */
    public static Grid fromValues(double[][] values) {
        String stage = "input";
        if (values == null || values.length == 0) {
            throw new InvalidGridException(stage, "Grid must have at least one row");
        }
        if (values[0] == null || values[0].length == 0) {
            throw new InvalidGridException(stage, "Grid must have at least one column");
        }
        int cols = values[0].length;
        Cell[][] cells = new Cell[values.length][cols];
        for (int r = 0; r < values.length; r++) {
            if (values[r] == null || values[r].length != cols) {
                int len = values[r] == null ? 0 : values[r].length;
                throw new InvalidGridException(stage,
                        "Ragged grid: row " + r + " has " + len + " columns, expected " + cols);
            }
            for (int c = 0; c < cols; c++) {
                double v = values[r][c];
                if (!Double.isFinite(v)) {
                    throw new InvalidGridException(stage, r, c, "Non-finite value " + v);
                }
                cells[r][c] = new Cell(v);
            }
        }
        return new Grid(cells);
    }

    /**
     * Deep, cell-by-cell copy.
     */
    public Grid copy() {
        Cell[][] copied = new Cell[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                copied[r][c] = cells[r][c].copy();
            }
        }
        return new Grid(copied);
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    public Cell[][] getCells() {
        return cells;
    }

    public Cell getCell(int r, int c) {
        return cells[r][c];
    }

    public double getValue(int r, int c) {
        return cells[r][c].getValue();
    }

    public boolean contains(int r, int c) {
        return r >= 0 && r < rows && c >= 0 && c < cols;
    }

    public boolean sameShape(Grid other) {
        return other != null && other.rows == rows && other.cols == cols;
    }

    public double[][] toValues() {
        double[][] values = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                values[r][c] = cells[r][c].getValue();
            }
        }
        return values;
    }

    /**
     * Fails with the given stage name on the first NaN or infinite value.
     */
    public void requireFinite(String stage) {
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                double v = cells[r][c].getValue();
                if (!Double.isFinite(v)) {
                    throw new InvalidGridException(stage, r, c, "Non-finite value " + v);
                }
            }
        }
    }

    @Override
    public String toString() {
        return "Grid{" + rows + "x" + cols + "}";
    }
}
