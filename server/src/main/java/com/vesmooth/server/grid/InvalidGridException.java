package com.vesmooth.server.grid;

/**
 * Thrown when a grid or a stage parameter cannot be processed. Carries the
 * stage that rejected the input and, for cell level problems, the offending
 * coordinates (-1 when not applicable).
 */
public class InvalidGridException extends IllegalArgumentException {

    private final String stage;
    private final int row;
    private final int col;

    public InvalidGridException(String stage, String message) {
        this(stage, -1, -1, message);
    }

    public InvalidGridException(String stage, int row, int col, String message) {
        super(formatMessage(stage, row, col, message));
        this.stage = stage;
        this.row = row;
        this.col = col;
    }

    private static String formatMessage(String stage, int row, int col, String message) {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(stage).append("] ").append(message);
        if (row >= 0 && col >= 0) {
            sb.append(" at (").append(row).append(", ").append(col).append(')');
        }
        return sb.toString();
    }

    public String getStage() {
        return stage;
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }
}
