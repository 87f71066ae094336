package com.battleship.model;

/**
 * Orientation of a ship on the board.
 */
public enum Orientation {
    HORIZONTAL(0, 1),
    VERTICAL(1, 0);

    private final int rowStep;
    private final int colStep;

    Orientation(int rowStep, int colStep) {
        this.rowStep = rowStep;
        this.colStep = colStep;
    }

    public int getRowStep() {
        return rowStep;
    }

    public int getColStep() {
        return colStep;
    }

    /**
     * Parses the console shorthand: {@code h} / {@code v} (or the full name).
     */
    public static Orientation fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Orientation must be 'h' or 'v'");
        }
        return switch (label.trim().toLowerCase()) {
            case "h", "horizontal" -> HORIZONTAL;
            case "v", "vertical" -> VERTICAL;
            default -> throw new IllegalArgumentException("Orientation must be 'h' or 'v', got: " + label);
        };
    }
}
