package com.battleship.model;

import java.util.List;

/**
 * A cell position on a board, 0-based.
 *
 * @param row row index, {@code 0} is the top row ("A")
 * @param col column index, {@code 0} is the left-most column ("1")
 */
public record Coordinate(int row, int col) {

    public static Coordinate of(int row, int col) {
        return new Coordinate(row, col);
    }

    /**
     * The four orthogonal neighbours in probing order: right, left, down, up.
     * Bounds are not checked here, see {@link BoardDimensions#neighborsOf(Coordinate)}.
     */
    public List<Coordinate> neighbors() {
        return List.of(
                new Coordinate(row, col + 1),
                new Coordinate(row, col - 1),
                new Coordinate(row + 1, col),
                new Coordinate(row - 1, col));
    }

    public Coordinate offset(int rowDelta, int colDelta) {
        return new Coordinate(row + rowDelta, col + colDelta);
    }

    public boolean hasParity(int parity) {
        return Math.floorMod(row + col, 2) == parity;
    }
}
