package com.battleship.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Size of a board ({@code rows x cols}).
 * <p>
 * This is the only board information a CPU strategy gets to see; ship layout
 * stays inside {@link Grid}.
 */
public record BoardDimensions(int rows, int cols) {

    public BoardDimensions {
        if (rows < 1 || cols < 1) {
            throw new IllegalArgumentException("Board must have at least one row and column, got "
                    + rows + "x" + cols);
        }
    }

    public static BoardDimensions square(int size) {
        return new BoardDimensions(size, size);
    }

    public boolean contains(Coordinate coordinate) {
        return coordinate.row() >= 0 && coordinate.row() < rows
                && coordinate.col() >= 0 && coordinate.col() < cols;
    }

    public int cellCount() {
        return rows * cols;
    }

    /**
     * All cells in row-major order.
     */
    public List<Coordinate> cells() {
        List<Coordinate> cells = new ArrayList<>(cellCount());
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                cells.add(new Coordinate(r, c));
            }
        }
        return Collections.unmodifiableList(cells);
    }

    /**
     * In-bounds orthogonal neighbours, in {@link Coordinate#neighbors()} order.
     */
    public List<Coordinate> neighborsOf(Coordinate coordinate) {
        return coordinate.neighbors().stream()
                .filter(this::contains)
                .toList();
    }

    @Override
    public String toString() {
        return rows + "x" + cols;
    }
}
