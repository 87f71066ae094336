package com.battleship.config;

import com.battleship.model.BoardDimensions;

import java.util.List;

/**
 * Board configuration shared by both sides, loaded from a JSON file.
 *
 * @param id        unique slug, e.g. "small"
 * @param name      human-readable name shown in the menu
 * @param rows      board height
 * @param cols      board width
 * @param shipSizes length of every ship in the fleet, in placement order
 */
public record BoardPreset(
        String id,
        String name,
        int rows,
        int cols,
        List<Integer> shipSizes
) {

    public BoardDimensions dimensions() {
        return new BoardDimensions(rows, cols);
    }

    public int fleetCells() {
        return shipSizes.stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * Checks the preset can be played at all.
     *
     * @throws IllegalArgumentException describing the first problem found
     */
    public void validate() {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Preset id must not be blank");
        }
        if (rows < 1 || cols < 1) {
            throw new IllegalArgumentException("Preset '" + id + "' has an invalid size " + rows + "x" + cols);
        }
        if (shipSizes == null || shipSizes.isEmpty()) {
            throw new IllegalArgumentException("Preset '" + id + "' has no ships");
        }
        int longest = Math.max(rows, cols);
        for (Integer size : shipSizes) {
            if (size == null || size < 1 || size > longest) {
                throw new IllegalArgumentException("Preset '" + id + "' has a ship of size " + size
                        + " that does not fit a " + rows + "x" + cols + " board");
            }
        }
        if (fleetCells() > rows * cols) {
            throw new IllegalArgumentException("Preset '" + id + "' fleet needs more cells than the board has");
        }
    }

    public String label() {
        return name + " (" + rows + "x" + cols + ")";
    }
}
