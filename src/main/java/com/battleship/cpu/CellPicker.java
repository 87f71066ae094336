package com.battleship.cpu;

import com.battleship.model.Coordinate;

import java.util.List;
import java.util.Random;

/**
 * Uniform, seed-reproducible choice among candidate cells.
 */
final class CellPicker {

    private CellPicker() {
    }

    /**
     * @param candidates cells in a fixed (row-major) order
     * @throws IllegalStateException if there is nothing left to choose
     */
    static Coordinate pickUniform(List<Coordinate> candidates, Random random) {
        if (candidates.isEmpty()) {
            throw new IllegalStateException("No untried cells left on the board");
        }
        return candidates.get(random.nextInt(candidates.size()));
    }
}
