package com.battleship.model;

/**
 * State of a single board cell.
 */
public enum CellState {
    EMPTY,      // Open water, not fired at
    SHIP,       // Intact ship segment
    HIT,        // Ship segment that has been hit
    MISS;       // Open water that has been fired at

    /**
     * HIT and MISS are terminal: a cell in one of them was already fired at.
     */
    public boolean isFiredAt() {
        return this == HIT || this == MISS;
    }
}
