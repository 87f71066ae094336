package com.battleship.model;

/**
 * How close ships may be placed to each other.
 */
public enum PlacementRule {
    /** Ships may not overlap but may share an edge or corner. */
    ALLOW_TOUCHING,
    /** Ships may not overlap nor touch, diagonals included. */
    NO_TOUCHING
}
