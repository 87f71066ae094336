package com.battleship.model;

/**
 * Outcome category of a shot fired at a board coordinate.
 */
public enum ShotResult {
    MISS,
    HIT,
    SUNK
}
