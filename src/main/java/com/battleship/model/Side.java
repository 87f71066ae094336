package com.battleship.model;

/**
 * The two sides of a game.
 */
public enum Side {
    HUMAN,
    CPU;

    public Side opponent() {
        return this == HUMAN ? CPU : HUMAN;
    }
}
