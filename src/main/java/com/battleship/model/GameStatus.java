package com.battleship.model;

/**
 * Represents the current status of a game.
 */
public enum GameStatus {
    IN_PROGRESS,
    FINISHED
}
