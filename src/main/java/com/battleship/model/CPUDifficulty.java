package com.battleship.model;

import java.util.Arrays;

/**
 * CPU difficulty levels.
 */
public enum CPUDifficulty {
    EASY,
    MEDIUM,
    HARD;

    /**
     * Case-insensitive lookup by label ("easy", "Medium", ...).
     *
     * @throws IllegalArgumentException if the label matches no difficulty
     */
    public static CPUDifficulty fromLabel(String label) {
        if (label != null) {
            for (CPUDifficulty difficulty : values()) {
                if (difficulty.name().equalsIgnoreCase(label.trim())) {
                    return difficulty;
                }
            }
        }
        throw new IllegalArgumentException("Unknown difficulty: " + label
                + ". Choose one of " + Arrays.toString(values()));
    }
}
