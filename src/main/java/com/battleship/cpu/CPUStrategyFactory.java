package com.battleship.cpu;

import com.battleship.model.CPUDifficulty;
import com.battleship.model.Game;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Factory for CPU strategies based on difficulty level.
 */
@Service
@RequiredArgsConstructor
public class CPUStrategyFactory {

    private final RandomShooterStrategy randomShooter;
    private final SeekAndDestroyStrategy seekAndDestroy;
    private final StrategicGeniusStrategy strategicGenius;

    /**
     * Get the strategy for a difficulty level. {@code null} means MEDIUM.
     */
    public CPUStrategy getStrategy(CPUDifficulty difficulty) {
        if (difficulty == null) {
            difficulty = CPUDifficulty.MEDIUM;
        }

        return switch (difficulty) {
            case EASY -> randomShooter;
            case MEDIUM -> seekAndDestroy;
            case HARD -> strategicGenius;
        };
    }

    /**
     * Get the strategy for the CPU side of a game.
     */
    public CPUStrategy getStrategy(Game game) {
        return getStrategy(game.getDifficulty());
    }
}
