package com.battleship.cpu;

import com.battleship.dto.ShotOutcome;
import com.battleship.model.BoardDimensions;
import com.battleship.model.CPUDifficulty;
import com.battleship.model.Coordinate;

/**
 * Strategy interface for CPU targeting.
 * Implements the Strategy pattern for the different CPU difficulty levels.
 * <p>
 * Implementations are stateless; everything they learn during a game lives in
 * the {@link TargetMemory} passed to each call. The caller records every
 * chosen cell with {@link TargetMemory#recordFired} right after firing and
 * before {@link #processResult}.
 */
public interface CPUStrategy {

    /**
     * Choose the next cell to fire at. Never returns a cell already in
     * {@link TargetMemory#getFired()}.
     *
     * @throws IllegalStateException if every cell has been fired at
     */
    Coordinate chooseTarget(TargetMemory memory, BoardDimensions dimensions);

    /**
     * Learn from the outcome of a shot at {@code coordinate}.
     */
    void processResult(TargetMemory memory, Coordinate coordinate, ShotOutcome outcome);

    /**
     * Get the difficulty level this strategy represents.
     */
    CPUDifficulty getDifficulty();
}
