package com.battleship.cpu;

import com.battleship.dto.ShotOutcome;
import com.battleship.model.BoardDimensions;
import com.battleship.model.CPUDifficulty;
import com.battleship.model.Coordinate;
import org.springframework.stereotype.Component;

/**
 * Easy CPU Strategy - Fires at random untried cells.
 */
@Component
public class RandomShooterStrategy implements CPUStrategy {

    @Override
    public CPUDifficulty getDifficulty() {
        return CPUDifficulty.EASY;
    }

    @Override
    public Coordinate chooseTarget(TargetMemory memory, BoardDimensions dimensions) {
        return CellPicker.pickUniform(memory.untriedCells(), memory.getRandom());
    }

    @Override
    public void processResult(TargetMemory memory, Coordinate coordinate, ShotOutcome outcome) {
        // Easy CPU learns nothing from its shots
    }
}
