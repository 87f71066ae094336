package com.battleship.cpu;

import com.battleship.dto.ShotOutcome;
import com.battleship.model.BoardDimensions;
import com.battleship.model.CPUDifficulty;
import com.battleship.model.Coordinate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Medium CPU Strategy - Random search, then probes the neighbours of every hit
 * until the ship sinks.
 */
@Component
@Slf4j
public class SeekAndDestroyStrategy implements CPUStrategy {

    @Override
    public CPUDifficulty getDifficulty() {
        return CPUDifficulty.MEDIUM;
    }

    @Override
    public Coordinate chooseTarget(TargetMemory memory, BoardDimensions dimensions) {
        return memory.pollPriorityTarget()
                .orElseGet(() -> CellPicker.pickUniform(memory.untriedCells(), memory.getRandom()));
    }

    @Override
    public void processResult(TargetMemory memory, Coordinate coordinate, ShotOutcome outcome) {
        if (outcome.isShipSunk()) {
            // Remaining candidates may belong to another ship; drop them anyway
            memory.clearPriorityTargets();
            return;
        }

        if (outcome.isHit()) {
            int added = memory.enqueueNeighbors(coordinate);
            log.debug("Hit at {}, queued {} neighbour(s)", coordinate, added);
        }
    }
}
