package com.battleship.service;

import com.battleship.cpu.CPUStrategy;
import com.battleship.cpu.CPUStrategyFactory;
import com.battleship.cpu.TargetMemory;
import com.battleship.dto.ShotOutcome;
import com.battleship.dto.TurnReport;
import com.battleship.model.Coordinate;
import com.battleship.model.Game;
import com.battleship.model.Side;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Service for executing CPU player turns.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CPUPlayerService {

    private final CPUStrategyFactory strategyFactory;
    private final WinConditionService winConditionService;

    /**
     * Execute one CPU shot: select a target, fire at the human grid, record it
     * in the CPU's memory and let the strategy learn from the outcome.
     *
     * @throws IllegalStateException if the game is already over, or the strategy
     *                               picked a cell it had already fired at
     */
    public TurnReport executeCPUTurn(Game game) {
        if (game.isFinished()) {
            throw new IllegalStateException("Game " + game.getId() + " is already over");
        }

        CPUStrategy strategy = strategyFactory.getStrategy(game);
        TargetMemory memory = game.getCpuMemory();

        Coordinate target = strategy.chooseTarget(memory, game.getDimensions());
        if (memory.hasFired(target)) {
            throw new IllegalStateException(strategy.getDifficulty() + " strategy chose " + target
                    + " which it had already fired at");
        }

        ShotOutcome outcome = game.targetGridOf(Side.CPU).fire(target);
        memory.recordFired(target);
        strategy.processResult(memory, target, outcome);

        log.debug("CPU ({}) fired at {}: {} [mode={}, queued={}]", strategy.getDifficulty(), target,
                outcome.getResult(), memory.getMode(), memory.getPriorityTargets().size());

        Side winner = winConditionService.checkGameOver(game).orElse(null);
        TurnReport report = TurnReport.of(game.getTurnNumber(), Side.CPU, outcome, winner);
        game.record(report);
        return report;
    }
}
