package com.battleship.service;

import com.battleship.config.BoardPreset;
import com.battleship.config.PresetLoader;
import com.battleship.cpu.TargetMemory;
import com.battleship.dto.ShipPlacement;
import com.battleship.dto.ShotOutcome;
import com.battleship.dto.TurnReport;
import com.battleship.model.CPUDifficulty;
import com.battleship.model.Coordinate;
import com.battleship.model.Game;
import com.battleship.model.Grid;
import com.battleship.model.Side;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.UUID;

/**
 * Core game service handling game creation and the turn sequence.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameService {

    private final PresetLoader presetLoader;
    private final FleetPlacementService fleetPlacementService;
    private final CPUPlayerService cpuPlayerService;
    private final WinConditionService winConditionService;

    @Value("${game.cpu.seed:#{null}}")
    private Long seed;

    @Value("${game.cpu.hunt-parity:0}")
    private int huntParity;

    /**
     * Create a new game; both fleets are placed at random.
     */
    public Game createGame(String presetId, CPUDifficulty difficulty) {
        Random random = newRandom();
        BoardPreset preset = presetLoader.getPreset(presetId);
        Grid humanGrid = fleetPlacementService.placeRandomFleet(preset.dimensions(), preset.shipSizes(), random);
        return createGame(preset, difficulty, humanGrid, random);
    }

    /**
     * Create a new game with the human fleet placed as requested.
     *
     * @throws IllegalArgumentException if the placements do not match the preset's fleet
     *                                  or the board rejects one of them
     */
    public Game createGame(String presetId, CPUDifficulty difficulty, List<ShipPlacement> humanPlacements) {
        BoardPreset preset = presetLoader.getPreset(presetId);
        List<Integer> requested = humanPlacements.stream().map(ShipPlacement::getLength).sorted().toList();
        List<Integer> expected = preset.shipSizes().stream().sorted().toList();
        if (!requested.equals(expected)) {
            throw new IllegalArgumentException("Preset '" + preset.id() + "' needs ships of sizes "
                    + preset.shipSizes() + ", got " + requested);
        }

        Grid humanGrid = fleetPlacementService.placeFleet(preset.dimensions(), humanPlacements);
        return createGame(preset, difficulty, humanGrid, newRandom());
    }

    /**
     * Create a new game with a human grid that was set up by the caller
     * (for example placed ship by ship at the console).
     */
    public Game createGame(String presetId, CPUDifficulty difficulty, Grid humanGrid) {
        BoardPreset preset = presetLoader.getPreset(presetId);
        if (!humanGrid.dimensions().equals(preset.dimensions())) {
            throw new IllegalArgumentException("Human grid is " + humanGrid.dimensions()
                    + " but preset '" + preset.id() + "' is " + preset.dimensions());
        }
        return createGame(preset, difficulty, humanGrid, newRandom());
    }

    private Game createGame(BoardPreset preset, CPUDifficulty difficulty, Grid humanGrid, Random random) {
        if (difficulty == null) {
            difficulty = CPUDifficulty.MEDIUM;
        }

        Grid cpuGrid = fleetPlacementService.placeRandomFleet(preset.dimensions(), preset.shipSizes(), random);

        Game game = Game.builder()
                .id(UUID.randomUUID().toString())
                .presetId(preset.id())
                .difficulty(difficulty)
                .humanGrid(humanGrid)
                .cpuGrid(cpuGrid)
                .cpuMemory(new TargetMemory(preset.dimensions(), huntParity, random))
                .build();

        log.info("Created game {} on preset '{}' ({}) against {} CPU", game.getId(), preset.id(),
                preset.dimensions(), difficulty);
        return game;
    }

    /**
     * The human fires at the CPU's grid.
     *
     * @throws IllegalStateException if the game is over, or the cell was already fired at
     * @throws IllegalArgumentException if the cell is off the board
     */
    public TurnReport humanFire(Game game, Coordinate target) {
        if (game.isFinished()) {
            throw new IllegalStateException("Game " + game.getId() + " is already over");
        }

        ShotOutcome outcome = game.targetGridOf(Side.HUMAN).fire(target);
        Side winner = winConditionService.checkGameOver(game).orElse(null);

        TurnReport report = TurnReport.of(game.getTurnNumber(), Side.HUMAN, outcome, winner);
        game.record(report);
        log.debug("Human fired at {}: {}", target, outcome.getResult());
        return report;
    }

    /**
     * Play one round: the human shot, then the CPU's reply unless the human just won.
     *
     * @return the reports of this round, human shot first
     */
    public List<TurnReport> playRound(Game game, Coordinate humanTarget) {
        List<TurnReport> reports = new ArrayList<>(2);
        reports.add(humanFire(game, humanTarget));

        if (!game.isFinished()) {
            reports.add(cpuPlayerService.executeCPUTurn(game));
        }
        if (!game.isFinished()) {
            game.nextTurn();
        }
        return reports;
    }

    /**
     * Start a fresh game with the same preset and difficulty.
     */
    public Game restart(Game previous) {
        return createGame(previous.getPresetId(), previous.getDifficulty());
    }

    public List<BoardPreset> getAvailablePresets() {
        return presetLoader.getAvailablePresets();
    }

    public BoardPreset getPreset(String presetId) {
        return presetLoader.getPreset(presetId);
    }

    private Random newRandom() {
        return seed != null ? new Random(seed) : new Random();
    }
}
