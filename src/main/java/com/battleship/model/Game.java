package com.battleship.model;

import com.battleship.cpu.TargetMemory;
import com.battleship.dto.TurnReport;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A single human-vs-CPU game session.
 * <p>
 * The human fires at {@link #cpuGrid}, the CPU at {@link #humanGrid}. The CPU
 * learns about the human board only through {@link #cpuMemory}.
 */
@Getter
@Builder
public class Game {

    private final String id;

    private final String presetId;

    private final CPUDifficulty difficulty;

    private final Grid humanGrid;

    private final Grid cpuGrid;

    private final TargetMemory cpuMemory;

    @Setter
    @Builder.Default
    private GameStatus status = GameStatus.IN_PROGRESS;

    @Setter
    private Side winner;

    @Builder.Default
    private int turnNumber = 1;

    @Builder.Default
    private final List<TurnReport> history = new ArrayList<>();

    public BoardDimensions getDimensions() {
        return humanGrid.dimensions();
    }

    /**
     * The grid belonging to {@code side}.
     */
    public Grid gridOf(Side side) {
        return side == Side.HUMAN ? humanGrid : cpuGrid;
    }

    /**
     * The grid {@code shooter} fires at.
     */
    public Grid targetGridOf(Side shooter) {
        return gridOf(shooter.opponent());
    }

    public boolean isFinished() {
        return status == GameStatus.FINISHED;
    }

    public void record(TurnReport report) {
        history.add(report);
    }

    public List<TurnReport> getHistory() {
        return Collections.unmodifiableList(history);
    }

    /**
     * Advances the round counter once both sides have fired.
     */
    public void nextTurn() {
        turnNumber++;
    }
}
