package com.battleship.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.Optional;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.battleship.cpu.CPUStrategy;
import com.battleship.cpu.CPUStrategyFactory;
import com.battleship.cpu.TargetMemory;
import com.battleship.dto.ShotOutcome;
import com.battleship.dto.TurnReport;
import com.battleship.model.BoardDimensions;
import com.battleship.model.CPUDifficulty;
import com.battleship.model.CellState;
import com.battleship.model.Coordinate;
import com.battleship.model.Game;
import com.battleship.model.GameStatus;
import com.battleship.model.Grid;
import com.battleship.model.Orientation;
import com.battleship.model.Ship;
import com.battleship.model.ShotResult;
import com.battleship.model.Side;

/**
 * Unit tests for CPUPlayerService: executeCPUTurn flow with a mocked strategy.
 */
@ExtendWith(MockitoExtension.class)
class CPUPlayerServiceTest {

    @Mock private CPUStrategyFactory strategyFactory;
    @Mock private WinConditionService winConditionService;
    @Mock private CPUStrategy cpuStrategy;

    private CPUPlayerService cpuPlayerService;
    private Game game;
    private TargetMemory memory;

    @BeforeEach
    void setUp() {
        cpuPlayerService = new CPUPlayerService(strategyFactory, winConditionService);

        BoardDimensions dimensions = BoardDimensions.square(4);
        Grid humanGrid = new Grid(dimensions);
        humanGrid.place(Ship.line(Coordinate.of(1, 1), 2, Orientation.HORIZONTAL));
        Grid cpuGrid = new Grid(dimensions);
        cpuGrid.place(Ship.line(Coordinate.of(3, 0), 3, Orientation.HORIZONTAL));
        memory = new TargetMemory(dimensions, new Random(1));

        game = Game.builder()
                .id("game-1")
                .presetId("tiny")
                .difficulty(CPUDifficulty.MEDIUM)
                .humanGrid(humanGrid)
                .cpuGrid(cpuGrid)
                .cpuMemory(memory)
                .build();
    }

    @Nested
    @DisplayName("executeCPUTurn() - full flow")
    class FullFlowTests {

        @Test
        @DisplayName("should fire at the chosen cell of the human grid and report a miss")
        void shouldFireAndReportMiss() {
            Coordinate target = Coordinate.of(0, 0);
            when(strategyFactory.getStrategy(game)).thenReturn(cpuStrategy);
            when(cpuStrategy.chooseTarget(memory, game.getDimensions())).thenReturn(target);
            when(winConditionService.checkGameOver(game)).thenReturn(Optional.empty());

            TurnReport report = cpuPlayerService.executeCPUTurn(game);

            assertEquals(Side.CPU, report.getShooter());
            assertEquals(target, report.getTarget());
            assertEquals(ShotResult.MISS, report.getResult());
            assertEquals(1, report.getTurnNumber());
            assertFalse(report.isGameOver());
            assertEquals(CellState.MISS, game.getHumanGrid().cellState(target));
            assertTrue(memory.hasFired(target));
            assertEquals(1, game.getHistory().size());
            verify(cpuStrategy).processResult(memory, target, ShotOutcome.miss(target));
        }

        @Test
        @DisplayName("should record the shot in memory before the strategy processes it")
        void shouldRecordBeforeProcessing() {
            Coordinate target = Coordinate.of(1, 1);
            when(strategyFactory.getStrategy(game)).thenReturn(cpuStrategy);
            when(cpuStrategy.chooseTarget(memory, game.getDimensions())).thenReturn(target);
            when(winConditionService.checkGameOver(game)).thenReturn(Optional.empty());
            doAnswer(invocation -> {
                assertTrue(memory.hasFired(target), "Cell must be recorded before processResult");
                return null;
            }).when(cpuStrategy).processResult(eq(memory), eq(target), any(ShotOutcome.class));

            TurnReport report = cpuPlayerService.executeCPUTurn(game);

            assertEquals(ShotResult.HIT, report.getResult());
            verify(cpuStrategy).processResult(memory, target, ShotOutcome.hit(target));
        }

        @Test
        @DisplayName("should report the winner when the last human ship sinks")
        void shouldReportWinner() {
            game.getHumanGrid().fire(Coordinate.of(1, 1));
            memory.recordFired(Coordinate.of(1, 1));
            Coordinate target = Coordinate.of(1, 2);
            when(strategyFactory.getStrategy(game)).thenReturn(cpuStrategy);
            when(cpuStrategy.chooseTarget(memory, game.getDimensions())).thenReturn(target);
            when(winConditionService.checkGameOver(game)).thenReturn(Optional.of(Side.CPU));

            TurnReport report = cpuPlayerService.executeCPUTurn(game);

            assertEquals(ShotResult.SUNK, report.getResult());
            assertEquals(2, report.getSunkShipLength());
            assertEquals(Side.CPU, report.getWinner());
            assertTrue(report.isGameOver());
        }
    }

    @Nested
    @DisplayName("executeCPUTurn() - rejected turns")
    class RejectedTurnTests {

        @Test
        @DisplayName("should refuse to play a finished game")
        void shouldRejectFinishedGame() {
            game.setStatus(GameStatus.FINISHED);

            assertThrows(IllegalStateException.class, () -> cpuPlayerService.executeCPUTurn(game));
            verifyNoInteractions(strategyFactory, winConditionService);
        }

        @Test
        @DisplayName("should fail loudly when the strategy repeats a cell")
        void shouldRejectRepeatedTarget() {
            Coordinate target = Coordinate.of(2, 2);
            game.getHumanGrid().fire(target);
            memory.recordFired(target);
            when(strategyFactory.getStrategy(game)).thenReturn(cpuStrategy);
            when(cpuStrategy.chooseTarget(memory, game.getDimensions())).thenReturn(target);

            IllegalStateException ex = assertThrows(IllegalStateException.class,
                    () -> cpuPlayerService.executeCPUTurn(game));

            assertTrue(ex.getMessage().contains("already fired"));
            verify(cpuStrategy, never()).processResult(any(), any(), any());
            verifyNoInteractions(winConditionService);
            assertTrue(game.getHistory().isEmpty());
        }
    }
}
