package com.battleship.cpu;

import com.battleship.dto.ShotOutcome;
import com.battleship.model.BoardDimensions;
import com.battleship.model.CPUDifficulty;
import com.battleship.model.Coordinate;
import com.battleship.model.Grid;
import com.battleship.model.Orientation;
import com.battleship.model.Ship;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SeekAndDestroyStrategy (MEDIUM).
 */
class SeekAndDestroyStrategyTest {

    private final SeekAndDestroyStrategy strategy = new SeekAndDestroyStrategy();

    @Test
    @DisplayName("getDifficulty() should return MEDIUM")
    void shouldReturnMediumDifficulty() {
        assertEquals(CPUDifficulty.MEDIUM, strategy.getDifficulty());
    }

    @Nested
    @DisplayName("Hunting")
    class HuntingTests {

        @Test
        @DisplayName("should fall back to random untried cells when nothing is queued")
        void shouldBehaveLikeRandomShooterWhenIdle() {
            BoardDimensions dimensions = BoardDimensions.square(2);
            TargetMemory memory = new TargetMemory(dimensions, new Random(5));
            Set<Coordinate> seen = new HashSet<>();

            for (int i = 0; i < 4; i++) {
                Coordinate target = strategy.chooseTarget(memory, dimensions);
                memory.recordFired(target);
                strategy.processResult(memory, target, ShotOutcome.miss(target));
                seen.add(target);
            }

            assertEquals(4, seen.size());
        }

        @Test
        @DisplayName("a miss should not queue anything")
        void missShouldNotQueue() {
            TargetMemory memory = new TargetMemory(BoardDimensions.square(3), new Random());
            memory.recordFired(Coordinate.of(1, 1));

            strategy.processResult(memory, Coordinate.of(1, 1), ShotOutcome.miss(Coordinate.of(1, 1)));

            assertEquals(TargetingMode.HUNTING, memory.getMode());
        }
    }

    @Nested
    @DisplayName("Probing")
    class ProbingTests {

        @Test
        @DisplayName("a hit should queue all in-bounds neighbours, right-left-down-up")
        void hitShouldQueueNeighbours() {
            BoardDimensions dimensions = BoardDimensions.square(3);
            TargetMemory memory = new TargetMemory(dimensions, new Random());
            memory.recordFired(Coordinate.of(1, 1));

            strategy.processResult(memory, Coordinate.of(1, 1), ShotOutcome.hit(Coordinate.of(1, 1)));

            assertEquals(List.of(Coordinate.of(1, 2), Coordinate.of(1, 0), Coordinate.of(2, 1), Coordinate.of(0, 1)),
                    memory.getPriorityTargets());
            assertEquals(TargetingMode.PROBING, memory.getMode());
        }

        @Test
        @DisplayName("next target after a hit should be an untried neighbour of it")
        void nextTargetShouldBeNeighbourOfHit() {
            BoardDimensions dimensions = BoardDimensions.square(5);
            TargetMemory memory = new TargetMemory(dimensions, new Random(11));
            Coordinate hit = Coordinate.of(2, 3);
            memory.recordFired(Coordinate.of(2, 4));
            memory.recordFired(hit);

            strategy.processResult(memory, hit, ShotOutcome.hit(hit));
            Coordinate next = strategy.chooseTarget(memory, dimensions);

            assertTrue(dimensions.neighborsOf(hit).contains(next));
            assertFalse(memory.hasFired(next));
        }

        @Test
        @DisplayName("should not queue fired or already queued neighbours")
        void shouldNotQueueDuplicates() {
            BoardDimensions dimensions = BoardDimensions.square(4);
            TargetMemory memory = new TargetMemory(dimensions, new Random());

            memory.recordFired(Coordinate.of(1, 1));
            strategy.processResult(memory, Coordinate.of(1, 1), ShotOutcome.hit(Coordinate.of(1, 1)));
            Coordinate next = strategy.chooseTarget(memory, dimensions);
            assertEquals(Coordinate.of(1, 2), next);

            memory.recordFired(next);
            strategy.processResult(memory, next, ShotOutcome.hit(next));

            List<Coordinate> queue = memory.getPriorityTargets();
            assertEquals(new HashSet<>(queue).size(), queue.size(), "Queue has duplicates: " + queue);
            assertFalse(queue.contains(Coordinate.of(1, 1)));
            assertEquals(List.of(
                    Coordinate.of(1, 0), Coordinate.of(2, 1), Coordinate.of(0, 1),
                    Coordinate.of(1, 3), Coordinate.of(2, 2), Coordinate.of(0, 2)), queue);
        }

        @Test
        @DisplayName("sinking a ship should clear the queue")
        void sunkShouldClearQueue() {
            TargetMemory memory = new TargetMemory(BoardDimensions.square(3), new Random());
            memory.recordFired(Coordinate.of(1, 1));
            strategy.processResult(memory, Coordinate.of(1, 1), ShotOutcome.hit(Coordinate.of(1, 1)));

            memory.recordFired(Coordinate.of(1, 2));
            strategy.processResult(memory, Coordinate.of(1, 2), ShotOutcome.sunk(Coordinate.of(1, 2), 2));

            assertTrue(memory.getPriorityTargets().isEmpty());
            assertEquals(TargetingMode.HUNTING, memory.getMode());
        }
    }

    @Test
    @DisplayName("5x5 scenario: hit at A1 probes A2, which sinks the ship and clears the queue")
    void cornerShipScenario() {
        BoardDimensions dimensions = BoardDimensions.square(5);
        Grid grid = new Grid(dimensions);
        grid.place(Ship.line(Coordinate.of(0, 0), 2, Orientation.HORIZONTAL));
        TargetMemory memory = new TargetMemory(dimensions, new Random());

        ShotOutcome first = grid.fire(Coordinate.of(0, 0));
        memory.recordFired(Coordinate.of(0, 0));
        strategy.processResult(memory, Coordinate.of(0, 0), first);

        assertEquals(List.of(Coordinate.of(0, 1), Coordinate.of(1, 0)), memory.getPriorityTargets());

        Coordinate next = strategy.chooseTarget(memory, dimensions);
        assertEquals(Coordinate.of(0, 1), next);

        ShotOutcome second = grid.fire(next);
        memory.recordFired(next);
        strategy.processResult(memory, next, second);

        assertTrue(second.isShipSunk());
        assertTrue(memory.getPriorityTargets().isEmpty());
        assertTrue(grid.allShipsSunk());
    }
}
