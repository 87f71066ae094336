package com.battleship.cpu;

import com.battleship.dto.ShotOutcome;
import com.battleship.model.BoardDimensions;
import com.battleship.model.CPUDifficulty;
import com.battleship.model.Coordinate;
import com.battleship.model.Orientation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Hard CPU Strategy - Hunts on a checkerboard and, once two hits line up,
 * tries the cells extending the line before any other queued candidate.
 * <p>
 * Every ship is at least two cells long, so it always covers a cell of either
 * checkerboard colour and hunting one colour cannot miss it.
 */
@Component
@Slf4j
public class StrategicGeniusStrategy implements CPUStrategy {

    @Override
    public CPUDifficulty getDifficulty() {
        return CPUDifficulty.HARD;
    }

    @Override
    public Coordinate chooseTarget(TargetMemory memory, BoardDimensions dimensions) {
        return memory.pollPriorityTarget()
                .orElseGet(() -> hunt(memory));
    }

    private Coordinate hunt(TargetMemory memory) {
        List<Coordinate> untried = memory.untriedCells();
        List<Coordinate> checkerboard = untried.stream()
                .filter(c -> c.hasParity(memory.getHuntParity()))
                .toList();

        // Checkerboard exhausted: any untried cell
        return CellPicker.pickUniform(checkerboard.isEmpty() ? untried : checkerboard, memory.getRandom());
    }

    @Override
    public void processResult(TargetMemory memory, Coordinate coordinate, ShotOutcome outcome) {
        if (outcome.isShipSunk()) {
            memory.clearPriorityTargets();
            return;
        }

        if (!outcome.isHit()) {
            return;
        }

        memory.addHit(coordinate);
        List<Coordinate> trail = memory.getHitTrail();

        if (trail.size() >= 2) {
            Optional<Orientation> orientation = inferOrientation(trail);
            if (orientation.isPresent()) {
                List<Coordinate> extensions = lineExtensions(memory, trail, orientation.get());
                if (!extensions.isEmpty()) {
                    log.debug("Hits {} line up {}, probing {} first", trail, orientation.get(), extensions);
                    memory.prioritize(extensions);
                    return;
                }
            }
        }

        memory.enqueueNeighbors(coordinate);
    }

    /**
     * Orientation shared by all unresolved hits, if they lie on one row or one column.
     */
    Optional<Orientation> inferOrientation(List<Coordinate> hits) {
        Coordinate first = hits.get(0);
        if (hits.stream().allMatch(c -> c.row() == first.row())) {
            return Optional.of(Orientation.HORIZONTAL);
        }
        if (hits.stream().allMatch(c -> c.col() == first.col())) {
            return Optional.of(Orientation.VERTICAL);
        }
        return Optional.empty();
    }

    /**
     * The cells just past each end of the hit segment (ahead first, then behind)
     * that are on the board and not fired at yet.
     */
    List<Coordinate> lineExtensions(TargetMemory memory, List<Coordinate> hits, Orientation orientation) {
        Comparator<Coordinate> alongLine = orientation == Orientation.HORIZONTAL
                ? Comparator.comparingInt(Coordinate::col)
                : Comparator.comparingInt(Coordinate::row);

        Coordinate low = hits.stream().min(alongLine).orElseThrow();
        Coordinate high = hits.stream().max(alongLine).orElseThrow();

        List<Coordinate> extensions = new ArrayList<>(2);
        for (Coordinate candidate : List.of(
                high.offset(orientation.getRowStep(), orientation.getColStep()),
                low.offset(-orientation.getRowStep(), -orientation.getColStep()))) {
            if (memory.getDimensions().contains(candidate) && !memory.hasFired(candidate)) {
                extensions.add(candidate);
            }
        }
        return extensions;
    }
}
