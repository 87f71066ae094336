package com.battleship.cpu;

import com.battleship.model.BoardDimensions;
import com.battleship.model.Coordinate;
import lombok.Getter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Per-game bookkeeping of one CPU player about the opponent's board.
 * <p>
 * Holds the cells already fired at, a FIFO queue of priority candidates next
 * to known hits, the trail of hits on the ship currently being probed, the
 * checkerboard parity used while hunting and the game's random source.
 * A queued cell is never a fired cell and never appears twice.
 */
public class TargetMemory {

    @Getter
    private final BoardDimensions dimensions;

    @Getter
    private final int huntParity;

    @Getter
    private final Random random;

    private final Set<Coordinate> fired = new HashSet<>();
    private final Deque<Coordinate> priorityTargets = new ArrayDeque<>();
    private final List<Coordinate> hitTrail = new ArrayList<>();

    public TargetMemory(BoardDimensions dimensions, int huntParity, Random random) {
        if (huntParity != 0 && huntParity != 1) {
            throw new IllegalArgumentException("Hunt parity must be 0 or 1, got " + huntParity);
        }
        this.dimensions = dimensions;
        this.huntParity = huntParity;
        this.random = random;
    }

    public TargetMemory(BoardDimensions dimensions, Random random) {
        this(dimensions, 0, random);
    }

    // ── fired cells ─────────────────────────────────────────────────────

    /**
     * Records a cell as fired at. Called by the game right after every CPU shot.
     */
    public void recordFired(Coordinate coordinate) {
        if (!dimensions.contains(coordinate)) {
            throw new IllegalArgumentException("Cell " + coordinate + " is outside the " + dimensions + " board");
        }
        fired.add(coordinate);
        priorityTargets.remove(coordinate);
    }

    public boolean hasFired(Coordinate coordinate) {
        return fired.contains(coordinate);
    }

    public Set<Coordinate> getFired() {
        return Collections.unmodifiableSet(fired);
    }

    /**
     * Cells not fired at yet, row-major.
     */
    public List<Coordinate> untriedCells() {
        return dimensions.cells().stream()
                .filter(c -> !fired.contains(c))
                .toList();
    }

    // ── priority queue ──────────────────────────────────────────────────

    /**
     * Appends a candidate unless it is off the board, already fired or already queued.
     *
     * @return whether the cell was added
     */
    public boolean enqueue(Coordinate coordinate) {
        if (!dimensions.contains(coordinate) || fired.contains(coordinate)
                || priorityTargets.contains(coordinate)) {
            return false;
        }
        priorityTargets.addLast(coordinate);
        return true;
    }

    /**
     * Queues the in-bounds, untried orthogonal neighbours of a hit.
     *
     * @return number of cells added
     */
    public int enqueueNeighbors(Coordinate hit) {
        int added = 0;
        for (Coordinate neighbor : dimensions.neighborsOf(hit)) {
            if (enqueue(neighbor)) {
                added++;
            }
        }
        return added;
    }

    /**
     * Moves {@code candidates} to the front of the queue, in the given order,
     * keeping every other queued cell behind them. Off-board and fired cells are skipped.
     */
    public void prioritize(List<Coordinate> candidates) {
        for (int i = candidates.size() - 1; i >= 0; i--) {
            Coordinate candidate = candidates.get(i);
            if (dimensions.contains(candidate) && !fired.contains(candidate)) {
                priorityTargets.remove(candidate);
                priorityTargets.addFirst(candidate);
            }
        }
    }

    /**
     * Takes the front candidate. When the queue has drained while hits on the
     * trail are still unresolved, the untried neighbours of every trail hit are
     * queued again first. Only when none are left is the trail dropped, which
     * returns the CPU to hunting.
     */
    public Optional<Coordinate> pollPriorityTarget() {
        Optional<Coordinate> next = pollQueued();
        if (next.isEmpty() && !hitTrail.isEmpty()) {
            hitTrail.forEach(this::enqueueNeighbors);
            next = pollQueued();
        }
        if (next.isEmpty()) {
            hitTrail.clear();
        }
        return next;
    }

    private Optional<Coordinate> pollQueued() {
        while (!priorityTargets.isEmpty()) {
            Coordinate next = priorityTargets.pollFirst();
            if (!fired.contains(next)) {
                return Optional.of(next);
            }
        }
        return Optional.empty();
    }

    public List<Coordinate> getPriorityTargets() {
        return List.copyOf(priorityTargets);
    }

    // ── hit trail ───────────────────────────────────────────────────────

    public void addHit(Coordinate coordinate) {
        if (!hitTrail.contains(coordinate)) {
            hitTrail.add(coordinate);
        }
    }

    public List<Coordinate> getHitTrail() {
        return Collections.unmodifiableList(hitTrail);
    }

    /**
     * Ends the current hunt around a ship: clears the queue and the hit trail.
     */
    public void clearPriorityTargets() {
        priorityTargets.clear();
        hitTrail.clear();
    }

    // ── lifecycle ───────────────────────────────────────────────────────

    /**
     * PROBING while there is a queued candidate or an unresolved hit with an
     * untried neighbour left, HUNTING otherwise.
     */
    public TargetingMode getMode() {
        if (!priorityTargets.isEmpty()) {
            return TargetingMode.PROBING;
        }
        boolean unresolved = hitTrail.stream()
                .flatMap(hit -> dimensions.neighborsOf(hit).stream())
                .anyMatch(c -> !fired.contains(c));
        return unresolved ? TargetingMode.PROBING : TargetingMode.HUNTING;
    }
}
