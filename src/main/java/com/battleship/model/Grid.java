package com.battleship.model;

import com.battleship.dto.ShotOutcome;
import com.battleship.exception.AlreadyFiredException;
import com.battleship.exception.InvalidPlacementException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One side's board: cell states plus the ships placed on it.
 * <p>
 * After setup the grid only changes through {@link #fire(Coordinate)}.
 */
public class Grid {

    private final BoardDimensions dimensions;
    private final PlacementRule placementRule;
    private final CellState[][] cells;
    private final List<Ship> ships = new ArrayList<>();
    private final Map<Coordinate, Ship> shipsByCell = new HashMap<>();

    public Grid(BoardDimensions dimensions) {
        this(dimensions, PlacementRule.ALLOW_TOUCHING);
    }

    public Grid(BoardDimensions dimensions, PlacementRule placementRule) {
        this.dimensions = dimensions;
        this.placementRule = placementRule;
        this.cells = new CellState[dimensions.rows()][dimensions.cols()];
        for (CellState[] row : cells) {
            Arrays.fill(row, CellState.EMPTY);
        }
    }

    public BoardDimensions dimensions() {
        return dimensions;
    }

    public PlacementRule getPlacementRule() {
        return placementRule;
    }

    /**
     * Whether {@link #place(Ship)} would accept the ship.
     */
    public boolean canPlace(Ship ship) {
        return placementProblem(ship) == null;
    }

    /**
     * Places a ship on the board.
     *
     * @throws InvalidPlacementException if a cell is out of bounds, already occupied
     *                                   or, under {@link PlacementRule#NO_TOUCHING}, next to another ship
     */
    public void place(Ship ship) {
        String problem = placementProblem(ship);
        if (problem != null) {
            throw new InvalidPlacementException(problem);
        }
        for (Coordinate c : ship.getFootprint()) {
            cells[c.row()][c.col()] = CellState.SHIP;
            shipsByCell.put(c, ship);
        }
        ships.add(ship);
    }

    private String placementProblem(Ship ship) {
        for (Coordinate c : ship.getFootprint()) {
            if (!dimensions.contains(c)) {
                return "Cell " + c + " is outside the " + dimensions + " board";
            }
            if (shipsByCell.containsKey(c)) {
                return "Cell " + c + " is already occupied";
            }
        }
        if (placementRule == PlacementRule.NO_TOUCHING) {
            for (Coordinate c : ship.getFootprint()) {
                for (int dr = -1; dr <= 1; dr++) {
                    for (int dc = -1; dc <= 1; dc++) {
                        Coordinate around = c.offset(dr, dc);
                        if (shipsByCell.containsKey(around)) {
                            return "Cell " + c + " touches another ship at " + around;
                        }
                    }
                }
            }
        }
        return null;
    }

    /**
     * Fires at a cell and applies the state transition.
     *
     * @throws IllegalArgumentException if the cell is outside the board
     * @throws AlreadyFiredException    if the cell is already HIT or MISS
     */
    public ShotOutcome fire(Coordinate target) {
        CellState state = cellState(target);
        if (state.isFiredAt()) {
            throw new AlreadyFiredException(target);
        }

        if (state == CellState.EMPTY) {
            cells[target.row()][target.col()] = CellState.MISS;
            return ShotOutcome.miss(target);
        }

        cells[target.row()][target.col()] = CellState.HIT;
        Ship ship = shipsByCell.get(target);
        ship.registerHit(target);
        return ship.isSunk()
                ? ShotOutcome.sunk(target, ship.getLength())
                : ShotOutcome.hit(target);
    }

    /**
     * @throws IllegalArgumentException if the cell is outside the board
     */
    public CellState cellState(Coordinate coordinate) {
        if (!dimensions.contains(coordinate)) {
            throw new IllegalArgumentException("Cell " + coordinate + " is outside the " + dimensions + " board");
        }
        return cells[coordinate.row()][coordinate.col()];
    }

    /**
     * Cells currently in {@code state}, row-major.
     */
    public List<Coordinate> cellsInState(CellState state) {
        return dimensions.cells().stream()
                .filter(c -> cells[c.row()][c.col()] == state)
                .toList();
    }

    public boolean isFiredAt(Coordinate coordinate) {
        return cellState(coordinate).isFiredAt();
    }

    public boolean allShipsSunk() {
        return ships.stream().allMatch(Ship::isSunk);
    }

    public long remainingShips() {
        return ships.stream().filter(s -> !s.isSunk()).count();
    }

    public List<Ship> getShips() {
        return Collections.unmodifiableList(ships);
    }
}
