package com.battleship.service;

import com.battleship.dto.ShipPlacement;
import com.battleship.exception.InvalidPlacementException;
import com.battleship.model.BoardDimensions;
import com.battleship.model.Coordinate;
import com.battleship.model.Grid;
import com.battleship.model.Orientation;
import com.battleship.model.PlacementRule;
import com.battleship.model.Ship;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Random;

/**
 * Builds grids and puts fleets on them, either at random or from explicit placements.
 */
@Service
@Slf4j
public class FleetPlacementService {

    @Value("${game.placement.rule:ALLOW_TOUCHING}")
    private PlacementRule placementRule;

    @Value("${game.placement.max-attempts:1000}")
    private int maxAttempts;

    public Grid newGrid(BoardDimensions dimensions) {
        return new Grid(dimensions, placementRule);
    }

    /**
     * Places one ship of each size at a random position and orientation.
     *
     * @throws IllegalStateException if a ship cannot be fitted within the configured attempts
     */
    public Grid placeRandomFleet(BoardDimensions dimensions, List<Integer> shipSizes, Random random) {
        Grid grid = newGrid(dimensions);
        for (int size : shipSizes) {
            placeRandomShip(grid, size, random);
        }
        return grid;
    }

    private void placeRandomShip(Grid grid, int size, Random random) {
        BoardDimensions dimensions = grid.dimensions();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Orientation orientation = random.nextBoolean() ? Orientation.HORIZONTAL : Orientation.VERTICAL;
            Coordinate start = new Coordinate(random.nextInt(dimensions.rows()), random.nextInt(dimensions.cols()));
            Ship ship = Ship.line(start, size, orientation);
            if (grid.canPlace(ship)) {
                grid.place(ship);
                log.debug("Placed ship of size {} at {} {} after {} attempt(s)", size, start, orientation, attempt);
                return;
            }
        }
        throw new IllegalStateException("Could not place a ship of size " + size + " on a "
                + dimensions + " board after " + maxAttempts + " attempts");
    }

    /**
     * Places a fleet exactly as requested.
     *
     * @throws InvalidPlacementException on the first placement the board rejects
     */
    public Grid placeFleet(BoardDimensions dimensions, List<ShipPlacement> placements) {
        Grid grid = newGrid(dimensions);
        placements.forEach(placement -> place(grid, placement));
        return grid;
    }

    /**
     * Places a single ship; a rejected placement leaves the grid unchanged.
     *
     * @throws InvalidPlacementException if the board rejects the placement
     */
    public Ship place(Grid grid, ShipPlacement placement) {
        Ship ship = placement.toShip();
        grid.place(ship);
        return ship;
    }
}
