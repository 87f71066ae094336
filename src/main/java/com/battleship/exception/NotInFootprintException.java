package com.battleship.exception;

import com.battleship.model.Coordinate;

/**
 * Thrown when a hit is registered on a ship that does not occupy the cell.
 * Indicates a hit was routed to the wrong ship.
 */
public class NotInFootprintException extends IllegalStateException {

    public NotInFootprintException(Coordinate coordinate) {
        super("Coordinate " + coordinate + " is not part of the ship's footprint");
    }
}
