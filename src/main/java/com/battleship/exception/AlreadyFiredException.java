package com.battleship.exception;

import com.battleship.model.Coordinate;
import lombok.Getter;

/**
 * Thrown when a cell that is already HIT or MISS is fired at again.
 * <p>
 * For the CPU this is a logic defect; strategies never pick a fired cell.
 */
@Getter
public class AlreadyFiredException extends IllegalStateException {

    private final Coordinate coordinate;

    public AlreadyFiredException(Coordinate coordinate) {
        super("Cell " + coordinate + " was already fired at");
        this.coordinate = coordinate;
    }
}
