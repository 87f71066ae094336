package com.battleship.exception;

/**
 * Thrown when a ship footprint is out of bounds, overlaps another ship or
 * breaks the board's {@link com.battleship.model.PlacementRule}.
 * <p>
 * Only the placement attempt fails; the board is left unchanged and the
 * caller may retry with another footprint.
 */
public class InvalidPlacementException extends IllegalArgumentException {

    public InvalidPlacementException(String message) {
        super(message);
    }
}
