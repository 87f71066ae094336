package com.battleship.dto;

import com.battleship.model.Coordinate;
import com.battleship.model.Orientation;
import com.battleship.model.Ship;
import lombok.Value;

/**
 * Request to place a straight ship of {@code length} cells at {@code start}.
 */
@Value
public class ShipPlacement {
    Coordinate start;
    Orientation orientation;
    int length;

    public static ShipPlacement of(Coordinate start, Orientation orientation, int length) {
        return new ShipPlacement(start, orientation, length);
    }

    public Ship toShip() {
        return Ship.line(start, length, orientation);
    }
}
