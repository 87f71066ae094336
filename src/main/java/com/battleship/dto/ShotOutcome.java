package com.battleship.dto;

import com.battleship.model.Coordinate;
import com.battleship.model.ShotResult;
import lombok.Builder;
import lombok.Value;

/**
 * What a shot revealed: the cell, whether it hit and whether a ship went down.
 * <p>
 * This is all the information about an opponent's board a CPU strategy
 * ever receives.
 */
@Value
@Builder
public class ShotOutcome {
    Coordinate coordinate;
    ShotResult result;
    /** Length of the sunk ship, {@code 0} unless {@link #result} is SUNK. */
    int sunkShipLength;

    public static ShotOutcome miss(Coordinate coordinate) {
        return new ShotOutcome(coordinate, ShotResult.MISS, 0);
    }

    public static ShotOutcome hit(Coordinate coordinate) {
        return new ShotOutcome(coordinate, ShotResult.HIT, 0);
    }

    public static ShotOutcome sunk(Coordinate coordinate, int shipLength) {
        return new ShotOutcome(coordinate, ShotResult.SUNK, shipLength);
    }

    public boolean isHit() {
        return result != ShotResult.MISS;
    }

    public boolean isShipSunk() {
        return result == ShotResult.SUNK;
    }
}
