package com.battleship.dto;

import com.battleship.model.Coordinate;
import com.battleship.model.ShotResult;
import com.battleship.model.Side;
import lombok.Builder;
import lombok.Value;

/**
 * One shot of a game, as it is logged and shown to the player.
 */
@Value
@Builder
public class TurnReport {
    int turnNumber;
    Side shooter;
    Coordinate target;
    ShotResult result;
    int sunkShipLength;
    /** Set when this shot ended the game. */
    Side winner;

    public static TurnReport of(int turnNumber, Side shooter, ShotOutcome outcome, Side winner) {
        return TurnReport.builder()
                .turnNumber(turnNumber)
                .shooter(shooter)
                .target(outcome.getCoordinate())
                .result(outcome.getResult())
                .sunkShipLength(outcome.getSunkShipLength())
                .winner(winner)
                .build();
    }

    public boolean isGameOver() {
        return winner != null;
    }
}
