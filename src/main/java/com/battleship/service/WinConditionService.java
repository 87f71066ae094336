package com.battleship.service;

import com.battleship.model.Game;
import com.battleship.model.GameStatus;
import com.battleship.model.Side;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Service responsible for detecting the end of a game.
 */
@Service
@Slf4j
public class WinConditionService {

    /**
     * Check if the game is over after a shot. A side wins once every ship of
     * the other side is sunk; the game is then marked finished.
     *
     * @return the winner, if there is one
     */
    public Optional<Side> checkGameOver(Game game) {
        if (game.isFinished()) {
            return Optional.ofNullable(game.getWinner());
        }

        Side winner = null;
        if (game.getCpuGrid().allShipsSunk()) {
            winner = Side.HUMAN;
        } else if (game.getHumanGrid().allShipsSunk()) {
            winner = Side.CPU;
        }

        if (winner != null) {
            finishGame(game, winner);
        }
        return Optional.ofNullable(winner);
    }

    private void finishGame(Game game, Side winner) {
        game.setStatus(GameStatus.FINISHED);
        game.setWinner(winner);
        log.info("Game {} over after {} turn(s): {} wins", game.getId(), game.getTurnNumber(), winner);
    }
}
