package com.battleship;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main entry point for the Battleship AI console game.
 *
 * Features:
 * - Three CPU opponents (random, hunt/probe, checkerboard + line inference)
 * - Board presets loaded from JSON
 * - Manual or random fleet placement
 */
@SpringBootApplication
public class BattleshipAIApplication {

    public static void main(String[] args) {
        SpringApplication.run(BattleshipAIApplication.class, args);
    }
}
