package com.battleship.console;

import com.battleship.config.BoardPreset;
import com.battleship.dto.ShipPlacement;
import com.battleship.dto.TurnReport;
import com.battleship.exception.InvalidPlacementException;
import com.battleship.model.CPUDifficulty;
import com.battleship.model.Coordinate;
import com.battleship.model.Game;
import com.battleship.model.Grid;
import com.battleship.model.Orientation;
import com.battleship.model.ShotResult;
import com.battleship.model.Side;
import com.battleship.service.BoardRenderer;
import com.battleship.service.CoordinateParser;
import com.battleship.service.FleetPlacementService;
import com.battleship.service.GameService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.fusesource.jansi.AnsiConsole;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Interactive console game: setup prompts, then one round per entered target
 * until a fleet is sunk or the player quits with {@code q}.
 */
@Component
@ConditionalOnProperty(name = "game.console.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ConsoleGameRunner implements CommandLineRunner {

    private static final String QUIT = "q";

    private final GameService gameService;
    private final FleetPlacementService fleetPlacementService;
    private final CoordinateParser coordinateParser;
    private final BoardRenderer boardRenderer;

    @Value("${game.default-difficulty:MEDIUM}")
    private CPUDifficulty defaultDifficulty;

    @Value("${game.default-preset:small}")
    private String defaultPreset;

    @Override
    public void run(String... args) throws IOException {
        AnsiConsole.systemInstall();
        try {
            play(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
        } finally {
            AnsiConsole.systemUninstall();
        }
    }

    /**
     * Runs one game against the given streams.
     *
     * @return the finished game, or empty if the player quit
     */
    public Optional<Game> play(BufferedReader in, PrintStream out) throws IOException {
        Optional<CPUDifficulty> difficulty = selectDifficulty(in, out);
        if (difficulty.isEmpty()) {
            return quit(out);
        }

        Optional<BoardPreset> preset = selectPreset(in, out);
        if (preset.isEmpty()) {
            return quit(out);
        }

        Optional<Game> created = setUpGame(in, out, preset.get(), difficulty.get());
        if (created.isEmpty()) {
            return quit(out);
        }

        Game game = created.get();
        List<String> messages = new ArrayList<>();

        while (!game.isFinished()) {
            boardRenderer.renderSideBySide(game.getHumanGrid(), game.getCpuGrid()).forEach(out::println);
            messages.forEach(out::println);
            messages.clear();

            String input = prompt(in, out, "Enter target (e.g. B3) or 'q' to quit: ");
            if (input == null || input.equalsIgnoreCase(QUIT)) {
                return quit(out);
            }

            Optional<Coordinate> target = coordinateParser.parse(input, game.getDimensions());
            if (target.isEmpty()) {
                messages.add("Invalid coordinate!");
                continue;
            }
            if (game.getCpuGrid().isFiredAt(target.get())) {
                messages.add("You already fired at " + coordinateParser.format(target.get()) + "!");
                continue;
            }

            for (TurnReport report : gameService.playRound(game, target.get())) {
                messages.add(describe(report));
            }
        }

        out.println();
        boardRenderer.renderSideBySide(game.getHumanGrid(), game.getCpuGrid()).forEach(out::println);
        messages.forEach(out::println);
        out.println(game.getWinner() == Side.HUMAN ? "You win!" : "You lose!");
        return Optional.of(game);
    }

    // ── setup ───────────────────────────────────────────────────────────

    private Optional<CPUDifficulty> selectDifficulty(BufferedReader in, PrintStream out) throws IOException {
        String choices = Arrays.stream(CPUDifficulty.values())
                .map(d -> capitalize(d.name()))
                .collect(Collectors.joining(", "));

        while (true) {
            String input = prompt(in, out, "Select CPU difficulty: " + choices
                    + " [" + capitalize(defaultDifficulty.name()) + "] or 'q' to quit: ");
            if (input == null || input.equalsIgnoreCase(QUIT)) {
                return Optional.empty();
            }
            if (input.isEmpty()) {
                return Optional.of(defaultDifficulty);
            }
            try {
                return Optional.of(CPUDifficulty.fromLabel(input));
            } catch (IllegalArgumentException e) {
                log.warn("Rejected difficulty '{}': {}", input, e.getMessage());
                out.println("Choose one of: " + choices);
            }
        }
    }

    private Optional<BoardPreset> selectPreset(BufferedReader in, PrintStream out) throws IOException {
        List<BoardPreset> presets = gameService.getAvailablePresets();
        String choices = presets.stream().map(BoardPreset::label).collect(Collectors.joining(" / "));

        while (true) {
            String input = prompt(in, out, "Select board size: " + choices
                    + " [" + defaultPreset + "] or 'q' to quit: ");
            if (input == null || input.equalsIgnoreCase(QUIT)) {
                return Optional.empty();
            }
            try {
                return Optional.of(gameService.getPreset(input.isEmpty() ? defaultPreset : input));
            } catch (IllegalArgumentException e) {
                log.warn("Rejected preset '{}': {}", input, e.getMessage());
                out.println("Please type one of: "
                        + presets.stream().map(BoardPreset::id).collect(Collectors.joining(", ")) + ", or 'q'.");
            }
        }
    }

    private Optional<Game> setUpGame(BufferedReader in, PrintStream out, BoardPreset preset,
                                     CPUDifficulty difficulty) throws IOException {
        String answer = prompt(in, out, "Place your ships yourself? [y/N]: ");
        if (answer == null || answer.equalsIgnoreCase(QUIT)) {
            return Optional.empty();
        }
        if (!answer.equalsIgnoreCase("y")) {
            return Optional.of(gameService.createGame(preset.id(), difficulty));
        }

        Grid grid = fleetPlacementService.newGrid(preset.dimensions());
        for (int size : preset.shipSizes()) {
            boolean placed = false;
            while (!placed) {
                boardRenderer.render(grid, true).forEach(out::println);

                String start = prompt(in, out, "Enter start coord for ship of size " + size + " (e.g. A1): ");
                if (start == null || start.equalsIgnoreCase(QUIT)) {
                    return Optional.empty();
                }
                String orientation = prompt(in, out, "Orientation horizontal [h] or vertical [v]: ");
                if (orientation == null || orientation.equalsIgnoreCase(QUIT)) {
                    return Optional.empty();
                }

                placed = tryPlace(grid, start, orientation, size);
                if (!placed) {
                    out.println("Invalid placement, try again.");
                }
            }
        }
        return Optional.of(gameService.createGame(preset.id(), difficulty, grid));
    }

    private boolean tryPlace(Grid grid, String startLabel, String orientationLabel, int size) {
        Optional<Coordinate> start = coordinateParser.parse(startLabel, grid.dimensions());
        if (start.isEmpty()) {
            return false;
        }
        try {
            Orientation orientation = Orientation.fromLabel(orientationLabel);
            fleetPlacementService.place(grid, ShipPlacement.of(start.get(), orientation, size));
            return true;
        } catch (InvalidPlacementException e) {
            log.warn("Rejected placement of size {} at {}: {}", size, startLabel, e.getMessage());
            return false;
        } catch (IllegalArgumentException e) {
            log.warn("Rejected orientation '{}': {}", orientationLabel, e.getMessage());
            return false;
        }
    }

    // ── output ──────────────────────────────────────────────────────────

    private String describe(TurnReport report) {
        String who = report.getShooter() == Side.HUMAN ? "You fire" : "Computer fires";
        String result = switch (report.getResult()) {
            case MISS -> "Miss";
            case HIT -> "Hit";
            case SUNK -> "Hit and sunk a ship of size " + report.getSunkShipLength() + "!";
        };
        String line = who + " at " + coordinateParser.format(report.getTarget()) + ": " + result;
        if (report.getResult() == ShotResult.SUNK && report.isGameOver()) {
            line += " That was the last one.";
        }
        return line;
    }

    private String prompt(BufferedReader in, PrintStream out, String text) throws IOException {
        out.print(text);
        out.flush();
        String line = in.readLine();
        return line == null ? null : line.trim();
    }

    private Optional<Game> quit(PrintStream out) {
        out.println();
        out.println("Quitting game. Goodbye!");
        return Optional.empty();
    }

    private static String capitalize(String name) {
        return name.charAt(0) + name.substring(1).toLowerCase();
    }
}
