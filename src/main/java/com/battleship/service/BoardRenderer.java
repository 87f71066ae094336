package com.battleship.service;

import com.battleship.model.BoardDimensions;
import com.battleship.model.CellState;
import com.battleship.model.Coordinate;
import com.battleship.model.Grid;
import lombok.RequiredArgsConstructor;
import org.fusesource.jansi.Ansi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Text view of a grid for the console.
 * <p>
 * {@code X} hit, {@code O} miss, {@code S} intact ship segment (only when
 * ships are revealed), blank for unknown water. With {@code game.console.color}
 * the symbols are coloured red, cyan and green.
 */
@Component
@RequiredArgsConstructor
public class BoardRenderer {

    private static final String GAP = "    ";

    private final CoordinateParser coordinateParser;

    @Value("${game.console.color:true}")
    private boolean color;

    public List<String> render(Grid grid, boolean revealShips) {
        return render(grid, revealShips, color);
    }

    private List<String> render(Grid grid, boolean revealShips, boolean colored) {
        BoardDimensions dimensions = grid.dimensions();
        List<String> lines = new ArrayList<>(dimensions.rows() + 1);

        StringBuilder header = new StringBuilder(" ");
        for (int c = 0; c < dimensions.cols(); c++) {
            header.append(' ').append(c + 1);
        }
        lines.add(header.toString());

        for (int r = 0; r < dimensions.rows(); r++) {
            StringBuilder line = new StringBuilder(coordinateParser.rowLabel(r));
            for (int c = 0; c < dimensions.cols(); c++) {
                char symbol = symbol(grid.cellState(new Coordinate(r, c)), revealShips);
                line.append(' ').append(colored ? colorize(symbol) : String.valueOf(symbol));
            }
            lines.add(line.toString());
        }
        return lines;
    }

    /**
     * The player's own fleet (ships shown) next to the opponent's waters (ships hidden).
     */
    public List<String> renderSideBySide(Grid own, Grid opponent) {
        List<String> left = render(own, true);
        List<String> right = render(opponent, false);
        // escape codes take no columns, so widths come from the plain text
        List<String> plainLeft = color ? render(own, true, false) : left;
        int width = Math.max(plainLeft.get(0).length(), "Your Fleet".length());

        List<String> lines = new ArrayList<>(left.size() + 1);
        lines.add(pad("Your Fleet", width) + GAP + "Enemy Waters");
        for (int i = 0; i < Math.max(left.size(), right.size()); i++) {
            String l = i < left.size() ? left.get(i) : "";
            String r = i < right.size() ? right.get(i) : "";
            int visible = i < plainLeft.size() ? plainLeft.get(i).length() : 0;
            lines.add(l + " ".repeat(Math.max(0, width - visible)) + GAP + r);
        }
        return lines;
    }

    private char symbol(CellState state, boolean revealShips) {
        return switch (state) {
            case HIT -> 'X';
            case MISS -> 'O';
            case SHIP -> revealShips ? 'S' : ' ';
            case EMPTY -> ' ';
        };
    }

    private static String colorize(char symbol) {
        Ansi.Color fg = switch (symbol) {
            case 'X' -> Ansi.Color.RED;
            case 'O' -> Ansi.Color.CYAN;
            case 'S' -> Ansi.Color.GREEN;
            default -> null;
        };
        return fg == null ? String.valueOf(symbol) : Ansi.ansi().fg(fg).a(symbol).reset().toString();
    }

    private static String pad(String text, int width) {
        return text.length() >= width ? text : text + " ".repeat(width - text.length());
    }
}
