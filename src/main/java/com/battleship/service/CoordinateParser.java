package com.battleship.service;

import com.battleship.model.BoardDimensions;
import com.battleship.model.Coordinate;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts between board labels such as {@code "B3"} and {@link Coordinate}s.
 * Rows are letters starting at {@code A}, columns are 1-based numbers.
 */
@Component
public class CoordinateParser {

    private static final Pattern LABEL = Pattern.compile("([A-Z])(\\d{1,3})");

    /**
     * Parse a label against a board. Case and surrounding whitespace are ignored.
     *
     * @return the coordinate, or empty if the label is malformed or off the board
     */
    public Optional<Coordinate> parse(String label, BoardDimensions dimensions) {
        if (label == null) {
            return Optional.empty();
        }

        Matcher matcher = LABEL.matcher(label.trim().toUpperCase());
        if (!matcher.matches()) {
            return Optional.empty();
        }

        int row = matcher.group(1).charAt(0) - 'A';
        int col = Integer.parseInt(matcher.group(2)) - 1;
        Coordinate coordinate = new Coordinate(row, col);
        return dimensions.contains(coordinate) ? Optional.of(coordinate) : Optional.empty();
    }

    public String format(Coordinate coordinate) {
        return rowLabel(coordinate.row()) + (coordinate.col() + 1);
    }

    public String rowLabel(int row) {
        return String.valueOf((char) ('A' + row));
    }
}
