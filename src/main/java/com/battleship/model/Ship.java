package com.battleship.model;

import com.battleship.exception.NotInFootprintException;
import lombok.Getter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * A ship placed on a grid: an ordered footprint and one hit flag per segment.
 */
public class Ship {

    @Getter
    private final List<Coordinate> footprint;

    private final boolean[] hits;

    public Ship(List<Coordinate> footprint) {
        if (footprint == null || footprint.isEmpty()) {
            throw new IllegalArgumentException("Ship footprint must not be empty");
        }
        if (new HashSet<>(footprint).size() != footprint.size()) {
            throw new IllegalArgumentException("Ship footprint contains duplicate cells: " + footprint);
        }
        this.footprint = List.copyOf(footprint);
        this.hits = new boolean[footprint.size()];
    }

    /**
     * Builds a straight ship starting at {@code start} and extending right
     * (horizontal) or down (vertical).
     */
    public static Ship line(Coordinate start, int length, Orientation orientation) {
        if (length < 1) {
            throw new IllegalArgumentException("Ship length must be positive, got " + length);
        }
        List<Coordinate> cells = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            cells.add(start.offset(i * orientation.getRowStep(), i * orientation.getColStep()));
        }
        return new Ship(cells);
    }

    public int getLength() {
        return footprint.size();
    }

    public boolean occupies(Coordinate coordinate) {
        return footprint.contains(coordinate);
    }

    /**
     * Marks the segment at {@code coordinate} as hit. Hitting the same segment
     * twice has no further effect.
     *
     * @throws NotInFootprintException if the ship does not occupy the cell
     */
    public void registerHit(Coordinate coordinate) {
        int index = footprint.indexOf(coordinate);
        if (index < 0) {
            throw new NotInFootprintException(coordinate);
        }
        hits[index] = true;
    }

    public boolean isHitAt(Coordinate coordinate) {
        int index = footprint.indexOf(coordinate);
        return index >= 0 && hits[index];
    }

    public int getHitCount() {
        int count = 0;
        for (boolean hit : hits) {
            if (hit) {
                count++;
            }
        }
        return count;
    }

    public boolean isSunk() {
        return getHitCount() == hits.length;
    }

    @Override
    public String toString() {
        return "Ship" + footprint + (isSunk() ? " (sunk)" : "");
    }
}
