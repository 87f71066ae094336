package com.battleship.service;

import com.battleship.model.BoardDimensions;
import com.battleship.model.Coordinate;
import com.battleship.model.Grid;
import com.battleship.model.Orientation;
import com.battleship.model.Ship;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.fusesource.jansi.Ansi;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoardRendererTest {

    private final BoardRenderer renderer = new BoardRenderer(new CoordinateParser());
    private Grid grid;

    @BeforeEach
    void setUp() {
        grid = new Grid(BoardDimensions.square(2));
        grid.place(Ship.line(Coordinate.of(0, 0), 2, Orientation.HORIZONTAL));
        grid.fire(Coordinate.of(0, 0));
        grid.fire(Coordinate.of(1, 1));
    }

    @Test
    @DisplayName("render() should show hits, misses and own ships")
    void shouldRevealOwnShips() {
        assertEquals(List.of(
                "  1 2",
                "A X S",
                "B   O"), renderer.render(grid, true));
    }

    @Test
    @DisplayName("render() should hide intact ship segments of the opponent")
    void shouldHideOpponentShips() {
        assertEquals(List.of(
                "  1 2",
                "A X  ",
                "B   O"), renderer.render(grid, false));
    }

    @Test
    @DisplayName("renderSideBySide() should title and align both boards")
    void shouldRenderSideBySide() {
        List<String> lines = renderer.renderSideBySide(grid, grid);

        assertEquals(4, lines.size());
        assertEquals("Your Fleet    Enemy Waters", lines.get(0));
        assertEquals("A X S         A X  ", lines.get(2));
        assertEquals(lines.get(0).indexOf("Enemy"), lines.get(3).indexOf("B", 1));
    }

    @Test
    @DisplayName("with colour on, hits should be red, misses cyan and ships green")
    void shouldColourSymbols() {
        ReflectionTestUtils.setField(renderer, "color", true);
        String red = Ansi.ansi().fg(Ansi.Color.RED).a('X').reset().toString();
        String green = Ansi.ansi().fg(Ansi.Color.GREEN).a('S').reset().toString();
        String cyan = Ansi.ansi().fg(Ansi.Color.CYAN).a('O').reset().toString();

        List<String> lines = renderer.render(grid, true);

        assertEquals("  1 2", lines.get(0));
        assertEquals("A " + red + " " + green, lines.get(1));
        assertEquals("B   " + cyan, lines.get(2));
    }

    @Test
    @DisplayName("with colour on, the opponent board should still line up")
    void shouldAlignColouredBoards() {
        ReflectionTestUtils.setField(renderer, "color", true);
        String red = Ansi.ansi().fg(Ansi.Color.RED).a('X').reset().toString();
        String green = Ansi.ansi().fg(Ansi.Color.GREEN).a('S').reset().toString();

        List<String> lines = renderer.renderSideBySide(grid, grid);

        assertEquals("Your Fleet    Enemy Waters", lines.get(0));
        assertEquals("A " + red + " " + green + "         A " + red + "  ", lines.get(2));
    }
}
