package com.gridmaze.generator;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

class WallGridTest {

    private static List<Cell> collect(Iterable<Cell> cells) {
        List<Cell> out = new ArrayList<>();
        cells.forEach(out::add);
        return out;
    }

    @Test
    void newGridIsFullyClosed() {
        WallGrid grid = new WallGrid(4, 3);
        assertEquals(0, grid.openPassageCount());
        assertEquals(12, grid.cellCount());
        for (boolean[] row : grid.verticalWalls()) {
            for (boolean wall : row) {
                assertTrue(wall);
            }
        }
        for (boolean[] row : grid.horizontalWalls()) {
            for (boolean wall : row) {
                assertTrue(wall);
            }
        }
    }

    @Test
    void rejectsNonPositiveDimensions() {
        InvalidDimensionException ex = assertThrows(InvalidDimensionException.class, () -> new WallGrid(0, 5));
        assertEquals(0, ex.width());
        assertEquals(5, ex.height());
        assertThrows(InvalidDimensionException.class, () -> new WallGrid(3, -1));
    }

    @Test
    void removingWallPicksOrientationFromCoordinates() {
        WallGrid grid = new WallGrid(3, 3);
        grid.removeWallBetween(new Cell(1, 2), new Cell(1, 1));
        assertFalse(grid.horizontalWalls()[1][1]);
        assertTrue(grid.isOpen(new Cell(1, 1), new Cell(1, 2)));

        grid.removeWallBetween(new Cell(2, 0), new Cell(1, 0));
        assertFalse(grid.verticalWalls()[0][1]);
        assertTrue(grid.isOpen(new Cell(1, 0), new Cell(2, 0)));

        assertFalse(grid.isOpen(new Cell(0, 0), new Cell(1, 0)));
        assertEquals(2, grid.openPassageCount());
    }

    @Test
    void rejectsCellsThatDoNotShareAnEdge() {
        WallGrid grid = new WallGrid(3, 3);
        assertThrows(NotAdjacentException.class, () -> grid.removeWallBetween(new Cell(0, 0), new Cell(1, 1)));
        assertThrows(NotAdjacentException.class, () -> grid.removeWallBetween(new Cell(0, 0), new Cell(2, 0)));
        assertThrows(NotAdjacentException.class, () -> grid.removeWallBetween(new Cell(0, 0), new Cell(0, 0)));
        assertThrows(NotAdjacentException.class, () -> grid.removeWallBetween(new Cell(2, 2), new Cell(3, 2)));
        assertThrows(NotAdjacentException.class, () -> grid.isOpen(new Cell(0, 0), new Cell(0, -1)));
        assertEquals(0, grid.openPassageCount());
    }

    @Test
    void neighborsFollowNorthEastSouthWestOrder() {
        WallGrid grid = new WallGrid(3, 3);
        assertEquals(
                List.of(new Cell(1, 0), new Cell(2, 1), new Cell(1, 2), new Cell(0, 1)),
                collect(grid.neighborsInBounds(new Cell(1, 1))));
        assertEquals(
                List.of(new Cell(1, 0), new Cell(0, 1)),
                collect(grid.neighborsInBounds(new Cell(0, 0))));
        assertEquals(
                List.of(new Cell(2, 1), new Cell(1, 2)),
                collect(grid.neighborsInBounds(new Cell(2, 2))));
    }

    @Test
    void neighborSequenceCanBeWalkedAgain() {
        WallGrid grid = new WallGrid(2, 2);
        Iterable<Cell> neighbors = grid.neighborsInBounds(new Cell(1, 0));
        assertEquals(collect(neighbors), collect(neighbors));
        assertTrue(collect(new WallGrid(1, 1).neighborsInBounds(Cell.ORIGIN)).isEmpty());
    }

    @Test
    void wallsOfReportsBorderAsClosed() {
        WallGrid grid = new WallGrid(2, 2);
        grid.removeWallBetween(new Cell(0, 0), new Cell(1, 0));
        CellWalls walls = grid.wallsOf(Cell.ORIGIN);
        assertTrue(walls.north());
        assertFalse(walls.east());
        assertTrue(walls.south());
        assertTrue(walls.west());
        assertEquals(3, walls.count());

        CellWalls corner = grid.wallsOf(new Cell(1, 1));
        assertEquals(new CellWalls(true, true, true, true), corner);
    }

    @Test
    void reachableCountFollowsOpenWalls() {
        WallGrid grid = new WallGrid(3, 1);
        assertEquals(1, grid.reachableCount(Cell.ORIGIN));
        grid.removeWallBetween(new Cell(0, 0), new Cell(1, 0));
        assertEquals(2, grid.reachableCount(Cell.ORIGIN));
        assertFalse(grid.isPerfectMaze());
        grid.removeWallBetween(new Cell(1, 0), new Cell(2, 0));
        assertTrue(grid.isPerfectMaze());
    }

    @Test
    void copyIsIndependent() {
        WallGrid grid = new WallGrid(2, 2);
        WallGrid copy = grid.copy();
        assertEquals(grid, copy);
        copy.removeWallBetween(new Cell(0, 0), new Cell(0, 1));
        assertNotEquals(grid, copy);
        assertEquals(0, grid.openPassageCount());
    }

    @Test
    void fromWallsRejectsWrongShape() {
        boolean[][] vertical = new boolean[2][3];
        boolean[][] horizontal = new boolean[2][2];
        assertThrows(IllegalArgumentException.class, () -> WallGrid.fromWalls(3, 2, vertical, horizontal));
    }

    @Test
    void cellIdIsRowMajor() {
        WallGrid grid = new WallGrid(5, 3);
        assertEquals(13, grid.cellId(new Cell(3, 2)));
        assertEquals(0, grid.cellId(Cell.ORIGIN));
        assertThrows(IndexOutOfBoundsException.class, () -> grid.cellId(new Cell(5, 0)));
    }

    @Test
    void rejectsGridsTooLargeToIndex() {
        InvalidDimensionException ex = assertThrows(InvalidDimensionException.class, () -> new WallGrid(50000, 50000));
        assertEquals(50000, ex.width());
        assertTrue(ex.getMessage().contains("2500000000"));
    }
}
