package com.gridmaze.generator;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class MazePlacementTest {

    @Test
    void centeredGoalRoundsTowardLowerIndex() {
        MazePlacement.StartGoal even = MazePlacement.computeStartGoal(16, 16, true);
        assertEquals(Cell.ORIGIN, even.start());
        assertEquals(new Cell(7, 7), even.goal());

        MazePlacement.StartGoal odd = MazePlacement.computeStartGoal(5, 5, true);
        assertEquals(new Cell(2, 2), odd.goal());

        assertEquals(new Cell(3, 0), MazePlacement.computeStartGoal(8, 1, true).goal());
    }

    @Test
    void cornerGoalIsFarCorner() {
        assertEquals(new Cell(15, 15), MazePlacement.computeStartGoal(16, 16, false).goal());
        assertEquals(new Cell(6, 2), MazePlacement.computeStartGoal(7, 3, false).goal());
    }

    @Test
    void usesConfigFields() {
        GenerationConfig config = GenerationConfig.builder().width(9).height(4).goalInCenter(false).build();
        assertEquals(new Cell(8, 3), MazePlacement.computeStartGoal(config).goal());
    }

    @Test
    void rejectsInvalidDimensions() {
        assertThrows(InvalidDimensionException.class, () -> MazePlacement.computeStartGoal(0, 4, true));
    }

    @Test
    void geometryMapsCellCentersAndBack() {
        MazeGeometry geometry = new MazeGeometry(2.0);
        assertEquals(new WorldPosition(1.0, 5.0), geometry.worldPositionOf(new Cell(0, 2)));
        assertEquals(new Cell(0, 2), geometry.cellContaining(new WorldPosition(1.0, 5.0)));
        assertEquals(new Cell(1, 1), geometry.cellContaining(new WorldPosition(2.0, 3.99)));
        assertEquals(new Cell(-1, 0), geometry.cellContaining(new WorldPosition(-0.5, 0.0)));
        assertThrows(IllegalArgumentException.class, () -> new MazeGeometry(0.0));
    }

    @Test
    void geometryRejectsNonFinitePositions() {
        MazeGeometry geometry = new MazeGeometry(1.0);
        assertThrows(IllegalArgumentException.class, () -> geometry.cellContaining(new WorldPosition(Double.NaN, 0.5)));
        assertThrows(IllegalArgumentException.class, () -> geometry.cellContaining(new WorldPosition(0.5, Double.NEGATIVE_INFINITY)));
    }

    @Test
    void resultContainsOnlyItsOwnCells() {
        MazeResult result = MazeGenerator.generate(GenerationConfig.builder().width(3).height(2).seed(4L).build());
        assertTrue(result.contains(new Cell(2, 1)));
        assertFalse(result.contains(new Cell(3, 1)));
        assertFalse(result.contains(new Cell(0, -1)));
    }

    @Test
    void resultExposesWorldPositions() {
        MazeResult result = MazeGenerator.generate(GenerationConfig.builder()
                .width(4)
                .height(4)
                .seed(11L)
                .goalInCenter(false)
                .build());
        MazeGeometry geometry = new MazeGeometry(10.0);
        assertEquals(new WorldPosition(5.0, 5.0), result.startWorldPosition(geometry));
        assertEquals(new WorldPosition(35.0, 35.0), result.goalWorldPosition(geometry));
    }
}
