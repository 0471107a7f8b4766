package com.gridmaze.generator;

import java.util.Objects;

public final class MazeResult {

    private final GenerationConfig config;
    private final WallGrid grid;
    private final Cell start;
    private final Cell goal;

    public MazeResult(GenerationConfig config, WallGrid grid, Cell start, Cell goal) {
        this.config = Objects.requireNonNull(config, "config");
        this.grid = Objects.requireNonNull(grid, "grid").copy();
        this.start = Objects.requireNonNull(start, "start");
        this.goal = Objects.requireNonNull(goal, "goal");
        if (grid.width() != config.width() || grid.height() != config.height()) {
            throw new IllegalArgumentException("Grid " + grid.width() + "x" + grid.height()
                    + " does not match configured " + config.width() + "x" + config.height());
        }
    }

    public GenerationConfig config() {
        return config;
    }

    public WallGrid grid() {
        return grid.copy();
    }

    public int width() {
        return grid.width();
    }

    public int height() {
        return grid.height();
    }

    public Cell start() {
        return start;
    }

    public Cell goal() {
        return goal;
    }

    public boolean contains(Cell cell) {
        return grid.contains(cell);
    }

    public CellWalls wallsOf(Cell cell) {
        return grid.wallsOf(cell);
    }

    public boolean isOpen(Cell a, Cell b) {
        return grid.isOpen(a, b);
    }

    public int openPassageCount() {
        return grid.openPassageCount();
    }

    public boolean isPerfectMaze() {
        return grid.isPerfectMaze();
    }

    public WorldPosition startWorldPosition(MazeGeometry geometry) {
        return geometry.worldPositionOf(start);
    }

    public WorldPosition goalWorldPosition(MazeGeometry geometry) {
        return geometry.worldPositionOf(goal);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof MazeResult other)) {
            return false;
        }
        return config.equals(other.config)
                && grid.equals(other.grid)
                && start.equals(other.start)
                && goal.equals(other.goal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(config, grid, start, goal);
    }
}
