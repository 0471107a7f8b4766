package com.gridmaze.generator;

public record MazeGeometry(double cellSize) {

    public static final double DEFAULT_CELL_SIZE = 1.0d;

    public MazeGeometry {
        if (Double.isNaN(cellSize) || Double.isInfinite(cellSize) || cellSize <= 0.0) {
            throw new IllegalArgumentException("Cell size must be a positive number");
        }
    }

    public WorldPosition worldPositionOf(Cell cell) {
        return new WorldPosition((cell.x() + 0.5) * cellSize, (cell.y() + 0.5) * cellSize);
    }

    // not clamped: positions outside the maze give cells outside it
    public Cell cellContaining(WorldPosition position) {
        if (!Double.isFinite(position.x()) || !Double.isFinite(position.y())) {
            throw new IllegalArgumentException("World position must be finite but was ("
                    + position.x() + ", " + position.y() + ")");
        }
        int x = (int) Math.floor(position.x() / cellSize);
        int y = (int) Math.floor(position.y() / cellSize);
        return new Cell(x, y);
    }
}
