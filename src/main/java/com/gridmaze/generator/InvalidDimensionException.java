package com.gridmaze.generator;

public class InvalidDimensionException extends IllegalArgumentException {

    // keeps 2 * cells, the interior wall count bound, inside an int
    static final long MAX_GRID_CELLS = Integer.MAX_VALUE / 2;

    private final int width;
    private final int height;

    public InvalidDimensionException(int width, int height) {
        this(width, height, "Maze dimensions must be positive but were " + width + "x" + height);
    }

    public InvalidDimensionException(int width, int height, String message) {
        super(message);
        this.width = width;
        this.height = height;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    static void check(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new InvalidDimensionException(width, height);
        }
        checkLimit(width, height, MAX_GRID_CELLS);
    }

    public static void checkLimit(int width, int height, long maxCells) {
        long cells = (long) width * height;
        if (cells > maxCells) {
            throw new InvalidDimensionException(width, height,
                    "Maze " + width + "x" + height + " has " + cells + " cells, more than the limit of " + maxCells);
        }
    }
}
