package com.gridmaze.generator;

import java.util.Arrays;
import java.util.Objects;

public record MazeSnapshot(
        int width,
        int height,
        boolean[][] verticalWalls,
        boolean[][] horizontalWalls,
        long seed,
        MazeAlgorithm algorithm,
        boolean goalInCenter
) {

    public MazeSnapshot {
        InvalidDimensionException.check(width, height);
        Objects.requireNonNull(algorithm, "algorithm");
        verticalWalls = requireShape(verticalWalls, width, height, "vertical_walls");
        horizontalWalls = requireShape(horizontalWalls, width, height, "horizontal_walls");
    }

    public static MazeSnapshot of(MazeResult result) {
        Objects.requireNonNull(result, "result");
        WallGrid grid = result.grid();
        GenerationConfig config = result.config();
        return new MazeSnapshot(
                grid.width(),
                grid.height(),
                grid.verticalWalls(),
                grid.horizontalWalls(),
                config.seed(),
                config.algorithm(),
                config.goalInCenter());
    }

    public MazeResult toResult() {
        GenerationConfig config = GenerationConfig.builder()
                .width(width)
                .height(height)
                .seed(seed)
                .algorithm(algorithm)
                .goalInCenter(goalInCenter)
                .build();
        WallGrid grid = WallGrid.fromWalls(width, height, verticalWalls, horizontalWalls);
        MazePlacement.StartGoal placement = MazePlacement.computeStartGoal(config);
        return new MazeResult(config, grid, placement.start(), placement.goal());
    }

    @Override
    public boolean[][] verticalWalls() {
        return copy(verticalWalls);
    }

    @Override
    public boolean[][] horizontalWalls() {
        return copy(horizontalWalls);
    }

    private static boolean[][] requireShape(boolean[][] walls, int width, int height, String label) {
        if (walls == null) {
            throw new MalformedMazeException(label + " is missing");
        }
        if (walls.length != height) {
            throw new MalformedMazeException(label + " must have " + height + " rows but has " + walls.length);
        }
        for (int y = 0; y < walls.length; y++) {
            if (walls[y] == null || walls[y].length != width) {
                throw new MalformedMazeException(label + " row " + y + " must have " + width + " entries");
            }
        }
        return copy(walls);
    }

    private static boolean[][] copy(boolean[][] source) {
        boolean[][] copy = new boolean[source.length][];
        for (int i = 0; i < source.length; i++) {
            copy[i] = source[i].clone();
        }
        return copy;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof MazeSnapshot other)) {
            return false;
        }
        return width == other.width
                && height == other.height
                && seed == other.seed
                && algorithm == other.algorithm
                && goalInCenter == other.goalInCenter
                && Arrays.deepEquals(verticalWalls, other.verticalWalls)
                && Arrays.deepEquals(horizontalWalls, other.horizontalWalls);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(width, height, seed, algorithm, goalInCenter);
        result = 31 * result + Arrays.deepHashCode(verticalWalls);
        result = 31 * result + Arrays.deepHashCode(horizontalWalls);
        return result;
    }

    @Override
    public String toString() {
        return "MazeSnapshot[" + width + "x" + height + ", " + algorithm + ", seed=" + seed
                + ", goalInCenter=" + goalInCenter + "]";
    }
}
