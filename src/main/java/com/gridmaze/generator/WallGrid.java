package com.gridmaze.generator;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Wall layout of a rectangular maze.
 *
 * <p>{@code verticalWalls[y][x]} is the wall between {@code (x, y)} and
 * {@code (x + 1, y)}; {@code horizontalWalls[y][x]} is the wall between
 * {@code (x, y)} and {@code (x, y + 1)}. Both arrays are {@code height x width};
 * the last column of the vertical array and the last row of the horizontal
 * array are never read, the outer border is implicit.
 */
public final class WallGrid {

    private static final Direction[] ORDER = Direction.values();

    private final int width;
    private final int height;
    private final boolean[][] verticalWalls;
    private final boolean[][] horizontalWalls;

    public WallGrid(int width, int height) {
        InvalidDimensionException.check(width, height);
        this.width = width;
        this.height = height;
        this.verticalWalls = closedWalls(width, height);
        this.horizontalWalls = closedWalls(width, height);
    }

    private WallGrid(int width, int height, boolean[][] verticalWalls, boolean[][] horizontalWalls) {
        this.width = width;
        this.height = height;
        this.verticalWalls = verticalWalls;
        this.horizontalWalls = horizontalWalls;
    }

    public static WallGrid fromWalls(int width, int height, boolean[][] verticalWalls, boolean[][] horizontalWalls) {
        InvalidDimensionException.check(width, height);
        Objects.requireNonNull(verticalWalls, "verticalWalls");
        Objects.requireNonNull(horizontalWalls, "horizontalWalls");
        ensureShape(verticalWalls, width, height, "vertical");
        ensureShape(horizontalWalls, width, height, "horizontal");
        return new WallGrid(width, height, deepCopy(verticalWalls), deepCopy(horizontalWalls));
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int cellCount() {
        return Math.toIntExact((long) width * height);
    }

    public boolean contains(Cell cell) {
        return cell.x() >= 0 && cell.x() < width && cell.y() >= 0 && cell.y() < height;
    }

    public int cellId(Cell cell) {
        ensureInBounds(cell);
        return cell.y() * width + cell.x();
    }

    public void removeWallBetween(Cell a, Cell b) {
        setWallBetween(a, b, false);
    }

    public boolean isOpen(Cell a, Cell b) {
        ensureAdjacent(a, b);
        if (a.x() == b.x()) {
            return !horizontalWalls[Math.min(a.y(), b.y())][a.x()];
        }
        return !verticalWalls[a.y()][Math.min(a.x(), b.x())];
    }

    public void openAll() {
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (x < width - 1) {
                    verticalWalls[y][x] = false;
                }
                if (y < height - 1) {
                    horizontalWalls[y][x] = false;
                }
            }
        }
    }

    public Iterable<Cell> neighborsInBounds(Cell cell) {
        ensureInBounds(cell);
        return () -> new NeighborIterator(cell);
    }

    public CellWalls wallsOf(Cell cell) {
        ensureInBounds(cell);
        int x = cell.x();
        int y = cell.y();
        boolean north = y == 0 || horizontalWalls[y - 1][x];
        boolean east = x == width - 1 || verticalWalls[y][x];
        boolean south = y == height - 1 || horizontalWalls[y][x];
        boolean west = x == 0 || verticalWalls[y][x - 1];
        return new CellWalls(north, east, south, west);
    }

    public int openPassageCount() {
        int open = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (x < width - 1 && !verticalWalls[y][x]) {
                    open++;
                }
                if (y < height - 1 && !horizontalWalls[y][x]) {
                    open++;
                }
            }
        }
        return open;
    }

    public int reachableCount(Cell from) {
        ensureInBounds(from);
        boolean[][] seen = new boolean[height][width];
        Deque<Cell> queue = new ArrayDeque<>();
        seen[from.y()][from.x()] = true;
        queue.add(from);
        int reached = 0;
        while (!queue.isEmpty()) {
            Cell cell = queue.poll();
            reached++;
            for (Cell neighbor : neighborsInBounds(cell)) {
                if (!seen[neighbor.y()][neighbor.x()] && isOpen(cell, neighbor)) {
                    seen[neighbor.y()][neighbor.x()] = true;
                    queue.add(neighbor);
                }
            }
        }
        return reached;
    }

    // spanning tree: one fewer passage than cells, all cells connected
    public boolean isPerfectMaze() {
        return openPassageCount() == cellCount() - 1 && reachableCount(Cell.ORIGIN) == cellCount();
    }

    public boolean[][] verticalWalls() {
        return deepCopy(verticalWalls);
    }

    public boolean[][] horizontalWalls() {
        return deepCopy(horizontalWalls);
    }

    public WallGrid copy() {
        return new WallGrid(width, height, deepCopy(verticalWalls), deepCopy(horizontalWalls));
    }

    private void setWallBetween(Cell a, Cell b, boolean present) {
        ensureAdjacent(a, b);
        if (a.x() == b.x()) {
            horizontalWalls[Math.min(a.y(), b.y())][a.x()] = present;
        } else {
            verticalWalls[a.y()][Math.min(a.x(), b.x())] = present;
        }
    }

    private void ensureAdjacent(Cell a, Cell b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        if (!contains(a) || !contains(b) || a.manhattanDistance(b) != 1) {
            throw new NotAdjacentException(a, b);
        }
    }

    private void ensureInBounds(Cell cell) {
        Objects.requireNonNull(cell, "cell");
        if (!contains(cell)) {
            throw new IndexOutOfBoundsException("Cell " + cell + " is outside the " + width + "x" + height + " grid");
        }
    }

    private static boolean[][] closedWalls(int width, int height) {
        boolean[][] walls = new boolean[height][width];
        for (boolean[] row : walls) {
            Arrays.fill(row, true);
        }
        return walls;
    }

    private static void ensureShape(boolean[][] walls, int width, int height, String label) {
        if (walls.length != height) {
            throw new IllegalArgumentException("Expected " + height + " " + label + " wall rows but found " + walls.length);
        }
        for (int y = 0; y < walls.length; y++) {
            if (walls[y] == null || walls[y].length != width) {
                int found = walls[y] == null ? 0 : walls[y].length;
                throw new IllegalArgumentException("Expected " + width + " " + label + " walls in row " + y + " but found " + found);
            }
        }
    }

    private static boolean[][] deepCopy(boolean[][] source) {
        boolean[][] copy = new boolean[source.length][];
        for (int i = 0; i < source.length; i++) {
            copy[i] = source[i].clone();
        }
        return copy;
    }

    private final class NeighborIterator implements Iterator<Cell> {
        private final Cell origin;
        private int next;

        private NeighborIterator(Cell origin) {
            this.origin = origin;
            advance(0);
        }

        @Override
        public boolean hasNext() {
            return next < ORDER.length;
        }

        @Override
        public Cell next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Cell neighbor = origin.offset(ORDER[next]);
            advance(next + 1);
            return neighbor;
        }

        private void advance(int from) {
            int idx = from;
            while (idx < ORDER.length && !contains(origin.offset(ORDER[idx]))) {
                idx++;
            }
            next = idx;
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof WallGrid other)) {
            return false;
        }
        return width == other.width
                && height == other.height
                && Arrays.deepEquals(verticalWalls, other.verticalWalls)
                && Arrays.deepEquals(horizontalWalls, other.horizontalWalls);
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(width);
        result = 31 * result + Integer.hashCode(height);
        result = 31 * result + Arrays.deepHashCode(verticalWalls);
        result = 31 * result + Arrays.deepHashCode(horizontalWalls);
        return result;
    }
}
