package com.gridmaze.generator;

public record Cell(int x, int y) {

    public static final Cell ORIGIN = new Cell(0, 0);

    public Cell offset(Direction direction) {
        return new Cell(x + direction.dx(), y + direction.dy());
    }

    public int manhattanDistance(Cell other) {
        return Math.abs(x - other.x) + Math.abs(y - other.y);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
