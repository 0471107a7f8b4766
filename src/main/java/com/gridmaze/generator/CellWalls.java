package com.gridmaze.generator;

public record CellWalls(boolean north, boolean east, boolean south, boolean west) {

    public boolean has(Direction direction) {
        return switch (direction) {
            case NORTH -> north;
            case EAST -> east;
            case SOUTH -> south;
            case WEST -> west;
        };
    }

    public int count() {
        int count = 0;
        for (Direction direction : Direction.values()) {
            if (has(direction)) {
                count++;
            }
        }
        return count;
    }
}
