package com.gridmaze.generator;

import java.util.Objects;

public final class MazePlacement {

    private MazePlacement() {
    }

    public static StartGoal computeStartGoal(GenerationConfig config) {
        Objects.requireNonNull(config, "config");
        return computeStartGoal(config.width(), config.height(), config.goalInCenter());
    }

    // centered goal rounds down to the lower-index cell of the middle pair
    public static StartGoal computeStartGoal(int width, int height, boolean goalInCenter) {
        InvalidDimensionException.check(width, height);
        Cell goal = goalInCenter
                ? new Cell((width - 1) / 2, (height - 1) / 2)
                : new Cell(width - 1, height - 1);
        return new StartGoal(Cell.ORIGIN, goal);
    }

    public record StartGoal(Cell start, Cell goal) {
    }
}
