package com.gridmaze.generator;

public class NotAdjacentException extends IllegalStateException {

    public NotAdjacentException(Cell a, Cell b) {
        super("Cells " + a + " and " + b + " are not adjacent inside the grid");
    }
}
