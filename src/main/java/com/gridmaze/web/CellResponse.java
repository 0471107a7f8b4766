package com.gridmaze.web;

import com.gridmaze.generator.Cell;
import com.gridmaze.generator.CellWalls;

public record CellResponse(
        double worldX,
        double worldY,
        Cell cell,
        boolean insideMaze,
        CellWalls walls
) {
}
