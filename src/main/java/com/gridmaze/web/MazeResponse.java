package com.gridmaze.web;

import com.gridmaze.generator.Cell;
import com.gridmaze.generator.WorldPosition;

public record MazeResponse(
        int width,
        int height,
        long seed,
        String algorithm,
        boolean goalInCenter,
        Cell start,
        Cell goal,
        WorldPosition startWorld,
        WorldPosition goalWorld,
        int openPassages,
        boolean perfect,
        String savedPath
) {
}
