package com.gridmaze.generator;

public record WallEdge(Cell first, Cell second) {
}
