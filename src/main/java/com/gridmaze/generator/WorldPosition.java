package com.gridmaze.generator;

public record WorldPosition(double x, double y) {
}
