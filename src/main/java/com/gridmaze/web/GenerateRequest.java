package com.gridmaze.web;

public record GenerateRequest(
        Integer width,
        Integer height,
        Long seed,
        String algorithm,
        Boolean goalInCenter,
        Boolean save
) {
}
