package com.gridmaze.generator;

import java.util.Objects;

public final class GenerationConfig {

    public static final int DEFAULT_WIDTH = 16;
    public static final int DEFAULT_HEIGHT = 16;
    public static final long RANDOM_SEED = 0L;

    private final int width;
    private final int height;
    private final long seed;
    private final MazeAlgorithm algorithm;
    private final boolean goalInCenter;

    private GenerationConfig(Builder builder) {
        this.width = builder.width;
        this.height = builder.height;
        this.seed = builder.seed;
        this.algorithm = builder.algorithm;
        this.goalInCenter = builder.goalInCenter;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    // 0 asks for a fresh seed on every run
    public long seed() {
        return seed;
    }

    public MazeAlgorithm algorithm() {
        return algorithm;
    }

    public boolean goalInCenter() {
        return goalInCenter;
    }

    public Builder toBuilder() {
        return new Builder()
                .width(width)
                .height(height)
                .seed(seed)
                .algorithm(algorithm)
                .goalInCenter(goalInCenter);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof GenerationConfig other)) {
            return false;
        }
        return width == other.width
                && height == other.height
                && seed == other.seed
                && algorithm == other.algorithm
                && goalInCenter == other.goalInCenter;
    }

    @Override
    public int hashCode() {
        return Objects.hash(width, height, seed, algorithm, goalInCenter);
    }

    @Override
    public String toString() {
        return width + "x" + height + " " + algorithm + " seed=" + seed + (goalInCenter ? " goal=center" : " goal=corner");
    }

    public static final class Builder {
        private int width = DEFAULT_WIDTH;
        private int height = DEFAULT_HEIGHT;
        private long seed = RANDOM_SEED;
        private MazeAlgorithm algorithm = MazeAlgorithm.PRIM;
        private boolean goalInCenter = true;

        public Builder width(int width) {
            this.width = width;
            return this;
        }

        public Builder height(int height) {
            this.height = height;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder algorithm(MazeAlgorithm algorithm) {
            this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
            return this;
        }

        public Builder goalInCenter(boolean goalInCenter) {
            this.goalInCenter = goalInCenter;
            return this;
        }

        public GenerationConfig build() {
            return new GenerationConfig(this);
        }
    }
}
