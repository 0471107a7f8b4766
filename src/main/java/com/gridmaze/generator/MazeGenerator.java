package com.gridmaze.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Carves passages into a fully closed {@link WallGrid}.
 *
 * <p>The only source of randomness is the {@link Random} handed in, so the
 * same config and the same seeded generator always give the same maze, and
 * separate calls with their own generators can run on separate threads.
 */
public final class MazeGenerator {

    private MazeGenerator() {
    }

    public static MazeResult generate(GenerationConfig config) {
        Objects.requireNonNull(config, "config");
        return generate(config, seededRandom(config.seed()));
    }

    public static MazeResult generate(GenerationConfig config, Random random) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(random, "random");
        InvalidDimensionException.check(config.width(), config.height());

        WallGrid grid = new WallGrid(config.width(), config.height());
        switch (config.algorithm()) {
            case PRIM -> carvePrim(grid, random);
            case KRUSKAL -> carveKruskal(grid, random);
            case CUSTOM -> grid.openAll();
        }
        MazePlacement.StartGoal placement = MazePlacement.computeStartGoal(config);
        return new MazeResult(config, grid, placement.start(), placement.goal());
    }

    // seed 0 means unseeded
    public static Random seededRandom(long seed) {
        return seed == GenerationConfig.RANDOM_SEED ? new Random() : new Random(seed);
    }

    // every interior wall once, row by row: east edge then south edge of each cell
    public static List<WallEdge> kruskalEdges(int width, int height) {
        InvalidDimensionException.check(width, height);
        List<WallEdge> edges = new ArrayList<>(Math.toIntExact(2L * width * height - width - height));
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                Cell cell = new Cell(x, y);
                if (x < width - 1) {
                    edges.add(new WallEdge(cell, cell.offset(Direction.EAST)));
                }
                if (y < height - 1) {
                    edges.add(new WallEdge(cell, cell.offset(Direction.SOUTH)));
                }
            }
        }
        return edges;
    }

    static void carvePrim(WallGrid grid, Random random) {
        boolean[][] visited = new boolean[grid.height()][grid.width()];
        List<FrontierEntry> frontier = new ArrayList<>();

        Cell start = new Cell(random.nextInt(grid.width()), random.nextInt(grid.height()));
        visited[start.y()][start.x()] = true;
        frontier.add(new FrontierEntry(start, null));

        while (!frontier.isEmpty()) {
            FrontierEntry entry = frontier.remove(random.nextInt(frontier.size()));
            Cell cell = entry.cell();
            if (entry.from() != null) {
                grid.removeWallBetween(entry.from(), cell);
            }
            for (Cell neighbor : grid.neighborsInBounds(cell)) {
                if (!visited[neighbor.y()][neighbor.x()]) {
                    visited[neighbor.y()][neighbor.x()] = true;
                    frontier.add(new FrontierEntry(neighbor, cell));
                }
            }
        }
    }

    static void carveKruskal(WallGrid grid, Random random) {
        List<WallEdge> edges = kruskalEdges(grid.width(), grid.height());
        shuffle(edges, random);
        DisjointSet sets = new DisjointSet(grid.cellCount());
        for (WallEdge edge : edges) {
            if (sets.union(grid.cellId(edge.first()), grid.cellId(edge.second()))) {
                grid.removeWallBetween(edge.first(), edge.second());
            }
        }
        if (sets.setCount() != 1) {
            throw new IllegalStateException("Kruskal carving left " + sets.setCount() + " disconnected regions");
        }
    }

    // Fisher-Yates from the last index down
    static <T> void shuffle(List<T> items, Random random) {
        for (int i = items.size() - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            T swap = items.get(i);
            items.set(i, items.get(j));
            items.set(j, swap);
        }
    }

    private record FrontierEntry(Cell cell, Cell from) {
    }
}
