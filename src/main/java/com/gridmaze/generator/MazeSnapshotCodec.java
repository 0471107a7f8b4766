package com.gridmaze.generator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON encoding of {@link MazeSnapshot}.
 *
 * <p>Reading is lenient about absent fields: width and height fall back to
 * 16, seed to 0, algorithm to PRIM, goal placement to the far corner, and
 * absent or empty wall arrays load as a fully closed grid. Wall arrays that
 * are present but do not match {@code height x width} are rejected, as are
 * dimensions over the cell limit.
 */
public final class MazeSnapshotCodec {

    public static final String WIDTH = "width";
    public static final String HEIGHT = "height";
    public static final String VERTICAL_WALLS = "vertical_walls";
    public static final String HORIZONTAL_WALLS = "horizontal_walls";
    public static final String SEED = "seed";
    public static final String ALGORITHM = "algorithm";
    public static final String GOAL_IN_CENTER = "goal_in_center";

    private final ObjectMapper mapper;
    private final long maxCells;

    public MazeSnapshotCodec() {
        this(new ObjectMapper(), InvalidDimensionException.MAX_GRID_CELLS);
    }

    public MazeSnapshotCodec(long maxCells) {
        this(new ObjectMapper(), maxCells);
    }

    public MazeSnapshotCodec(ObjectMapper mapper, long maxCells) {
        if (maxCells <= 0) {
            throw new IllegalArgumentException("maxCells must be positive but was " + maxCells);
        }
        this.mapper = Objects.requireNonNull(mapper, "mapper").copy()
                .disable(SerializationFeature.INDENT_OUTPUT);
        this.maxCells = Math.min(maxCells, InvalidDimensionException.MAX_GRID_CELLS);
    }

    public long maxCells() {
        return maxCells;
    }

    public byte[] serialize(MazeSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        ObjectNode root = mapper.createObjectNode();
        root.put(WIDTH, snapshot.width());
        root.put(HEIGHT, snapshot.height());
        root.set(VERTICAL_WALLS, wallsNode(snapshot.verticalWalls()));
        root.set(HORIZONTAL_WALLS, wallsNode(snapshot.horizontalWalls()));
        root.put(SEED, snapshot.seed());
        root.put(ALGORITHM, snapshot.algorithm().name());
        root.put(GOAL_IN_CENTER, snapshot.goalInCenter());
        try {
            return mapper.writeValueAsBytes(root);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize maze", ex);
        }
    }

    public String serializeToString(MazeSnapshot snapshot) {
        return new String(serialize(snapshot), StandardCharsets.UTF_8);
    }

    public MazeSnapshot deserialize(String json) {
        Objects.requireNonNull(json, "json");
        return deserialize(json.getBytes(StandardCharsets.UTF_8));
    }

    public MazeSnapshot deserialize(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        JsonNode root;
        try {
            root = mapper.readTree(bytes);
        } catch (IOException ex) {
            throw new MalformedMazeException("Maze payload is not valid JSON", ex);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedMazeException("Maze payload must be a JSON object");
        }

        int width = readInt(root, WIDTH, GenerationConfig.DEFAULT_WIDTH);
        int height = readInt(root, HEIGHT, GenerationConfig.DEFAULT_HEIGHT);
        long seed = readLong(root, SEED, GenerationConfig.RANDOM_SEED);
        MazeAlgorithm algorithm = readAlgorithm(root);
        boolean goalInCenter = readBoolean(root, GOAL_IN_CENTER, false);
        InvalidDimensionException.check(width, height);
        InvalidDimensionException.checkLimit(width, height, maxCells);
        boolean[][] verticalWalls = readWalls(root, VERTICAL_WALLS, width, height);
        boolean[][] horizontalWalls = readWalls(root, HORIZONTAL_WALLS, width, height);

        return new MazeSnapshot(width, height, verticalWalls, horizontalWalls, seed, algorithm, goalInCenter);
    }

    private ArrayNode wallsNode(boolean[][] walls) {
        ArrayNode rows = mapper.createArrayNode();
        for (boolean[] wallRow : walls) {
            ArrayNode row = rows.addArray();
            for (boolean wall : wallRow) {
                row.add(wall);
            }
        }
        return rows;
    }

    private static int readInt(JsonNode root, String field, int fallback) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new MalformedMazeException("Field '" + field + "' must be an integer but was " + node);
        }
        return node.intValue();
    }

    private static long readLong(JsonNode root, String field, long fallback) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isIntegralNumber() || !node.canConvertToLong()) {
            throw new MalformedMazeException("Field '" + field + "' must be an integer but was " + node);
        }
        return node.longValue();
    }

    private static boolean readBoolean(JsonNode root, String field, boolean fallback) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isBoolean()) {
            throw new MalformedMazeException("Field '" + field + "' must be a boolean but was " + node);
        }
        return node.booleanValue();
    }

    private static MazeAlgorithm readAlgorithm(JsonNode root) {
        JsonNode node = root.get(ALGORITHM);
        if (node == null || node.isNull()) {
            return MazeAlgorithm.PRIM;
        }
        try {
            if (node.isIntegralNumber()) {
                return MazeAlgorithm.fromOrdinal(node.intValue());
            }
            if (node.isTextual()) {
                return MazeAlgorithm.parse(node.textValue());
            }
        } catch (IllegalArgumentException ex) {
            throw new MalformedMazeException("Field '" + ALGORITHM + "' is invalid: " + ex.getMessage(), ex);
        }
        throw new MalformedMazeException("Field '" + ALGORITHM + "' must be a name or an ordinal but was " + node);
    }

    private static boolean[][] readWalls(JsonNode root, String field, int width, int height) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || (node.isArray() && node.isEmpty())) {
            return closedWalls(width, height);
        }
        if (!node.isArray()) {
            throw new MalformedMazeException("Field '" + field + "' must be an array of rows");
        }
        if (node.size() != height) {
            throw new MalformedMazeException("Field '" + field + "' has " + node.size() + " rows but height is " + height);
        }
        boolean[][] walls = new boolean[height][width];
        for (int y = 0; y < height; y++) {
            JsonNode row = node.get(y);
            if (!row.isArray() || row.size() != width) {
                throw new MalformedMazeException("Field '" + field + "' row " + y + " must hold " + width + " booleans");
            }
            for (int x = 0; x < width; x++) {
                JsonNode value = row.get(x);
                if (!value.isBoolean()) {
                    throw new MalformedMazeException("Field '" + field + "' row " + y + " holds a non-boolean: " + value);
                }
                walls[y][x] = value.booleanValue();
            }
        }
        return walls;
    }

    private static boolean[][] closedWalls(int width, int height) {
        boolean[][] walls = new boolean[height][width];
        for (boolean[] row : walls) {
            Arrays.fill(row, true);
        }
        return walls;
    }
}
