package com.gridmaze.config;

import com.gridmaze.generator.GenerationConfig;
import com.gridmaze.generator.MazeAlgorithm;
import com.gridmaze.generator.MazeGeometry;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class AppProperties {

    private static final String DEFAULT_STORE_PATH = "maze/last.json";
    private static final int DEFAULT_MAX_CELLS = 1_000_000;

    private final String bindHost;
    private final int bindPort;
    private final int mazeWidth;
    private final int mazeHeight;
    private final MazeAlgorithm mazeAlgorithm;
    private final boolean goalInCenter;
    private final double cellSize;
    private final Path storePath;
    private final int maxCells;

    public AppProperties(Environment environment) {
        BindAddress address = determineBindAddress(environment);
        this.bindHost = address.host();
        this.bindPort = address.port();

        this.mazeWidth = parsePositiveInt(environment, "app.maze.width", "MAZE_WIDTH", GenerationConfig.DEFAULT_WIDTH);
        this.mazeHeight = parsePositiveInt(environment, "app.maze.height", "MAZE_HEIGHT", GenerationConfig.DEFAULT_HEIGHT);
        this.mazeAlgorithm = parseAlgorithm(environment);
        this.goalInCenter = parseBoolean(environment, "app.maze.goal-in-center", "MAZE_GOAL_IN_CENTER", true);
        this.cellSize = parseCellSize(environment);
        String store = resolveOptional(environment, "app.maze.store-path", "MAZE_STORE_PATH");
        this.storePath = Path.of(store != null ? store : DEFAULT_STORE_PATH);
        this.maxCells = parsePositiveInt(environment, "app.maze.max-cells", "MAZE_MAX_CELLS", DEFAULT_MAX_CELLS);
        if ((long) mazeWidth * mazeHeight > maxCells) {
            throw new IllegalStateException("Default maze " + mazeWidth + "x" + mazeHeight
                    + " exceeds MAZE_MAX_CELLS " + maxCells);
        }
    }

    public String getBindHost() {
        return bindHost;
    }

    public int getBindPort() {
        return bindPort;
    }

    public InetAddress getBindAddress() {
        try {
            return InetAddress.getByName(bindHost);
        } catch (UnknownHostException ex) {
            throw new IllegalStateException("Failed to resolve bind host: " + bindHost, ex);
        }
    }

    public int getMazeWidth() {
        return mazeWidth;
    }

    public int getMazeHeight() {
        return mazeHeight;
    }

    public MazeAlgorithm getMazeAlgorithm() {
        return mazeAlgorithm;
    }

    public boolean isGoalInCenter() {
        return goalInCenter;
    }

    public double getCellSize() {
        return cellSize;
    }

    public Path getStorePath() {
        return storePath;
    }

    public int getMaxCells() {
        return maxCells;
    }

    public MazeGeometry geometry() {
        return new MazeGeometry(cellSize);
    }

    public GenerationConfig defaultConfig() {
        return GenerationConfig.builder()
                .width(mazeWidth)
                .height(mazeHeight)
                .algorithm(mazeAlgorithm)
                .goalInCenter(goalInCenter)
                .build();
    }

    private String resolveOptional(Environment environment, String propertyKey, String envKey) {
        String value = environment.getProperty(propertyKey);
        if (StringUtils.hasText(value)) {
            return value.trim();
        }
        value = environment.getProperty(envKey);
        return StringUtils.hasText(value) ? value.trim() : null;
    }

    private int parsePositiveInt(Environment environment, String propertyKey, String envKey, int fallback) {
        String value = resolveOptional(environment, propertyKey, envKey);
        if (value == null) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(value);
            if (parsed <= 0) {
                throw new IllegalArgumentException();
            }
            return parsed;
        } catch (Exception ex) {
            throw new IllegalStateException(envKey + " must be a positive integer: " + value, ex);
        }
    }

    private MazeAlgorithm parseAlgorithm(Environment environment) {
        String value = resolveOptional(environment, "app.maze.algorithm", "MAZE_ALGORITHM");
        if (value == null) {
            return MazeAlgorithm.PRIM;
        }
        try {
            return MazeAlgorithm.parse(value);
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("Invalid MAZE_ALGORITHM value: " + value, ex);
        }
    }

    private boolean parseBoolean(Environment environment, String propertyKey, String envKey, boolean fallback) {
        String value = resolveOptional(environment, propertyKey, envKey);
        if (value == null) {
            return fallback;
        }
        if ("true".equalsIgnoreCase(value) || "1".equals(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value) || "0".equals(value)) {
            return false;
        }
        throw new IllegalStateException(envKey + " must be true or false: " + value);
    }

    private double parseCellSize(Environment environment) {
        String value = resolveOptional(environment, "app.maze.cell-size", "MAZE_CELL_SIZE");
        if (value == null) {
            return MazeGeometry.DEFAULT_CELL_SIZE;
        }
        try {
            return new MazeGeometry(Double.parseDouble(value)).cellSize();
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("MAZE_CELL_SIZE must be a positive number: " + value, ex);
        }
    }

    private BindAddress determineBindAddress(Environment environment) {
        String bindRaw = resolveOptional(environment, "app.bind-address", "APP_BIND_ADDR");
        String defaultHost = "0.0.0.0";
        int defaultPort = 3000;

        if (StringUtils.hasText(bindRaw)) {
            String[] parts = bindRaw.split(":", 2);
            if (parts.length != 2 || !StringUtils.hasText(parts[0]) || !StringUtils.hasText(parts[1])) {
                throw new IllegalStateException("APP_BIND_ADDR must follow host:port format");
            }
            int port = parsePort(parts[1]);
            return new BindAddress(parts[0].trim(), port);
        }

        String portValue = resolveOptional(environment, "server.port", "PORT");
        if (StringUtils.hasText(portValue)) {
            int port = parsePort(portValue);
            return new BindAddress(defaultHost, port);
        }

        return new BindAddress(defaultHost, defaultPort);
    }

    private int parsePort(String value) {
        try {
            int port = Integer.parseInt(value.trim());
            if (port <= 0 || port > 65535) {
                throw new IllegalArgumentException();
            }
            return port;
        } catch (Exception ex) {
            throw new IllegalStateException("Invalid port value: " + value, ex);
        }
    }

    private record BindAddress(String host, int port) {}
}
