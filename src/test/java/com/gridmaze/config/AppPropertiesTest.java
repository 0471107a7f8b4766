package com.gridmaze.config;

import static org.junit.jupiter.api.Assertions.*;

import com.gridmaze.generator.GenerationConfig;
import com.gridmaze.generator.MazeAlgorithm;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class AppPropertiesTest {

    @Test
    void defaultsWhenNothingConfigured() {
        AppProperties properties = new AppProperties(new MockEnvironment());
        assertEquals("0.0.0.0", properties.getBindHost());
        assertEquals(3000, properties.getBindPort());
        assertEquals(Path.of("maze/last.json"), properties.getStorePath());
        assertEquals(1.0, properties.getCellSize());
        assertEquals(1_000_000, properties.getMaxCells());

        GenerationConfig config = properties.defaultConfig();
        assertEquals(16, config.width());
        assertEquals(16, config.height());
        assertEquals(0L, config.seed());
        assertEquals(MazeAlgorithm.PRIM, config.algorithm());
        assertTrue(config.goalInCenter());
    }

    @Test
    void propertiesWinOverEnvironmentKeys() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("app.maze.width", "21")
                .withProperty("MAZE_WIDTH", "9")
                .withProperty("MAZE_HEIGHT", "11")
                .withProperty("MAZE_ALGORITHM", "kruskal")
                .withProperty("app.maze.goal-in-center", "false")
                .withProperty("APP_BIND_ADDR", "127.0.0.1:8081");
        AppProperties properties = new AppProperties(environment);
        assertEquals(21, properties.getMazeWidth());
        assertEquals(11, properties.getMazeHeight());
        assertEquals(MazeAlgorithm.KRUSKAL, properties.getMazeAlgorithm());
        assertFalse(properties.isGoalInCenter());
        assertEquals("127.0.0.1", properties.getBindHost());
        assertEquals(8081, properties.getBindPort());
    }

    @Test
    void maxCellsIsConfigurableAndBoundsDefaults() {
        AppProperties properties = new AppProperties(new MockEnvironment().withProperty("MAZE_MAX_CELLS", "400"));
        assertEquals(400, properties.getMaxCells());
        assertThrows(IllegalStateException.class, () -> new AppProperties(new MockEnvironment()
                .withProperty("app.maze.max-cells", "100")
                .withProperty("app.maze.width", "20")));
        assertThrows(IllegalStateException.class,
                () -> new AppProperties(new MockEnvironment().withProperty("app.maze.max-cells", "-5")));
    }

    @Test
    void portFallsBackToServerPort() {
        AppProperties properties = new AppProperties(new MockEnvironment().withProperty("PORT", "9090"));
        assertEquals(9090, properties.getBindPort());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalStateException.class,
                () -> new AppProperties(new MockEnvironment().withProperty("app.maze.width", "0")));
        assertThrows(IllegalStateException.class,
                () -> new AppProperties(new MockEnvironment().withProperty("app.maze.algorithm", "dfs")));
        assertThrows(IllegalStateException.class,
                () -> new AppProperties(new MockEnvironment().withProperty("app.maze.cell-size", "-1")));
        assertThrows(IllegalStateException.class,
                () -> new AppProperties(new MockEnvironment().withProperty("app.maze.goal-in-center", "maybe")));
        assertThrows(IllegalStateException.class,
                () -> new AppProperties(new MockEnvironment().withProperty("APP_BIND_ADDR", "localhost")));
    }
}
