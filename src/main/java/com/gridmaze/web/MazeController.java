package com.gridmaze.web;

import com.gridmaze.config.AppProperties;
import com.gridmaze.generator.Cell;
import com.gridmaze.generator.GenerationConfig;
import com.gridmaze.generator.MazeAlgorithm;
import com.gridmaze.generator.MazeGeometry;
import com.gridmaze.generator.MazeResult;
import com.gridmaze.generator.MazeService;
import com.gridmaze.generator.WorldPosition;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/maze")
public class MazeController {

    private static final Logger log = LoggerFactory.getLogger(MazeController.class);

    private final MazeService mazeService;
    private final AppProperties properties;

    public MazeController(MazeService mazeService, AppProperties properties) {
        this.mazeService = mazeService;
        this.properties = properties;
    }

    @PostMapping(path = "/generate", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public MazeResponse generate(@RequestBody GenerateRequest request) {
        GenerationConfig config = buildConfig(request);

        MazeResult result;
        try {
            result = mazeService.regenerate(config);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }

        Path savedPath = null;
        if (request.save() == null || request.save()) {
            try {
                savedPath = mazeService.persist(result);
            } catch (IllegalStateException ex) {
                throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), ex);
            }
        }

        log.info("Generated {} maze {}x{} (seed {}, goal {})",
                config.algorithm(),
                result.width(),
                result.height(),
                config.seed(),
                result.goal());
        return toResponse(result, savedPath);
    }

    @GetMapping(path = "/current", produces = MediaType.APPLICATION_JSON_VALUE)
    public String current() {
        try {
            return mazeService.currentSnapshotJson();
        } catch (MazeService.NoMazeException ex) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, ex.getMessage(), ex);
        }
    }

    @PostMapping(path = "/load", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public MazeResponse load(@RequestBody String payload) {
        MazeResult result;
        try {
            result = mazeService.reload(payload);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid maze: " + ex.getMessage(), ex);
        }
        log.info("Reloaded {} maze {}x{}", result.config().algorithm(), result.width(), result.height());
        return toResponse(result, null);
    }

    @PostMapping(path = "/restore", produces = MediaType.APPLICATION_JSON_VALUE)
    public MazeResponse restore() {
        MazeResult result;
        try {
            result = mazeService.loadLast();
        } catch (MazeService.NoSavedMazeException ex) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, ex.getMessage(), ex);
        } catch (IllegalStateException ex) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), ex);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid saved maze: " + ex.getMessage(), ex);
        }
        return toResponse(result, mazeService.storePath());
    }

    @GetMapping(path = "/cell", produces = MediaType.APPLICATION_JSON_VALUE)
    public CellResponse cell(@RequestParam("x") double x, @RequestParam("y") double y) {
        MazeResult result = mazeService.current()
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No maze generated yet"));
        Cell cell;
        try {
            cell = mazeService.geometry().cellContaining(new WorldPosition(x, y));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
        boolean inside = result.contains(cell);
        return new CellResponse(x, y, cell, inside, inside ? result.wallsOf(cell) : null);
    }

    private GenerationConfig buildConfig(GenerateRequest request) {
        GenerationConfig.Builder builder = properties.defaultConfig().toBuilder();
        if (request.width() != null) {
            builder.width(request.width());
        }
        if (request.height() != null) {
            builder.height(request.height());
        }
        if (request.seed() != null) {
            builder.seed(request.seed());
        }
        if (StringUtils.hasText(request.algorithm())) {
            builder.algorithm(parseAlgorithm(request.algorithm()));
        }
        if (request.goalInCenter() != null) {
            builder.goalInCenter(request.goalInCenter());
        }
        return builder.build();
    }

    private MazeAlgorithm parseAlgorithm(String algorithm) {
        try {
            return MazeAlgorithm.parse(algorithm);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }

    private MazeResponse toResponse(MazeResult result, Path savedPath) {
        MazeGeometry geometry = mazeService.geometry();
        GenerationConfig config = result.config();
        return new MazeResponse(
                result.width(),
                result.height(),
                config.seed(),
                config.algorithm().name(),
                config.goalInCenter(),
                result.start(),
                result.goal(),
                result.startWorldPosition(geometry),
                result.goalWorldPosition(geometry),
                result.openPassageCount(),
                result.isPerfectMaze(),
                savedPath == null ? null : savedPath.toString());
    }
}
