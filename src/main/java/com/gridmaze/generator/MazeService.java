package com.gridmaze.generator;

import com.gridmaze.config.AppProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class MazeService {

    private static final Logger log = LoggerFactory.getLogger(MazeService.class);

    private final Path storePath;
    private final MazeGeometry geometry;
    private final int maxCells;
    private final MazeSnapshotCodec codec;
    private final AtomicReference<MazeResult> current = new AtomicReference<>();
    private final Object storeLock = new Object();

    public MazeService(AppProperties properties) {
        Objects.requireNonNull(properties, "properties");
        this.storePath = properties.getStorePath();
        this.geometry = properties.geometry();
        this.maxCells = properties.getMaxCells();
        this.codec = new MazeSnapshotCodec(maxCells);
    }

    public MazeResult regenerate(GenerationConfig config) {
        Objects.requireNonNull(config, "config");
        return generateAndStore(config, MazeGenerator.seededRandom(config.seed()));
    }

    // the caller's Random made the maze, so the recorded seed is 0
    public MazeResult regenerate(GenerationConfig config, Random random) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(random, "random");
        return generateAndStore(config.toBuilder().seed(GenerationConfig.RANDOM_SEED).build(), random);
    }

    private MazeResult generateAndStore(GenerationConfig config, Random random) {
        InvalidDimensionException.checkLimit(config.width(), config.height(), maxCells);
        long start = System.nanoTime();
        MazeResult result = MazeGenerator.generate(config, random);
        current.set(result);
        Duration spent = Duration.ofNanos(System.nanoTime() - start);
        String timeLabel = String.format(Locale.US, "%.1f ms", spent.toNanos() / 1_000_000.0);
        log.info(
                "Generated maze {} (passages={}, start={}, goal={}, spent={})",
                config,
                result.openPassageCount(),
                result.start(),
                result.goal(),
                timeLabel);
        return result;
    }

    public Optional<MazeResult> current() {
        return Optional.ofNullable(current.get());
    }

    public MazeGeometry geometry() {
        return geometry;
    }

    public Path storePath() {
        return storePath;
    }

    public int maxCells() {
        return maxCells;
    }

    public String currentSnapshotJson() {
        return codec.serializeToString(MazeSnapshot.of(requireCurrent()));
    }

    public MazeResult reload(String json) {
        Objects.requireNonNull(json, "json");
        return replaceWith(codec.deserialize(json), "payload");
    }

    public Path persistLast() {
        return persist(requireCurrent());
    }

    public Path persist(MazeResult result) {
        Objects.requireNonNull(result, "result");
        byte[] bytes = codec.serialize(MazeSnapshot.of(result));
        Path target = storePath.toAbsolutePath();
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        synchronized (storeLock) {
            try {
                Files.createDirectories(target.getParent());
                Files.write(temp, bytes);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException ex) {
                throw new IllegalStateException("Failed to persist maze to " + storePath, ex);
            }
        }
        log.info("Saved maze {} to {} ({} bytes)", result.config(), storePath, bytes.length);
        return storePath;
    }

    public MazeResult loadLast() {
        byte[] bytes;
        synchronized (storeLock) {
            if (!Files.exists(storePath)) {
                throw new NoSavedMazeException(storePath);
            }
            try {
                bytes = Files.readAllBytes(storePath);
            } catch (IOException ex) {
                throw new IllegalStateException("Failed to read maze from " + storePath, ex);
            }
        }
        return replaceWith(codec.deserialize(bytes), storePath.toString());
    }

    private MazeResult replaceWith(MazeSnapshot snapshot, String source) {
        MazeResult result = snapshot.toResult();
        current.set(result);
        log.info("Loaded maze {} from {} (passages={})", result.config(), source, result.openPassageCount());
        return result;
    }

    private MazeResult requireCurrent() {
        MazeResult result = current.get();
        if (result == null) {
            throw new NoMazeException();
        }
        return result;
    }

    public static class NoMazeException extends IllegalStateException {
        public NoMazeException() {
            super("No maze generated yet");
        }
    }

    public static class NoSavedMazeException extends IllegalStateException {
        public NoSavedMazeException(Path storePath) {
            super("No saved maze at " + storePath);
        }
    }
}
