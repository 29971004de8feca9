package com.scanprep;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class ScoreCacheTest {

    @TempDir
    Path dir;

    @Test
    void freshCacheHasNoEntries() {
        try (ScoreCache cache = ScoreCache.open(dir.resolve("image_scores.json"))) {
            assertEquals(OptionalDouble.empty(), cache.get("/scans/a.png"));
            assertEquals(0, cache.size());
        }
    }

    @Test
    void roundTripIsExact() {
        try (ScoreCache cache = ScoreCache.open(dir.resolve("image_scores.json"))) {
            cache.put("/scans/a.png", 0.33512345678901234);
            assertEquals(0.33512345678901234, cache.get("/scans/a.png").getAsDouble());
        }
    }

    @Test
    void survivesReopen() {
        Path file = dir.resolve("image_scores.json");
        try (ScoreCache cache = ScoreCache.open(file)) {
            cache.put("/scans/a.png", 0.1);
            cache.put("/scans/b.png", -3.25e-7);
        }
        try (ScoreCache cache = ScoreCache.open(file)) {
            assertEquals(2, cache.size());
            assertEquals(0.1, cache.get("/scans/a.png").getAsDouble());
            assertEquals(-3.25e-7, cache.get("/scans/b.png").getAsDouble());
        }
    }

    @Test
    void writesThroughOnEveryPut() {
        Path file = dir.resolve("image_scores.json");
        ScoreCache cache = ScoreCache.open(file);
        cache.put("/scans/a.png", 0.7);
        // not closed: the entry must already be on disk
        try (ScoreCache other = ScoreCache.open(file)) {
            assertEquals(0.7, other.get("/scans/a.png").getAsDouble());
        }
        cache.close();
    }

    @Test
    void corruptFileDegradesToEmpty() throws IOException {
        Path file = dir.resolve("image_scores.json");
        Files.writeString(file, "{ not json", StandardCharsets.UTF_8);
        try (ScoreCache cache = ScoreCache.open(file)) {
            assertEquals(0, cache.size());
            cache.put("/scans/a.png", 0.5);
        }
        try (ScoreCache cache = ScoreCache.open(file)) {
            assertEquals(0.5, cache.get("/scans/a.png").getAsDouble());
        }
    }

    @Test
    void nonNumericEntriesIgnored() throws IOException {
        Path file = dir.resolve("image_scores.json");
        Files.writeString(file, "{\"/scans/a.png\": \"NA\", \"/scans/b.png\": 0.4}", StandardCharsets.UTF_8);
        try (ScoreCache cache = ScoreCache.open(file)) {
            assertEquals(1, cache.size());
            assertFalse(cache.get("/scans/a.png").isPresent());
            assertEquals(0.4, cache.get("/scans/b.png").getAsDouble());
        }
    }

    @Test
    void deletedFileIsTolerated() throws IOException {
        Path file = dir.resolve("image_scores.json");
        try (ScoreCache cache = ScoreCache.open(file)) {
            cache.put("/scans/a.png", 0.2);
            Files.delete(file);
            cache.put("/scans/b.png", 0.3);
            assertEquals(0, cache.getWriteFailures());
        }
        try (ScoreCache cache = ScoreCache.open(file)) {
            assertEquals(2, cache.size());
        }
    }

    @Test
    void failedWritesAreCountedNotThrown() {
        try (ScoreCache cache = ScoreCache.open(dir.resolve("missing").resolve("image_scores.json"))) {
            cache.put("/scans/a.png", 0.2);
            assertEquals(1, cache.getWriteFailures());
            assertEquals(0.2, cache.get("/scans/a.png").getAsDouble());
        }
    }

    @Test
    void clearRemovesFile() {
        Path file = dir.resolve("image_scores.json");
        try (ScoreCache cache = ScoreCache.open(file)) {
            cache.put("/scans/a.png", 0.2);
            cache.clear();
            assertEquals(0, cache.size());
        }
        assertFalse(Files.exists(file));
    }

    @Test
    void nonFiniteScoreRefused() {
        try (ScoreCache cache = ScoreCache.open(dir.resolve("image_scores.json"))) {
            assertThrows(IllegalArgumentException.class, () -> cache.put("/scans/a.png", Double.NaN));
        }
    }
}
