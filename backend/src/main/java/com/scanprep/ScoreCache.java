package com.scanprep;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Persistent map from image path to quality score, stored as one JSON object file.
 * <p>
 * Every {@link #put} is written through (temp file, then atomic rename) so an interrupted
 * run leaves a usable cache behind. A missing or unreadable file starts the cache empty;
 * write failures are logged and counted but never stop the run. Entries are not tied to
 * the model that produced them: delete the file (or reset the cache) after changing models.
 * All methods are synchronized; the cache is shared by the run's workers.
 */
public class ScoreCache implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScoreCache.class);

    private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    private final Path file;
    private final Map<String, Double> scores;
    private boolean dirty;
    private int writeFailures;

    private ScoreCache(Path file, Map<String, Double> scores) {
        this.file = file;
        this.scores = scores;
    }

    /**
     * Opens the cache backed by {@code file}, loading existing entries if it can.
     */
    public static ScoreCache open(Path file) {
        Map<String, Double> loaded = new TreeMap<>();
        if (Files.exists(file)) {
            try {
                loaded.putAll(load(file));
                log.info("Loaded {} cached scores from {}", loaded.size(), file);
            } catch (CacheIOException e) {
                log.warn("Score cache {} is unreadable, starting empty: {}", file, e.getMessage());
            }
        }
        return new ScoreCache(file, loaded);
    }

    static Map<String, Double> load(Path file) throws CacheIOException {
        JsonElement root;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            root = JsonParser.parseReader(reader);
        } catch (IOException | JsonParseException e) {
            throw new CacheIOException("Cannot read score cache " + file, e);
        }

        Map<String, Double> out = new TreeMap<>();
        if (root.isJsonNull()) {
            return out;
        }
        if (!root.isJsonObject()) {
            throw new CacheIOException("Score cache " + file + " is not a JSON object", null);
        }
        int ignored = 0;
        for (Map.Entry<String, JsonElement> e : root.getAsJsonObject().entrySet()) {
            JsonElement v = e.getValue();
            if (v.isJsonPrimitive() && v.getAsJsonPrimitive().isNumber() && Double.isFinite(v.getAsDouble())) {
                out.put(e.getKey(), v.getAsDouble());
            } else {
                ignored++;
            }
        }
        if (ignored > 0) {
            log.warn("Ignored {} non-numeric entries in {}", ignored, file);
        }
        return out;
    }

    public synchronized OptionalDouble get(String path) {
        Double score = scores.get(path);
        return score == null ? OptionalDouble.empty() : OptionalDouble.of(score);
    }

    public synchronized void put(String path, double score) {
        if (!Double.isFinite(score)) {
            throw new IllegalArgumentException("Refusing to cache non-finite score " + score + " for " + path);
        }
        scores.put(path, score);
        persist();
    }

    public synchronized int size() {
        return scores.size();
    }

    /**
     * Drops every entry and deletes the backing file.
     */
    public synchronized void clear() {
        scores.clear();
        dirty = false;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            writeFailures++;
            log.warn("Could not delete score cache {}: {}", file, e.getMessage());
        }
    }

    public synchronized int getWriteFailures() {
        return writeFailures;
    }

    public Path getFile() {
        return file;
    }

    @Override
    public synchronized void close() {
        if (dirty) {
            persist();
        }
    }

    private void persist() {
        try {
            write();
            dirty = false;
        } catch (CacheIOException e) {
            dirty = true;
            writeFailures++;
            log.warn("{} (cause: {})", e.getMessage(), String.valueOf(e.getCause()));
        }
    }

    private void write() throws CacheIOException {
        JsonObject root = new JsonObject();
        for (Map.Entry<String, Double> e : scores.entrySet()) {
            root.add(e.getKey(), new JsonPrimitive(e.getValue()));
        }
        Path dir = file.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                gson.toJson(root, writer);
            }
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException suppressed) {
                    e.addSuppressed(suppressed);
                }
            }
            throw new CacheIOException("Could not write score cache " + file, e);
        }
    }
}
