package com.scanprep;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-run report: every file's outcome plus the counts operators look at first.
 */
public final class RunSummary {

    private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    private final List<FileOutcome> outcomes;
    private final boolean cancelled;
    private final int cacheWriteFailures;
    private final Duration elapsed;

    RunSummary(List<FileOutcome> outcomes, boolean cancelled, int cacheWriteFailures, Duration elapsed) {
        this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
        this.cancelled = cancelled;
        this.cacheWriteFailures = cacheWriteFailures;
        this.elapsed = elapsed;
    }

    public List<FileOutcome> getOutcomes() { return outcomes; }
    public boolean isCancelled() { return cancelled; }
    public int getCacheWriteFailures() { return cacheWriteFailures; }
    public Duration getElapsed() { return elapsed; }

    public int getTotal() {
        return outcomes.size();
    }

    public int getSucceeded() {
        return count(FileOutcome.Status.SUCCESS);
    }

    public int getSkipped() {
        return count(FileOutcome.Status.SKIPPED);
    }

    public int getFailed() {
        return count(FileOutcome.Status.FAILED);
    }

    public int getGood() {
        return countProcessed(Classification.GOOD);
    }

    public int getBad() {
        return countProcessed(Classification.BAD);
    }

    public int getPassthrough() {
        return (int) outcomes.stream().filter(FileOutcome::isPassthrough).count();
    }

    public boolean hasFailures() {
        return getFailed() > 0;
    }

    private int count(FileOutcome.Status status) {
        return (int) outcomes.stream().filter(o -> o.getStatus() == status).count();
    }

    private int countProcessed(Classification c) {
        return (int) outcomes.stream()
                .filter(o -> o.getStatus() == FileOutcome.Status.SUCCESS && o.getClassification() == c)
                .count();
    }

    public String describe() {
        return String.format("%d files: %d succeeded (%d GOOD, %d BAD, %d passthrough), %d skipped, %d failed in %.1fs%s",
                getTotal(), getSucceeded(), getGood(), getBad(), getPassthrough(), getSkipped(), getFailed(),
                elapsed.toMillis() / 1000.0, cancelled ? " [cancelled]" : "");
    }

    /**
     * Pretty-printed JSON report of the counts and every file's outcome.
     */
    public String toJson() {
        return gson.toJson(toMap());
    }

    public Map<String, Object> toMap() {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("total", getTotal());
        output.put("succeeded", getSucceeded());
        output.put("skipped", getSkipped());
        output.put("failed", getFailed());
        output.put("good", getGood());
        output.put("bad", getBad());
        output.put("passthrough", getPassthrough());
        output.put("cancelled", cancelled);
        output.put("cacheWriteFailures", cacheWriteFailures);
        output.put("elapsedMillis", elapsed.toMillis());

        List<Map<String, Object>> files = new ArrayList<>();
        for (FileOutcome o : outcomes) {
            Map<String, Object> file = new LinkedHashMap<>();
            file.put("source", o.getSource().toString());
            file.put("status", o.getStatus().name());
            if (o.getLastStage() != null) file.put("lastStage", o.getLastStage().name());
            if (o.getOutput() != null) file.put("output", o.getOutput().toString());
            if (o.getClassification() != null) file.put("classification", o.getClassification().name());
            if (o.getScore() != null) {
                file.put("score", o.getScore());
                file.put("scoreFromCache", o.isScoreFromCache());
            }
            if (o.getDeskewAngle() != null) file.put("deskewAngle", o.getDeskewAngle());
            if (o.getMessage() != null) file.put("message", o.getMessage());
            files.add(file);
        }
        output.put("files", files);
        return output;
    }

    public void writeReport(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, toJson(), StandardCharsets.UTF_8);
    }
}
