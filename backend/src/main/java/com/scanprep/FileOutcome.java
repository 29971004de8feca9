package com.scanprep;

import java.nio.file.Path;

/**
 * What happened to one input file. {@link #getLastStage()} is the last stage the file
 * completed; for a failure it shows where processing stopped.
 */
public final class FileOutcome {

    public enum Status {
        SUCCESS,
        SKIPPED,
        FAILED
    }

    private final Path source;
    private final Path output;
    private final Status status;
    private final FileStage lastStage;
    private final Classification classification;
    private final Double score;
    private final boolean scoreFromCache;
    private final Double deskewAngle;
    private final String message;

    private FileOutcome(Path source, Path output, Status status, FileStage lastStage,
                        Classification classification, Double score, boolean scoreFromCache,
                        Double deskewAngle, String message) {
        this.source = source;
        this.output = output;
        this.status = status;
        this.lastStage = lastStage;
        this.classification = classification;
        this.score = score;
        this.scoreFromCache = scoreFromCache;
        this.deskewAngle = deskewAngle;
        this.message = message;
    }

    static FileOutcome processed(Path source, Path output, Classification classification, Double score,
                                 boolean scoreFromCache, double deskewAngle) {
        return new FileOutcome(source, output, Status.SUCCESS, FileStage.WRITTEN, classification,
                score, scoreFromCache, deskewAngle, null);
    }

    static FileOutcome passthrough(Path source, Path output) {
        return new FileOutcome(source, output, Status.SUCCESS, FileStage.WRITTEN, null,
                null, false, null, "passthrough");
    }

    static FileOutcome skipped(Path source, FileStage lastStage, String reason) {
        return new FileOutcome(source, null, Status.SKIPPED, lastStage, null, null, false, null, reason);
    }

    static FileOutcome cancelled(Path source) {
        return skipped(source, null, "cancelled");
    }

    static FileOutcome failed(Path source, FileStage lastStage, Classification classification, Double score,
                              String reason) {
        return new FileOutcome(source, null, Status.FAILED, lastStage, classification, score, false, null, reason);
    }

    public Path getSource() { return source; }
    public Path getOutput() { return output; }
    public Status getStatus() { return status; }
    public FileStage getLastStage() { return lastStage; }
    public Classification getClassification() { return classification; }
    public Double getScore() { return score; }
    public boolean isScoreFromCache() { return scoreFromCache; }
    public Double getDeskewAngle() { return deskewAngle; }
    public String getMessage() { return message; }

    public boolean isPassthrough() {
        return status == Status.SUCCESS && classification == null;
    }

    @Override
    public String toString() {
        return source.getFileName() + " " + status
                + (classification != null ? " " + classification : "")
                + (message != null ? " (" + message + ")" : "");
    }
}
