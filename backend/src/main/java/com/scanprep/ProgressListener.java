package com.scanprep;

/**
 * Notified from worker threads as files finish; implementations must be thread-safe.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (outcome, completed, total) -> { };

    void onFileDone(FileOutcome outcome, int completed, int total);
}
