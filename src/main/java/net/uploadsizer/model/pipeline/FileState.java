package net.uploadsizer.model.pipeline;

/**
 * Lifecycle of one file through the pipeline.
 */
public enum FileState {
    DETECTED,
    DEBOUNCED,
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }
}
