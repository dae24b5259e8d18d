package net.uploadsizer.model.pipeline;

import java.nio.file.Path;
import net.uploadsizer.model.image.ProcessingResult;

/**
 * Terminal state of one processing intent.
 */
public record FileOutcome(Path path, FileState state, ProcessingResult result, String reason) {

    public FileOutcome {
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("Outcome state must be terminal: " + state);
        }
    }

    public static FileOutcome completed(Path path, ProcessingResult result) {
        return new FileOutcome(path, FileState.COMPLETED, result, null);
    }

    public static FileOutcome failed(Path path, String reason) {
        return new FileOutcome(path, FileState.FAILED, null, reason);
    }

    public static FileOutcome skipped(Path path, String reason) {
        return new FileOutcome(path, FileState.SKIPPED, null, reason);
    }
}
