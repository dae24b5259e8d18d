package net.uploadsizer.model.pipeline;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A debounced, deduplicated request to process one file.
 *
 * @param path absolute path of the source
 * @param stat stat from the last event before the debounce window closed
 * @param token in-flight membership token; releasing with a stale token is a no-op
 * @param detectedAt when the intent was emitted
 */
public record ProcessingIntent(Path path, FileStat stat, long token, Instant detectedAt) {
}
