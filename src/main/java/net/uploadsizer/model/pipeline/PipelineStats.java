package net.uploadsizer.model.pipeline;

import java.time.Instant;

/**
 * Point-in-time view of pipeline counters and queue state.
 */
public record PipelineStats(long detected,
                            long processed,
                            long skipped,
                            long errored,
                            int queueDepth,
                            int inFlightCount,
                            int pendingDebounce,
                            Instant startedAt) {
}
