package net.uploadsizer.service.stats;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/**
 * Outcome counters kept by the coordinator.
 */
@Component
public class PipelineCounters {

    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicLong errored = new AtomicLong();
    private final Instant startedAt = Instant.now();

    public void recordProcessed(int failedVariants) {
        processed.incrementAndGet();
        if (failedVariants > 0) {
            errored.addAndGet(failedVariants);
        }
    }

    public void recordSkipped() {
        skipped.incrementAndGet();
    }

    public void recordFailed() {
        errored.incrementAndGet();
    }

    public long processed() {
        return processed.get();
    }

    public long skipped() {
        return skipped.get();
    }

    public long errored() {
        return errored.get();
    }

    public Instant startedAt() {
        return startedAt;
    }
}
