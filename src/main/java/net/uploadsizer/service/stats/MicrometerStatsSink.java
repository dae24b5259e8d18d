package net.uploadsizer.service.stats;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.atomic.AtomicLong;
import net.uploadsizer.model.pipeline.PipelineStats;
import org.springframework.stereotype.Component;

/**
 * Exposes the last published stats as {@code upload.pipeline.*} gauges.
 */
@Component
public class MicrometerStatsSink implements StatsSink {

    private final AtomicLong detected = new AtomicLong();
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicLong errored = new AtomicLong();
    private final AtomicLong queueDepth = new AtomicLong();
    private final AtomicLong inFlight = new AtomicLong();

    public MicrometerStatsSink(MeterRegistry meterRegistry) {
        register(meterRegistry, "upload.pipeline.detected", detected, "Candidate file events accepted");
        register(meterRegistry, "upload.pipeline.processed", processed, "Files derived successfully");
        register(meterRegistry, "upload.pipeline.skipped", skipped, "Files skipped (vanished or no longer valid)");
        register(meterRegistry, "upload.pipeline.errored", errored, "Failed files plus failed sizes");
        register(meterRegistry, "upload.pipeline.queue.depth", queueDepth, "Intents waiting for a worker");
        register(meterRegistry, "upload.pipeline.in.flight", inFlight, "Files between debounce and completion");
    }

    @Override
    public void publish(PipelineStats stats) {
        detected.set(stats.detected());
        processed.set(stats.processed());
        skipped.set(stats.skipped());
        errored.set(stats.errored());
        queueDepth.set(stats.queueDepth());
        inFlight.set(stats.inFlightCount());
    }

    private static void register(MeterRegistry registry, String name, AtomicLong value, String description) {
        Gauge.builder(name, value, AtomicLong::get)
            .description(description)
            .register(registry);
    }
}
