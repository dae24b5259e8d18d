package net.uploadsizer.service.stats;

import java.time.Clock;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import net.uploadsizer.model.pipeline.PipelineStats;
import net.uploadsizer.util.UptimeFormatter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Writes a one-line INFO summary of the pipeline counters.
 */
@Slf4j
@Component
public class LoggingStatsSink implements StatsSink {

    private final boolean enabled;
    private final Clock clock;

    @Autowired
    public LoggingStatsSink(@Value("${pipeline.monitoring.enabled:true}") boolean enabled) {
        this(enabled, Clock.systemUTC());
    }

    LoggingStatsSink(boolean enabled, Clock clock) {
        this.enabled = enabled;
        this.clock = clock;
    }

    @Override
    public void publish(PipelineStats stats) {
        if (!enabled) {
            return;
        }
        log.info(summarize(stats));
    }

    String summarize(PipelineStats stats) {
        String uptime = UptimeFormatter.format(Duration.between(stats.startedAt(), clock.instant()));
        return "Pipeline stats: uptime=%s detected=%d processed=%d skipped=%d errored=%d queued=%d inFlight=%d debouncing=%d"
            .formatted(uptime, stats.detected(), stats.processed(), stats.skipped(), stats.errored(),
                stats.queueDepth(), stats.inFlightCount(), stats.pendingDebounce());
    }
}
