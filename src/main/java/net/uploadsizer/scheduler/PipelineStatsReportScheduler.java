package net.uploadsizer.scheduler;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import net.uploadsizer.application.pipeline.PipelineCoordinator;
import net.uploadsizer.model.pipeline.PipelineStats;
import net.uploadsizer.service.stats.StatsSink;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Publishes a {@link PipelineStats} snapshot to every {@link StatsSink} on
 * {@code pipeline.monitoring.report-interval}, and once more on shutdown.
 */
@Slf4j
@Component
public class PipelineStatsReportScheduler {

    private final PipelineCoordinator coordinator;
    private final List<StatsSink> sinks;

    public PipelineStatsReportScheduler(PipelineCoordinator coordinator, List<StatsSink> sinks) {
        this.coordinator = coordinator;
        this.sinks = List.copyOf(sinks);
    }

    @Scheduled(fixedDelayString = "${pipeline.monitoring.report-interval:PT30M}",
               initialDelayString = "${pipeline.monitoring.report-interval:PT30M}")
    public void report() {
        publish(coordinator.stats());
    }

    public void publish(PipelineStats stats) {
        for (StatsSink sink : sinks) {
            try {
                sink.publish(stats);
            } catch (RuntimeException e) {
                log.warn("Stats sink {} failed: {}", sink.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
