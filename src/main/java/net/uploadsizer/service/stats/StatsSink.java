package net.uploadsizer.service.stats;

import net.uploadsizer.model.pipeline.PipelineStats;

/**
 * Receives periodic pipeline counters. Telemetry only; nothing flows back into the pipeline.
 */
public interface StatsSink {

    void publish(PipelineStats stats);
}
