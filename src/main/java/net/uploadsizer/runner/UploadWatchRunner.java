package net.uploadsizer.runner;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import net.uploadsizer.application.pipeline.PipelineCoordinator;
import net.uploadsizer.config.PipelineProperties;
import net.uploadsizer.model.image.SizeCatalog;
import net.uploadsizer.scheduler.PipelineStatsReportScheduler;
import net.uploadsizer.service.catalog.SizeCatalogService;
import net.uploadsizer.support.concurrency.ConcurrencyLimiter;
import net.uploadsizer.support.watch.EventCoalescer;
import net.uploadsizer.support.watch.UploadDirectoryWatcher;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Starts the pipeline once the context is ready and stops it in order on shutdown.
 *
 * <p>Startup: load the size catalog, connect the coalescer to the coordinator, start watching.
 * Shutdown: stop watching, drop pending debounce timers, wait for outstanding files up to
 * {@code pipeline.shutdown-grace}, stop the workers, publish final stats.</p>
 */
@Slf4j
@Component
public class UploadWatchRunner implements ApplicationRunner {

    private final SizeCatalogService catalogService;
    private final EventCoalescer coalescer;
    private final UploadDirectoryWatcher watcher;
    private final PipelineCoordinator coordinator;
    private final ConcurrencyLimiter limiter;
    private final PipelineStatsReportScheduler statsReporter;
    private final Duration shutdownGrace;

    private volatile boolean started;

    public UploadWatchRunner(SizeCatalogService catalogService,
                             EventCoalescer coalescer,
                             UploadDirectoryWatcher watcher,
                             PipelineCoordinator coordinator,
                             ConcurrencyLimiter limiter,
                             PipelineStatsReportScheduler statsReporter,
                             PipelineProperties properties) {
        this.catalogService = catalogService;
        this.coalescer = coalescer;
        this.watcher = watcher;
        this.coordinator = coordinator;
        this.limiter = limiter;
        this.statsReporter = statsReporter;
        this.shutdownGrace = properties.getShutdownGrace();
    }

    @Override
    public void run(ApplicationArguments args) {
        SizeCatalog catalog = catalogService.refresh();
        coalescer.start(coordinator::handle);
        watcher.start();
        started = true;
        log.info("Upload pipeline started: root={}, sizes={}, workers={}",
            watcher.getRoot(), catalog.sizes().keySet(), limiter.capacity());
    }

    @PreDestroy
    void shutdown() {
        if (!started) {
            return;
        }
        started = false;
        log.info("Shutting down upload pipeline");
        watcher.stop();
        coalescer.close();
        coordinator.awaitDrain(shutdownGrace);
        limiter.shutdown(shutdownGrace);
        statsReporter.publish(coordinator.stats());
    }
}
