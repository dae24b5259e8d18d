package net.uploadsizer.application.pipeline;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import net.uploadsizer.config.PipelineProperties;
import net.uploadsizer.exception.ImageDecodeException;
import net.uploadsizer.model.image.ProcessingResult;
import net.uploadsizer.model.image.SizeCatalog;
import net.uploadsizer.model.pipeline.FileOutcome;
import net.uploadsizer.model.pipeline.PipelineStats;
import net.uploadsizer.model.pipeline.ProcessingIntent;
import net.uploadsizer.model.pipeline.RecordId;
import net.uploadsizer.service.catalog.SizeCatalogService;
import net.uploadsizer.service.image.DerivationEngine;
import net.uploadsizer.service.image.ImageCodec;
import net.uploadsizer.service.metadata.MetadataSink;
import net.uploadsizer.service.stats.PipelineCounters;
import net.uploadsizer.support.concurrency.ConcurrencyLimiter;
import net.uploadsizer.support.watch.EventCoalescer;
import net.uploadsizer.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Drives each processing intent from the coalescer through the limiter and engine to the metadata sink.
 *
 * <p>Per file: {@code QUEUED} while waiting for a slot, {@code PROCESSING} once a worker picks it up, then
 * exactly one of {@code COMPLETED}, {@code FAILED} or {@code SKIPPED}. Whatever the outcome, the
 * in-flight membership is released and the counters are updated once.</p>
 *
 * <p>Failures of one file never escape {@link #handle(ProcessingIntent)}; they become its outcome.</p>
 */
@Service
public class PipelineCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(PipelineCoordinator.class);

    private final DerivationEngine engine;
    private final ImageCodec codec;
    private final ConcurrencyLimiter limiter;
    private final EventCoalescer coalescer;
    private final SizeCatalogService catalogService;
    private final MetadataSink metadataSink;
    private final PipelineCounters counters;
    private final Path root;
    private final Set<CompletableFuture<FileOutcome>> outstanding = ConcurrentHashMap.newKeySet();

    @Autowired
    public PipelineCoordinator(DerivationEngine engine,
                               ImageCodec codec,
                               ConcurrencyLimiter limiter,
                               EventCoalescer coalescer,
                               SizeCatalogService catalogService,
                               MetadataSink metadataSink,
                               PipelineCounters counters,
                               PipelineProperties properties) {
        this(engine, codec, limiter, coalescer, catalogService, metadataSink, counters, properties.rootPath());
    }

    PipelineCoordinator(DerivationEngine engine,
                        ImageCodec codec,
                        ConcurrencyLimiter limiter,
                        EventCoalescer coalescer,
                        SizeCatalogService catalogService,
                        MetadataSink metadataSink,
                        PipelineCounters counters,
                        Path root) {
        this.engine = engine;
        this.codec = codec;
        this.limiter = limiter;
        this.coalescer = coalescer;
        this.catalogService = catalogService;
        this.metadataSink = metadataSink;
        this.counters = counters;
        this.root = root.toAbsolutePath().normalize();
    }

    /**
     * Queues the intent for derivation.
     *
     * @return a future completing with the terminal outcome; it never completes exceptionally
     */
    public CompletableFuture<FileOutcome> handle(ProcessingIntent intent) {
        CompletableFuture<FileOutcome> outcome = new CompletableFuture<>();
        outstanding.add(outcome);
        logger.debug("Queued {} (token {})", intent.path(), intent.token());

        limiter.submit(() -> process(intent)).result().whenComplete((value, error) -> {
            FileOutcome resolved = error == null ? value : unfinished(intent, error);
            try {
                record(resolved);
            } finally {
                coalescer.release(intent);
                outstanding.remove(outcome);
                outcome.complete(resolved);
            }
        });
        return outcome;
    }

    public PipelineStats stats() {
        ConcurrencyLimiter.LimiterSnapshot snapshot = limiter.snapshot();
        return new PipelineStats(
            coalescer.detectedCount(),
            counters.processed(),
            counters.skipped(),
            counters.errored(),
            snapshot.pending(),
            coalescer.inFlightCount(),
            coalescer.pendingCount(),
            counters.startedAt()
        );
    }

    public int outstandingCount() {
        return outstanding.size();
    }

    /**
     * Waits up to {@code grace} for every queued or running intent to reach a terminal state.
     *
     * @return {@code true} when everything drained in time
     */
    public boolean awaitDrain(Duration grace) {
        CompletableFuture<?>[] pending = outstanding.toArray(new CompletableFuture<?>[0]);
        if (pending.length == 0) {
            return true;
        }
        logger.info("Waiting up to {} for {} outstanding file(s)", grace, pending.length);
        try {
            CompletableFuture.allOf(pending).get(grace.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            logger.warn("{} file(s) still outstanding after {}", outstanding.size(), grace);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            LoggingUtils.warn(logger, e.getCause(), "Outstanding file future failed during drain");
            return false;
        }
    }

    FileOutcome process(ProcessingIntent intent) {
        Path path = intent.path();
        try {
            Optional<String> invalid = recheck(path);
            if (invalid.isPresent()) {
                logger.debug("Skipping {}: {}", path, invalid.get());
                return FileOutcome.skipped(path, invalid.get());
            }
            SizeCatalog catalog = catalogService.current();
            ProcessingResult result = engine.derive(path, catalog);
            persist(path, result);
            return FileOutcome.completed(path, result);
        } catch (NoSuchFileException | AccessDeniedException e) {
            logger.debug("Skipping {}: {}", path, e.getClass().getSimpleName());
            return FileOutcome.skipped(path, e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (ImageDecodeException e) {
            logger.warn("Cannot decode {}: {}", path, e.getReason().getDescription());
            return FileOutcome.failed(path, e.getMessage());
        } catch (IOException | RuntimeException e) {
            LoggingUtils.error(logger, e, "Processing failed for {}", path);
            return FileOutcome.failed(path, LoggingUtils.describe(e));
        }
    }

    /**
     * Immediately-before-processing check that the file is still a complete, readable image.
     *
     * @return the reason the file is no longer valid, if any
     */
    private Optional<String> recheck(Path path) throws IOException {
        if (!Files.exists(path)) {
            return Optional.of("file no longer exists");
        }
        if (!Files.isRegularFile(path)) {
            return Optional.of("not a regular file");
        }
        if (Files.size(path) == 0) {
            return Optional.of("file is empty");
        }
        if (!codec.isRecognized(path)) {
            return Optional.of("content is not a recognized image");
        }
        return Optional.empty();
    }

    private void persist(Path path, ProcessingResult result) {
        String relativePath = relativePath(path);
        Optional<RecordId> recordId;
        try {
            recordId = metadataSink.resolveRecordId(relativePath);
        } catch (RuntimeException e) {
            LoggingUtils.error(logger, e, "Record lookup failed for {}; derived files kept", relativePath);
            return;
        }
        if (recordId.isEmpty()) {
            logger.warn("No media record for {}; derived files kept on disk without metadata", relativePath);
            return;
        }
        try {
            if (!metadataSink.store(recordId.get(), result)) {
                logger.error("Metadata sink rejected result for {} (record {}); derived files kept", relativePath, recordId.get());
            }
        } catch (RuntimeException e) {
            LoggingUtils.error(logger, e, "Metadata store failed for {} (record {}); derived files kept", relativePath, recordId.get());
        }
    }

    private String relativePath(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        Path relative = normalized.startsWith(root) ? root.relativize(normalized) : normalized.getFileName();
        return relative.toString().replace('\\', '/');
    }

    private void record(FileOutcome outcome) {
        switch (outcome.state()) {
            case COMPLETED -> counters.recordProcessed(outcome.result().variantFailures().size());
            case FAILED -> counters.recordFailed();
            case SKIPPED -> counters.recordSkipped();
            default -> throw new IllegalStateException("Non-terminal outcome " + outcome.state());
        }
    }

    private static FileOutcome unfinished(ProcessingIntent intent, Throwable error) {
        if (error instanceof CancellationException || error instanceof RejectedExecutionException) {
            logger.debug("{} was not processed: {}", intent.path(), LoggingUtils.describe(error));
            return FileOutcome.skipped(intent.path(), "not started: " + LoggingUtils.describe(error));
        }
        logger.error("Processing aborted for {}: {}", intent.path(), LoggingUtils.describe(error), error);
        return FileOutcome.failed(intent.path(), "aborted: " + LoggingUtils.describe(error));
    }
}
