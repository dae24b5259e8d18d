package net.uploadsizer.support.watch;

import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import net.uploadsizer.model.pipeline.FileEvent;
import net.uploadsizer.model.pipeline.FileEventKind;
import net.uploadsizer.model.pipeline.FileStat;
import net.uploadsizer.model.pipeline.ProcessingIntent;
import net.uploadsizer.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns raw filesystem events into at most one {@link ProcessingIntent} per stable file state.
 *
 * <p>All state (the debounce table and the in-flight set) is owned by one {@code event-coalescer} thread.
 * Events, timer firings, deletes and releases are submitted to that thread as commands, so none of the
 * state is ever touched concurrently.</p>
 *
 * <p>In-flight memberships carry a token. {@link #release(ProcessingIntent)} only removes the membership
 * whose token matches, so a release arriving after a delete and a fresh detection cannot evict the newer
 * membership.</p>
 */
public class EventCoalescer implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(EventCoalescer.class);

    private final ScheduledExecutorService actor;
    private final CandidateFileFilter filter;
    private final long debounceMillis;

    // Owned by the actor thread.
    private final Map<Path, PendingTimer> debounceTable = new HashMap<>();
    private final Map<Path, Long> inFlight = new HashMap<>();
    private long tokenSequence;
    private long timerGeneration;
    private Consumer<ProcessingIntent> listener;

    private final AtomicLong detected = new AtomicLong();
    private volatile int pendingCount;
    private volatile int inFlightCount;
    private volatile boolean closed;

    public EventCoalescer(CoalescerSettings settings, CandidateFileFilter filter) {
        this.filter = filter;
        this.debounceMillis = settings.debounce().toMillis();
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "event-coalescer");
            thread.setDaemon(true);
            return thread;
        });
        executor.setRemoveOnCancelPolicy(true);
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.actor = executor;
    }

    /**
     * Sets the receiver of emitted intents. Must be called before events arrive.
     */
    public void start(Consumer<ProcessingIntent> intentListener) {
        submit(() -> this.listener = intentListener);
    }

    public void accept(FileEvent event) {
        submit(() -> onEvent(event));
    }

    /**
     * Ends the intent's in-flight membership if its token is still current.
     */
    public void release(ProcessingIntent intent) {
        submit(() -> {
            if (inFlight.remove(intent.path(), intent.token())) {
                logger.trace("Released {} (token {})", intent.path(), intent.token());
            }
            publishCounts();
        });
    }

    public long detectedCount() {
        return detected.get();
    }

    public int pendingCount() {
        return pendingCount;
    }

    public int inFlightCount() {
        return inFlightCount;
    }

    /**
     * Drops every pending timer and stops accepting events. In-flight work is not affected.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        submit(() -> {
            debounceTable.values().forEach(timer -> timer.future().cancel(false));
            int dropped = debounceTable.size();
            debounceTable.clear();
            publishCounts();
            if (dropped > 0) {
                logger.info("Dropped {} pending debounce timer(s) on close", dropped);
            }
        });
        closed = true;
        actor.shutdown();
        try {
            if (!actor.awaitTermination(5, TimeUnit.SECONDS)) {
                actor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            actor.shutdownNow();
        }
    }

    private void onEvent(FileEvent event) {
        Path path = event.path();
        if (event.kind() == FileEventKind.DELETE) {
            onDelete(path);
            return;
        }
        if (!filter.isCandidate(path)) {
            return;
        }
        if (inFlight.containsKey(path)) {
            logger.debug("Ignoring {} event for {}: already in flight", event.kind(), path);
            return;
        }
        detected.incrementAndGet();
        cancelTimer(path);

        long generation = ++timerGeneration;
        FileStat stat = event.stat();
        ScheduledFuture<?> future = actor.schedule(() -> onTimer(path, stat, generation), debounceMillis, TimeUnit.MILLISECONDS);
        debounceTable.put(path, new PendingTimer(future, generation));
        publishCounts();
    }

    private void onDelete(Path path) {
        boolean hadTimer = cancelTimer(path);
        boolean wasInFlight = inFlight.remove(path) != null;
        if (hadTimer || wasInFlight) {
            logger.debug("{} deleted; pending timer cancelled: {}, in-flight membership dropped: {}", path, hadTimer, wasInFlight);
        }
        publishCounts();
    }

    private void onTimer(Path path, FileStat stat, long generation) {
        PendingTimer current = debounceTable.get(path);
        if (current == null || current.generation() != generation) {
            return;
        }
        debounceTable.remove(path);
        long token = ++tokenSequence;
        inFlight.put(path, token);
        publishCounts();

        ProcessingIntent intent = new ProcessingIntent(path, stat, token, Instant.now());
        if (listener == null) {
            logger.warn("No intent listener registered; dropping {}", path);
            inFlight.remove(path, token);
            publishCounts();
            return;
        }
        try {
            listener.accept(intent);
        } catch (RuntimeException e) {
            LoggingUtils.error(logger, e, "Intent listener rejected {}", path);
            inFlight.remove(path, token);
            publishCounts();
        }
    }

    private boolean cancelTimer(Path path) {
        PendingTimer existing = debounceTable.remove(path);
        if (existing == null) {
            return false;
        }
        existing.future().cancel(false);
        return true;
    }

    private void publishCounts() {
        pendingCount = debounceTable.size();
        inFlightCount = inFlight.size();
    }

    private void submit(Runnable command) {
        if (closed) {
            logger.trace("Coalescer closed; ignoring command");
            return;
        }
        try {
            actor.execute(command);
        } catch (RejectedExecutionException e) {
            logger.debug("Coalescer rejected command after shutdown");
        }
    }

    private record PendingTimer(ScheduledFuture<?> future, long generation) {
    }
}
