package net.uploadsizer.support.concurrency;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * FIFO slot limiter for derivation work.
 *
 * <p>{@link #submit} never blocks: the task waits in the pending queue until one of {@code capacity}
 * slots frees up, runs on a {@code derive-worker-N} thread and gives its slot back in {@code finally}.
 * At no time are more than {@code capacity} tasks running.</p>
 */
@Slf4j
@Component
public class ConcurrencyLimiter {

    static final int MAX_ALLOWED_WORKERS = 64;
    private static final Duration DEFAULT_SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private final ExecutorService executorService;
    private final Deque<PendingTask<?>> pending;
    private final int capacity;

    private int runningCount;
    private boolean accepting;

    public ConcurrencyLimiter(@Value("${pipeline.images.workers:4}") int configuredWorkers) {
        this.capacity = coerceWorkers(configuredWorkers);
        this.pending = new ArrayDeque<>();
        AtomicInteger workerIndex = new AtomicInteger();
        this.executorService = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("derive-worker-" + workerIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.runningCount = 0;
        this.accepting = true;
        log.info("Derivation concurrency limited to {} worker(s)", capacity);
    }

    public synchronized LimiterSnapshot snapshot() {
        return new LimiterSnapshot(runningCount, pending.size(), capacity);
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Queues a task for execution.
     *
     * <p>After {@link #shutdown(Duration)} both returned futures complete exceptionally with
     * {@link RejectedExecutionException}.</p>
     */
    public synchronized <T> SubmittedTask<T> submit(Supplier<T> supplier) {
        CompletableFuture<Void> started = new CompletableFuture<>();
        CompletableFuture<T> result = new CompletableFuture<>();
        if (!accepting) {
            RejectedExecutionException rejection = new RejectedExecutionException("Concurrency limiter is shut down");
            started.completeExceptionally(rejection);
            result.completeExceptionally(rejection);
            return new SubmittedTask<>(started, result);
        }
        pending.addLast(new PendingTask<>(supplier, started, result));
        drain();
        return new SubmittedTask<>(started, result);
    }

    /**
     * Stops accepting work, cancels tasks that never started and waits up to {@code grace} for running ones
     * before interrupting them.
     */
    public void shutdown(Duration grace) {
        synchronized (this) {
            if (!accepting) {
                return;
            }
            accepting = false;
            CancellationException cancellation = new CancellationException("Concurrency limiter shut down before task start");
            PendingTask<?> next;
            while ((next = pending.pollFirst()) != null) {
                next.started.completeExceptionally(cancellation);
                next.result.completeExceptionally(cancellation);
            }
        }
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Derivation workers still running after {}; interrupting", grace);
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executorService.shutdownNow();
        }
    }

    @PreDestroy
    void shutdown() {
        shutdown(DEFAULT_SHUTDOWN_GRACE);
    }

    private synchronized void drain() {
        while (runningCount < capacity) {
            PendingTask<?> next = pending.pollFirst();
            if (next == null) {
                return;
            }
            runningCount += 1;
            next.started.complete(null);
            executorService.submit(() -> execute(next));
        }
    }

    /**
     * Runs the task, then frees its slot before completing the result, so a caller that sees the result
     * also sees the slot released. An {@link Error} completes the result exceptionally like any other failure.
     */
    private <T> void execute(PendingTask<T> task) {
        T value = null;
        Throwable failure = null;
        try {
            value = task.supplier.get();
        } catch (Throwable throwable) {
            failure = throwable;
            if (throwable instanceof Error) {
                log.error("Derivation worker hit {}", throwable.getClass().getSimpleName(), throwable);
            }
        }
        synchronized (this) {
            runningCount -= 1;
            if (accepting) {
                drain();
            }
        }
        if (failure == null) {
            task.result.complete(value);
        } else {
            task.result.completeExceptionally(failure);
        }
    }

    static int coerceWorkers(int configuredWorkers) {
        if (configuredWorkers <= 0) {
            return Math.min(Runtime.getRuntime().availableProcessors(), MAX_ALLOWED_WORKERS);
        }
        return Math.min(configuredWorkers, MAX_ALLOWED_WORKERS);
    }

    private static final class PendingTask<T> {
        private final Supplier<T> supplier;
        private final CompletableFuture<Void> started;
        private final CompletableFuture<T> result;

        private PendingTask(Supplier<T> supplier, CompletableFuture<Void> started, CompletableFuture<T> result) {
            this.supplier = supplier;
            this.started = started;
            this.result = result;
        }
    }

    public record LimiterSnapshot(int running, int pending, int capacity) {
    }

    public record SubmittedTask<T>(CompletableFuture<Void> started, CompletableFuture<T> result) {
    }
}
