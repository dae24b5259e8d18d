package net.uploadsizer.service.catalog;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import net.uploadsizer.config.PipelineProperties;
import net.uploadsizer.exception.SizeCatalogUnavailableException;
import net.uploadsizer.model.image.CatalogSource;
import net.uploadsizer.model.image.SizeCatalog;
import net.uploadsizer.model.image.SizeSpec;
import net.uploadsizer.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Holds the active size catalog and refreshes it from the {@link SizeCatalogProvider}.
 *
 * <p>Each derivation reads {@link #current()} once and works against that snapshot. A refresh swaps in a
 * whole new snapshot. When a fetch fails or exceeds the timeout the previous snapshot is kept as
 * last-known-good; when there has never been a good fetch the built-in default catalog is installed.</p>
 */
@Service
public class SizeCatalogService {

    private static final Logger logger = LoggerFactory.getLogger(SizeCatalogService.class);

    private final SizeCatalogProvider provider;
    private final Duration fetchTimeout;
    private final Clock clock;
    private final AtomicReference<SizeCatalog> current = new AtomicReference<>();
    private final ExecutorService fetchExecutor;

    @Autowired
    public SizeCatalogService(SizeCatalogProvider provider, PipelineProperties properties) {
        this(provider, properties.getCatalog().getFetchTimeout(), Clock.systemUTC());
    }

    SizeCatalogService(SizeCatalogProvider provider, Duration fetchTimeout, Clock clock) {
        this.provider = provider;
        this.fetchTimeout = fetchTimeout;
        this.clock = clock;
        this.fetchExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "size-catalog-fetch");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Returns the active snapshot, loading it on first use.
     */
    public SizeCatalog current() {
        SizeCatalog snapshot = current.get();
        return snapshot != null ? snapshot : refresh();
    }

    /**
     * Fetches sizes from the provider and installs the resulting snapshot.
     *
     * @return the snapshot now active (fresh, last-known-good or default)
     */
    public synchronized SizeCatalog refresh() {
        SizeCatalog previous = current.get();
        SizeCatalog next;
        try {
            Map<String, SizeSpec> sizes = fetchWithTimeout();
            next = SizeCatalog.of(sizes, clock.instant(), CatalogSource.PROVIDER);
            logger.info("Loaded {} image size(s) from {}: {}", next.size(), provider.describe(), next.sizes().keySet());
        } catch (SizeCatalogUnavailableException e) {
            next = previous != null ? previous.asLastKnownGood() : SizeCatalog.defaults(clock.instant());
            logger.warn("Size catalog unavailable ({}); using {} sizes {}",
                LoggingUtils.describe(e), next.source().getDescription().toLowerCase(Locale.ROOT), next.sizes().keySet());
        }
        current.set(next);
        return next;
    }

    private Map<String, SizeSpec> fetchWithTimeout() {
        CompletableFuture<Map<String, SizeSpec>> fetch = CompletableFuture.supplyAsync(provider::fetchSizes, fetchExecutor);
        try {
            Map<String, SizeSpec> sizes = fetch.get(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (sizes == null || sizes.isEmpty()) {
                throw new SizeCatalogUnavailableException(provider.describe() + " returned no sizes");
            }
            return sizes;
        } catch (TimeoutException e) {
            fetch.cancel(true);
            throw new SizeCatalogUnavailableException(provider.describe() + " did not answer within " + fetchTimeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SizeCatalogUnavailableException("Interrupted while fetching sizes from " + provider.describe(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SizeCatalogUnavailableException unavailable) {
                throw unavailable;
            }
            throw new SizeCatalogUnavailableException(provider.describe() + " failed: " + LoggingUtils.describe(cause), cause);
        }
    }

    @PreDestroy
    void shutdown() {
        fetchExecutor.shutdownNow();
    }
}
