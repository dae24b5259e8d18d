package net.uploadsizer.scheduler;

import lombok.extern.slf4j.Slf4j;
import net.uploadsizer.model.image.SizeCatalog;
import net.uploadsizer.service.catalog.SizeCatalogService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Re-reads the size catalog on {@code pipeline.catalog.refresh-interval}.
 */
@Slf4j
@Component
public class SizeCatalogRefreshScheduler {

    private final SizeCatalogService catalogService;

    public SizeCatalogRefreshScheduler(SizeCatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @Scheduled(fixedDelayString = "${pipeline.catalog.refresh-interval:PT15M}",
               initialDelayString = "${pipeline.catalog.refresh-interval:PT15M}")
    public void refreshCatalog() {
        try {
            SizeCatalog catalog = catalogService.refresh();
            log.debug("Scheduled catalog refresh finished with {} size(s) from {}", catalog.size(), catalog.source());
        } catch (RuntimeException e) {
            log.error("Scheduled size catalog refresh failed: {}", e.getMessage(), e);
        }
    }
}
