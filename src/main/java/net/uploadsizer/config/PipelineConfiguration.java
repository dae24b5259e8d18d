/**
 * Wiring for the watch-and-derive pipeline
 *
 * Features:
 * - Resolves immutable settings records from {@link PipelineProperties} once
 * - Builds the event filter, coalescer and directory watcher around the configured root
 * - Chooses the size catalog provider: a JSON file when configured, the declared sizes otherwise
 */
package net.uploadsizer.config;

import java.nio.file.Path;
import net.uploadsizer.model.image.DerivationOptions;
import net.uploadsizer.service.catalog.ConfiguredSizeCatalogProvider;
import net.uploadsizer.service.catalog.JsonFileSizeCatalogProvider;
import net.uploadsizer.service.catalog.SizeCatalogProvider;
import net.uploadsizer.support.watch.CandidateFileFilter;
import net.uploadsizer.support.watch.CoalescerSettings;
import net.uploadsizer.support.watch.EventCoalescer;
import net.uploadsizer.support.watch.UploadDirectoryWatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import tools.jackson.databind.ObjectMapper;

@Configuration
public class PipelineConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(PipelineConfiguration.class);

    @Bean
    public DerivationOptions derivationOptions(PipelineProperties properties) {
        return properties.toDerivationOptions();
    }

    @Bean
    public CoalescerSettings coalescerSettings(PipelineProperties properties) {
        return new CoalescerSettings(properties.getWatcher().getDebounce());
    }

    @Bean
    public CandidateFileFilter candidateFileFilter(PipelineProperties properties) {
        return new CandidateFileFilter(properties.getWatcher().getInclude(), properties.getWatcher().getIgnore());
    }

    @Bean(destroyMethod = "close")
    public EventCoalescer eventCoalescer(CoalescerSettings settings, CandidateFileFilter filter) {
        return new EventCoalescer(settings, filter);
    }

    @Bean(destroyMethod = "stop")
    public UploadDirectoryWatcher uploadDirectoryWatcher(PipelineProperties properties,
                                                         CandidateFileFilter filter,
                                                         EventCoalescer coalescer) {
        return new UploadDirectoryWatcher(properties.rootPath(), filter, coalescer);
    }

    /**
     * Size catalog source: the JSON file named by {@code pipeline.catalog.file} when set, otherwise the
     * sizes declared under {@code pipeline.catalog.sizes}.
     */
    @Bean
    public SizeCatalogProvider sizeCatalogProvider(PipelineProperties properties, ObjectMapper objectMapper) {
        String file = properties.getCatalog().getFile();
        if (StringUtils.hasText(file)) {
            Path path = Path.of(file).toAbsolutePath().normalize();
            logger.info("Size catalog will be read from {}", path);
            return new JsonFileSizeCatalogProvider(path, objectMapper);
        }
        logger.info("Size catalog will use {} configured size(s)", properties.getCatalog().getSizes().size());
        return new ConfiguredSizeCatalogProvider(properties.getCatalog());
    }
}
