package net.uploadsizer.service.catalog;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.uploadsizer.config.PipelineProperties;
import net.uploadsizer.exception.SizeCatalogUnavailableException;
import net.uploadsizer.model.image.SizeSpec;

/**
 * Serves the sizes declared under {@code pipeline.catalog.sizes}.
 */
public class ConfiguredSizeCatalogProvider implements SizeCatalogProvider {

    private final PipelineProperties.Catalog catalog;

    public ConfiguredSizeCatalogProvider(PipelineProperties.Catalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public Map<String, SizeSpec> fetchSizes() {
        List<SizeSpec> specs;
        try {
            specs = catalog.toSizeSpecs();
        } catch (IllegalArgumentException e) {
            throw new SizeCatalogUnavailableException("Invalid configured size: " + e.getMessage(), e);
        }
        if (specs.isEmpty()) {
            throw new SizeCatalogUnavailableException("No sizes configured under pipeline.catalog.sizes");
        }
        Map<String, SizeSpec> sizes = new LinkedHashMap<>();
        for (SizeSpec spec : specs) {
            sizes.put(spec.name(), spec);
        }
        return sizes;
    }

    @Override
    public String describe() {
        return "configuration";
    }
}
