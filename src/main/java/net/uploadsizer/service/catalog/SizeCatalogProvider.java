package net.uploadsizer.service.catalog;

import java.util.Map;
import net.uploadsizer.model.image.SizeSpec;

/**
 * Source of the named output sizes.
 */
public interface SizeCatalogProvider {

    /**
     * Fetches the current sizes in catalog order.
     *
     * @throws net.uploadsizer.exception.SizeCatalogUnavailableException when no usable sizes can be produced
     */
    Map<String, SizeSpec> fetchSizes();

    /**
     * Short label for logs.
     */
    String describe();
}
