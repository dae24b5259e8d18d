package net.uploadsizer.model.image;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of deriving every catalog size for one source.
 *
 * <p>Variants are kept in catalog order. A size that was skipped by the planner appears in neither
 * {@link #variants()} nor {@link #variantFailures()}.</p>
 */
public record ProcessingResult(SourceImage sourceImage,
                               List<DerivedVariant> variants,
                               List<VariantFailure> variantFailures,
                               CaptureMetadata captureMetadata,
                               long timingMs) {

    public ProcessingResult {
        Objects.requireNonNull(sourceImage, "sourceImage");
        variants = variants == null ? List.of() : List.copyOf(variants);
        variantFailures = variantFailures == null ? List.of() : List.copyOf(variantFailures);
        Objects.requireNonNull(captureMetadata, "captureMetadata");
    }

    /**
     * Variants keyed by size name, in catalog order.
     */
    public Map<String, DerivedVariant> variantsBySize() {
        Map<String, DerivedVariant> bySize = new LinkedHashMap<>();
        for (DerivedVariant variant : variants) {
            bySize.put(variant.sizeName(), variant);
        }
        return Collections.unmodifiableMap(bySize);
    }
}
