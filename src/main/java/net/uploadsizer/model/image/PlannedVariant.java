package net.uploadsizer.model.image;

/**
 * Target dimensions computed for one size before any pixels are touched.
 *
 * @param spec the catalog entry
 * @param width output width, at least 1
 * @param height output height, at least 1
 * @param crop whether the resize is cover-and-center-crop rather than a proportional fit
 */
public record PlannedVariant(SizeSpec spec, int width, int height, boolean crop) {

    public String sizeName() {
        return spec.name();
    }
}
