package net.uploadsizer.model.image;

import java.util.Objects;

/**
 * One named output size from the size catalog.
 *
 * <p>A bound of {@code 0} leaves that axis unconstrained. Both bounds at {@code 0} is reserved and rejected.</p>
 *
 * @param name catalog key, e.g. {@code thumbnail}
 * @param maxWidth maximum output width in pixels, {@code 0} for height-only sizes
 * @param maxHeight maximum output height in pixels, {@code 0} for width-only sizes
 * @param crop whether the output is cropped to the exact bounds instead of fitted
 */
public record SizeSpec(String name, int maxWidth, int maxHeight, boolean crop) {

    public SizeSpec {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Size name must not be blank");
        }
        if (maxWidth < 0 || maxHeight < 0) {
            throw new IllegalArgumentException(
                "Size '%s' has negative bounds %dx%d".formatted(name, maxWidth, maxHeight));
        }
        if (maxWidth == 0 && maxHeight == 0) {
            throw new IllegalArgumentException("Size '%s' must constrain at least one dimension".formatted(name));
        }
    }

    public static SizeSpec fit(String name, int maxWidth, int maxHeight) {
        return new SizeSpec(name, maxWidth, maxHeight, false);
    }

    public static SizeSpec cropped(String name, int width, int height) {
        return new SizeSpec(name, width, height, true);
    }

    /**
     * Crop applies only when both bounds are set; a crop size with an open axis behaves as a fit.
     */
    public boolean cropsExactly() {
        return crop && maxWidth > 0 && maxHeight > 0;
    }

    public boolean widthUnbounded() {
        return maxWidth == 0;
    }

    public boolean heightUnbounded() {
        return maxHeight == 0;
    }
}
