package net.uploadsizer.model.image;

/**
 * A catalog size that could not be produced for a source.
 */
public record VariantFailure(String sizeName, String message) {
}
