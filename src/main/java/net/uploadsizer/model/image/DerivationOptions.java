package net.uploadsizer.model.image;

import java.util.ArrayList;
import java.util.List;

/**
 * Encoder settings resolved once from configuration.
 *
 * @param jpegQuality JPEG quality, 1-100
 * @param webpQuality WebP quality, 1-100
 * @param avifQuality AVIF quality, 1-100
 * @param progressive write progressive JPEGs where the writer supports it
 * @param optimize optimize JPEG Huffman tables
 * @param webpEnabled also write a WebP sibling per variant
 * @param avifEnabled also write an AVIF sibling per variant
 * @param backupOriginals copy the source to {@code .backup} before the first encode
 */
public record DerivationOptions(int jpegQuality,
                                int webpQuality,
                                int avifQuality,
                                boolean progressive,
                                boolean optimize,
                                boolean webpEnabled,
                                boolean avifEnabled,
                                boolean backupOriginals) {

    public static DerivationOptions defaults() {
        return new DerivationOptions(90, 80, 75, true, true, true, false, true);
    }

    /**
     * Modern formats requested, in write order.
     */
    public List<String> modernFormats() {
        List<String> formats = new ArrayList<>(2);
        if (webpEnabled) {
            formats.add("webp");
        }
        if (avifEnabled) {
            formats.add("avif");
        }
        return formats;
    }

    public int qualityFor(String formatName) {
        return switch (formatName) {
            case "jpeg", "jpg" -> jpegQuality;
            case "webp" -> webpQuality;
            case "avif" -> avifQuality;
            default -> 100;
        };
    }

    public DerivationOptions withBackupOriginals(boolean enabled) {
        return new DerivationOptions(jpegQuality, webpQuality, avifQuality,
            progressive, optimize, webpEnabled, avifEnabled, enabled);
    }

    public DerivationOptions withModernFormats(boolean webp, boolean avif) {
        return new DerivationOptions(jpegQuality, webpQuality, avifQuality,
            progressive, optimize, webp, avif, backupOriginals);
    }
}
