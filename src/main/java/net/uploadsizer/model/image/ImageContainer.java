package net.uploadsizer.model.image;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Image container formats accepted as sources, keyed by file extension.
 */
public enum ImageContainer {
    JPEG("jpeg", "image/jpeg", false, "jpg", "jpeg"),
    PNG("png", "image/png", true, "png"),
    GIF("gif", "image/gif", true, "gif"),
    WEBP("webp", "image/webp", true, "webp"),
    BMP("bmp", "image/bmp", false, "bmp"),
    TIFF("tiff", "image/tiff", true, "tiff", "tif");

    private final String formatName;
    private final String mimeType;
    private final boolean supportsAlpha;
    private final String[] extensions;

    ImageContainer(String formatName, String mimeType, boolean supportsAlpha, String... extensions) {
        this.formatName = formatName;
        this.mimeType = mimeType;
        this.supportsAlpha = supportsAlpha;
        this.extensions = extensions;
    }

    /**
     * ImageIO writer format name.
     */
    public String getFormatName() {
        return formatName;
    }

    public String getMimeType() {
        return mimeType;
    }

    public boolean supportsAlpha() {
        return supportsAlpha;
    }

    public static Optional<ImageContainer> fromExtension(String extension) {
        if (extension == null || extension.isBlank()) {
            return Optional.empty();
        }
        String normalized = extension.toLowerCase(Locale.ROOT);
        for (ImageContainer container : values()) {
            for (String candidate : container.extensions) {
                if (candidate.equals(normalized)) {
                    return Optional.of(container);
                }
            }
        }
        return Optional.empty();
    }

    public static Optional<ImageContainer> fromPath(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return Optional.empty();
        }
        return fromExtension(fileName.substring(dot + 1));
    }
}
