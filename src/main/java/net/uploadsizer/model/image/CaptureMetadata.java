package net.uploadsizer.model.image;

/**
 * Best-effort camera metadata in the string-valued shape of WordPress {@code image_meta}.
 *
 * <p>Numeric fields default to {@code "0"}, text fields to an empty string and orientation to {@code "1"}.</p>
 */
public record CaptureMetadata(String aperture,
                              String credit,
                              String camera,
                              String caption,
                              String createdTimestamp,
                              String copyright,
                              String focalLength,
                              String iso,
                              String shutterSpeed,
                              String title,
                              String orientation) {

    public CaptureMetadata {
        aperture = orDefault(aperture, "0");
        credit = orDefault(credit, "");
        camera = orDefault(camera, "");
        caption = orDefault(caption, "");
        createdTimestamp = orDefault(createdTimestamp, "0");
        copyright = orDefault(copyright, "");
        focalLength = orDefault(focalLength, "0");
        iso = orDefault(iso, "0");
        shutterSpeed = orDefault(shutterSpeed, "0");
        title = orDefault(title, "");
        orientation = orDefault(orientation, "1");
    }

    /**
     * Metadata carrying only a creation timestamp (epoch seconds).
     */
    public static CaptureMetadata createdAt(long epochSeconds) {
        return new CaptureMetadata(null, null, null, null, Long.toString(epochSeconds),
            null, null, null, null, null, null);
    }

    private static String orDefault(String value, String fallback) {
        return value == null ? fallback : value;
    }
}
