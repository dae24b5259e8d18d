package net.uploadsizer.model.image;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Source file as read for a single processing attempt.
 */
public record SourceImage(Path absolutePath,
                          int pixelWidth,
                          int pixelHeight,
                          long byteSize,
                          Instant createdAt,
                          ImageContainer container) {

    public String fileName() {
        return absolutePath.getFileName().toString();
    }
}
