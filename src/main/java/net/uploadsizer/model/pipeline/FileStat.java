package net.uploadsizer.model.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;

/**
 * Size and modification time observed when an event was raised.
 */
public record FileStat(long size, Instant lastModified) {

    public static FileStat of(Path path) throws IOException {
        BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
        return new FileStat(attributes.size(), attributes.lastModifiedTime().toInstant());
    }
}
