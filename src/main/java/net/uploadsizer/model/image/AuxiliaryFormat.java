package net.uploadsizer.model.image;

import java.nio.file.Path;

/**
 * Additional encoding of a derived variant in a modern format such as WebP or AVIF.
 */
public record AuxiliaryFormat(String format, Path filePath, long byteSize) {
}
