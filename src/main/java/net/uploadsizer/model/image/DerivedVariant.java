package net.uploadsizer.model.image;

import java.nio.file.Path;
import java.util.List;

/**
 * One written output size.
 *
 * @param sizeName catalog size this variant satisfies
 * @param filePath absolute path of the written file
 * @param pixelWidth actual output width
 * @param pixelHeight actual output height
 * @param mimeType MIME type of the primary file
 * @param byteSize size on disk, read back after the write
 * @param auxiliaryFormats modern-format siblings written for the same dimensions
 */
public record DerivedVariant(String sizeName,
                             Path filePath,
                             int pixelWidth,
                             int pixelHeight,
                             String mimeType,
                             long byteSize,
                             List<AuxiliaryFormat> auxiliaryFormats) {

    public DerivedVariant {
        auxiliaryFormats = auxiliaryFormats == null ? List.of() : List.copyOf(auxiliaryFormats);
    }

    /**
     * Reuses the written file for another size that resolved to the same dimensions.
     */
    public DerivedVariant withSizeName(String otherSizeName) {
        return new DerivedVariant(otherSizeName, filePath, pixelWidth, pixelHeight, mimeType, byteSize, auxiliaryFormats);
    }
}
