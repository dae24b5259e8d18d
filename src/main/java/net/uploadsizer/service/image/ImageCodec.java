package net.uploadsizer.service.image;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import net.uploadsizer.model.image.DerivationOptions;

/**
 * Decodes sources and encodes variants.
 */
public interface ImageCodec {

    /**
     * Decodes the whole image.
     *
     * @throws net.uploadsizer.exception.ImageDecodeException when the data is unreadable or empty
     * @throws IOException when the file cannot be opened
     */
    BufferedImage decode(Path source) throws IOException;

    /**
     * Whether some registered reader recognizes the file's content, without decoding pixels.
     */
    boolean isRecognized(Path source) throws IOException;

    /**
     * Whether a writer for the format name (e.g. {@code jpeg}, {@code webp}) is available.
     */
    boolean canEncode(String formatName);

    /**
     * Encodes the image into {@code target}, replacing whatever is there.
     */
    void encode(BufferedImage image, String formatName, Path target, DerivationOptions options) throws IOException;
}
