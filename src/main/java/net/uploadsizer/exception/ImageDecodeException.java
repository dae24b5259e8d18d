package net.uploadsizer.exception;

import jakarta.annotation.Nullable;
import java.nio.file.Path;
import net.uploadsizer.model.image.DecodeFailureReason;

/**
 * Source image could not be decoded (corrupt data, unsupported codec, zero dimensions).
 * RETRYABLE: No (the same bytes will fail again)
 *
 * <p>The whole derivation fails and no variants are written.</p>
 */
public class ImageDecodeException extends RuntimeException {

    private final Path sourcePath;
    private final DecodeFailureReason reason;

    public ImageDecodeException(Path sourcePath, DecodeFailureReason reason) {
        this(sourcePath, reason, null);
    }

    public ImageDecodeException(Path sourcePath, DecodeFailureReason reason, @Nullable Throwable cause) {
        super("Cannot decode " + sourcePath + ": " + reason.getDescription(), cause);
        this.sourcePath = sourcePath;
        this.reason = reason;
    }

    public Path getSourcePath() {
        return sourcePath;
    }

    public DecodeFailureReason getReason() {
        return reason;
    }
}
