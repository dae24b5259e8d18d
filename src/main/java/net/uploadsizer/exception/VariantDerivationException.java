package net.uploadsizer.exception;

import java.nio.file.Path;

/**
 * Resizing or encoding one catalog size failed.
 * RETRYABLE: No within the same attempt; the remaining sizes still run.
 */
public class VariantDerivationException extends RuntimeException {

    private final String sizeName;
    private final Path sourcePath;

    public VariantDerivationException(String sizeName, Path sourcePath, Throwable cause) {
        super("Failed to derive size '" + sizeName + "' for " + sourcePath + ": " + describe(cause), cause);
        this.sizeName = sizeName;
        this.sourcePath = sourcePath;
    }

    public String getSizeName() {
        return sizeName;
    }

    public Path getSourcePath() {
        return sourcePath;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
