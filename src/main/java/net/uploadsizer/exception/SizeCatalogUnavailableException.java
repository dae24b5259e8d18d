package net.uploadsizer.exception;

/**
 * The size catalog provider could not supply sizes (I/O error, malformed data, timeout, empty result).
 * RETRYABLE: Yes, on the next scheduled refresh
 */
public final class SizeCatalogUnavailableException extends RuntimeException {

    public SizeCatalogUnavailableException(String message) {
        super(message);
    }

    public SizeCatalogUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
