package net.uploadsizer.model.image;

/**
 * Why a source could not be decoded into pixels.
 */
public enum DecodeFailureReason {
    NO_READER("No image reader recognizes the file"),
    CORRUPT("The image data could not be read"),
    EMPTY_IMAGE("The image has zero width or height");

    private final String description;

    DecodeFailureReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
