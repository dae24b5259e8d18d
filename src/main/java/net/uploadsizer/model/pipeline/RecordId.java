package net.uploadsizer.model.pipeline;

import java.util.Objects;

/**
 * Identifier of the media record a result is attached to.
 */
public record RecordId(String value) {

    public RecordId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Record id must not be blank");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
