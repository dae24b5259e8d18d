package net.uploadsizer.support.watch;

import java.time.Duration;
import java.util.Objects;

/**
 * Debounce window applied per path before an event becomes a processing intent.
 */
public record CoalescerSettings(Duration debounce) {

    public CoalescerSettings {
        Objects.requireNonNull(debounce, "debounce");
        if (debounce.isNegative()) {
            throw new IllegalArgumentException("Debounce must not be negative: " + debounce);
        }
    }
}
