package net.uploadsizer.model.image;

/**
 * Where the active size catalog snapshot came from.
 */
public enum CatalogSource {
    PROVIDER("Fetched from the configured catalog provider"),
    LAST_KNOWN_GOOD("Kept from the previous successful fetch"),
    DEFAULT("Built-in thumbnail/medium/large fallback");

    private final String description;

    CatalogSource(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
