package net.uploadsizer.model.image;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, ordered snapshot of the output sizes to derive.
 *
 * <p>Iteration order is catalog order and is preserved in every {@link ProcessingResult} built from it.
 * Refreshes replace the whole snapshot; a snapshot is never mutated.</p>
 */
public final class SizeCatalog {

    private static final List<SizeSpec> DEFAULT_SIZES = List.of(
        SizeSpec.cropped("thumbnail", 150, 150),
        SizeSpec.fit("medium", 300, 300),
        SizeSpec.fit("large", 1024, 1024)
    );

    private final Map<String, SizeSpec> sizes;
    private final Instant loadedAt;
    private final CatalogSource source;

    private SizeCatalog(Map<String, SizeSpec> sizes, Instant loadedAt, CatalogSource source) {
        this.sizes = Collections.unmodifiableMap(new LinkedHashMap<>(sizes));
        this.loadedAt = Objects.requireNonNull(loadedAt, "loadedAt");
        this.source = Objects.requireNonNull(source, "source");
    }

    public static SizeCatalog of(Map<String, SizeSpec> sizes, Instant loadedAt, CatalogSource source) {
        Objects.requireNonNull(sizes, "sizes");
        return new SizeCatalog(sizes, loadedAt, source);
    }

    public static SizeCatalog of(List<SizeSpec> specs, Instant loadedAt, CatalogSource source) {
        Map<String, SizeSpec> byName = new LinkedHashMap<>();
        for (SizeSpec spec : specs) {
            byName.put(spec.name(), spec);
        }
        return new SizeCatalog(byName, loadedAt, source);
    }

    /**
     * Built-in fallback used when no provider fetch has ever succeeded.
     */
    public static SizeCatalog defaults(Instant loadedAt) {
        return of(DEFAULT_SIZES, loadedAt, CatalogSource.DEFAULT);
    }

    /**
     * Same sizes, re-labelled as a retained snapshot after a failed refresh.
     */
    public SizeCatalog asLastKnownGood() {
        return source == CatalogSource.LAST_KNOWN_GOOD ? this : new SizeCatalog(sizes, loadedAt, CatalogSource.LAST_KNOWN_GOOD);
    }

    public Map<String, SizeSpec> sizes() {
        return sizes;
    }

    public Iterable<SizeSpec> specs() {
        return sizes.values();
    }

    public int size() {
        return sizes.size();
    }

    public boolean isEmpty() {
        return sizes.isEmpty();
    }

    public Instant loadedAt() {
        return loadedAt;
    }

    public CatalogSource source() {
        return source;
    }

    @Override
    public String toString() {
        return "SizeCatalog{source=" + source + ", sizes=" + sizes.keySet() + ", loadedAt=" + loadedAt + "}";
    }
}
