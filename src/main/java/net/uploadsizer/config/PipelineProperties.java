package net.uploadsizer.config;

import jakarta.annotation.PostConstruct;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.uploadsizer.model.image.DerivationOptions;
import net.uploadsizer.model.image.SizeSpec;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Strongly typed configuration for the upload pipeline.
 */
@Component
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    private final Watcher watcher = new Watcher();
    private final Images images = new Images();
    private final Catalog catalog = new Catalog();
    private final Metadata metadata = new Metadata();
    private final Monitoring monitoring = new Monitoring();

    /**
     * How long shutdown waits for in-flight derivations before interrupting workers.
     */
    private Duration shutdownGrace = Duration.ofSeconds(30);

    @PostConstruct
    void validate() {
        Assert.hasText(watcher.root, "pipeline.watcher.root must be set");
        Assert.isTrue(!watcher.debounce.isNegative(), "pipeline.watcher.debounce must be non-negative");
        assertQuality("jpeg", images.quality.jpeg);
        assertQuality("webp", images.quality.webp);
        assertQuality("avif", images.quality.avif);
        Assert.isTrue(catalog.fetchTimeout.toMillis() > 0, "pipeline.catalog.fetch-timeout must be positive");
        Assert.isTrue(catalog.refreshInterval.toMillis() > 0, "pipeline.catalog.refresh-interval must be positive");
        Assert.isTrue(monitoring.reportInterval.toMillis() > 0, "pipeline.monitoring.report-interval must be positive");
        Assert.isTrue(!shutdownGrace.isNegative(), "pipeline.shutdown-grace must be non-negative");
        catalog.sizes.forEach((name, size) -> Assert.isTrue(size.width > 0 || size.height > 0,
            "pipeline.catalog.sizes." + name + " must set width or height"));
    }

    private static void assertQuality(String format, int quality) {
        Assert.isTrue(quality >= 1 && quality <= 100, "pipeline.images.quality." + format + " must be between 1 and 100");
    }

    /**
     * Encoder settings for the derivation engine.
     */
    public DerivationOptions toDerivationOptions() {
        return new DerivationOptions(
            images.quality.jpeg,
            images.quality.webp,
            images.quality.avif,
            images.progressive,
            images.optimize,
            images.formats.webp,
            images.formats.avif,
            images.backupOriginals
        );
    }

    public Path rootPath() {
        return Path.of(watcher.root).toAbsolutePath().normalize();
    }

    /**
     * Sidecar metadata directory, defaulting to {@code .sizes-metadata} under the watch root.
     */
    public Path metadataPath() {
        if (metadata.directory == null || metadata.directory.isBlank()) {
            return rootPath().resolve(".sizes-metadata");
        }
        return Path.of(metadata.directory).toAbsolutePath().normalize();
    }

    public Watcher getWatcher() {
        return watcher;
    }

    public Images getImages() {
        return images;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public Metadata getMetadata() {
        return metadata;
    }

    public Monitoring getMonitoring() {
        return monitoring;
    }

    public Duration getShutdownGrace() {
        return shutdownGrace;
    }

    public void setShutdownGrace(Duration shutdownGrace) {
        this.shutdownGrace = shutdownGrace;
    }

    public static class Watcher {

        /**
         * Uploads directory to watch recursively; created when missing.
         */
        private String root = "./uploads";

        /**
         * Globs, relative to the root, a file must match to be considered.
         */
        private List<String> include = new ArrayList<>(List.of("**/*.{jpg,jpeg,png,gif,webp,bmp,tiff,tif}"));

        /**
         * Globs, relative to the root, for files and directories that are never processed.
         */
        private List<String> ignore = new ArrayList<>(List.of("**/node_modules/**", "**/.git/**", "**/thumbs/**"));

        /**
         * Quiet period after the last event for a file before it is processed.
         */
        private Duration debounce = Duration.ofMillis(1000);

        public String getRoot() {
            return root;
        }

        public void setRoot(String root) {
            this.root = root;
        }

        public List<String> getInclude() {
            return include;
        }

        public void setInclude(List<String> include) {
            this.include = include;
        }

        public List<String> getIgnore() {
            return ignore;
        }

        public void setIgnore(List<String> ignore) {
            this.ignore = ignore;
        }

        public Duration getDebounce() {
            return debounce;
        }

        public void setDebounce(Duration debounce) {
            this.debounce = debounce;
        }
    }

    public static class Images {

        private final Quality quality = new Quality();
        private final Formats formats = new Formats();

        /**
         * Write progressive JPEGs.
         */
        private boolean progressive = true;

        /**
         * Optimize JPEG Huffman tables.
         */
        private boolean optimize = true;

        /**
         * Maximum concurrent derivations; 0 or less uses the number of available processors.
         */
        private int workers = 4;

        /**
         * Keep an untouched {@code .backup} copy of every source.
         */
        private boolean backupOriginals = true;

        public Quality getQuality() {
            return quality;
        }

        public Formats getFormats() {
            return formats;
        }

        public boolean isProgressive() {
            return progressive;
        }

        public void setProgressive(boolean progressive) {
            this.progressive = progressive;
        }

        public boolean isOptimize() {
            return optimize;
        }

        public void setOptimize(boolean optimize) {
            this.optimize = optimize;
        }

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public boolean isBackupOriginals() {
            return backupOriginals;
        }

        public void setBackupOriginals(boolean backupOriginals) {
            this.backupOriginals = backupOriginals;
        }
    }

    public static class Quality {
        private int jpeg = 90;
        private int webp = 80;
        private int avif = 75;

        public int getJpeg() {
            return jpeg;
        }

        public void setJpeg(int jpeg) {
            this.jpeg = jpeg;
        }

        public int getWebp() {
            return webp;
        }

        public void setWebp(int webp) {
            this.webp = webp;
        }

        public int getAvif() {
            return avif;
        }

        public void setAvif(int avif) {
            this.avif = avif;
        }
    }

    public static class Formats {
        private boolean webp = true;
        private boolean avif = false;

        public boolean isWebp() {
            return webp;
        }

        public void setWebp(boolean webp) {
            this.webp = webp;
        }

        public boolean isAvif() {
            return avif;
        }

        public void setAvif(boolean avif) {
            this.avif = avif;
        }
    }

    public static class Catalog {

        /**
         * Sizes served by the configured provider, in catalog order.
         */
        private Map<String, Size> sizes = new LinkedHashMap<>();

        /**
         * Optional JSON file in the {@code wp_get_additional_image_sizes()} shape; takes precedence over {@code sizes}.
         */
        private String file;

        private Duration refreshInterval = Duration.ofMinutes(15);

        private Duration fetchTimeout = Duration.ofSeconds(10);

        public List<SizeSpec> toSizeSpecs() {
            List<SizeSpec> specs = new ArrayList<>(sizes.size());
            sizes.forEach((name, size) -> specs.add(new SizeSpec(name, size.width, size.height, size.crop)));
            return specs;
        }

        public Map<String, Size> getSizes() {
            return sizes;
        }

        public void setSizes(Map<String, Size> sizes) {
            this.sizes = sizes;
        }

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }

        public Duration getRefreshInterval() {
            return refreshInterval;
        }

        public void setRefreshInterval(Duration refreshInterval) {
            this.refreshInterval = refreshInterval;
        }

        public Duration getFetchTimeout() {
            return fetchTimeout;
        }

        public void setFetchTimeout(Duration fetchTimeout) {
            this.fetchTimeout = fetchTimeout;
        }
    }

    public static class Size {
        private int width;
        private int height;
        private boolean crop;

        public int getWidth() {
            return width;
        }

        public void setWidth(int width) {
            this.width = width;
        }

        public int getHeight() {
            return height;
        }

        public void setHeight(int height) {
            this.height = height;
        }

        public boolean isCrop() {
            return crop;
        }

        public void setCrop(boolean crop) {
            this.crop = crop;
        }
    }

    public static class Metadata {

        /**
         * Where sidecar {@code _wp_attachment_metadata} JSON files are written; blank means {@code {root}/.sizes-metadata}.
         */
        private String directory;

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }
    }

    public static class Monitoring {

        /**
         * Whether the periodic stats log line is written.
         */
        private boolean enabled = true;

        private Duration reportInterval = Duration.ofMinutes(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getReportInterval() {
            return reportInterval;
        }

        public void setReportInterval(Duration reportInterval) {
            this.reportInterval = reportInterval;
        }
    }
}
