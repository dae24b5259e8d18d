package net.uploadsizer.util.image;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Naming contract shared by the derivation engine (what it writes) and the event filter (what it ignores).
 *
 * <p>Variants are written as {@code {baseName}-{w}x{h}.{ext}} next to the source, backups as
 * {@code {fileName}.backup}, and in-progress writes as hidden {@code .{fileName}.tmp-*} siblings.</p>
 */
public final class DerivedFileNames {

    public static final Set<String> SUPPORTED_EXTENSIONS = Set.of("jpg", "jpeg", "png", "gif", "webp", "bmp", "tiff", "tif");
    public static final String BACKUP_SUFFIX = ".backup";

    private static final Pattern DERIVED_NAME = Pattern.compile(".*-\\d+x\\d+\\.[^.]+$");
    private static final String TEMP_MARKER = ".tmp-";

    private DerivedFileNames() {
    }

    public static String extension(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1);
    }

    public static String baseName(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot <= 0 ? fileName : fileName.substring(0, dot);
    }

    public static boolean hasSupportedExtension(Path path) {
        return SUPPORTED_EXTENSIONS.contains(extension(path).toLowerCase(Locale.ROOT));
    }

    /**
     * Whether the file name carries the {@code -WxH} suffix this pipeline writes.
     */
    public static boolean isDerivedName(Path path) {
        return DERIVED_NAME.matcher(path.getFileName().toString()).matches();
    }

    public static boolean isBackup(Path path) {
        return path.getFileName().toString().endsWith(BACKUP_SUFFIX);
    }

    public static boolean isTemporary(Path path) {
        String fileName = path.getFileName().toString();
        return fileName.startsWith(".") && fileName.contains(TEMP_MARKER);
    }

    /**
     * Variant sibling for the source, keeping the source's own extension.
     */
    public static Path variantPath(Path source, int width, int height) {
        return variantPath(source, width, height, extension(source));
    }

    public static Path variantPath(Path source, int width, int height, String extension) {
        String name = baseName(source) + "-" + width + "x" + height + "." + extension;
        return source.resolveSibling(name);
    }

    public static Path backupPath(Path source) {
        return source.resolveSibling(source.getFileName() + BACKUP_SUFFIX);
    }

    /**
     * Hidden sibling used as the write target before the final move.
     */
    public static Path temporarySibling(Path target) {
        return target.resolveSibling("." + target.getFileName() + TEMP_MARKER + UUID.randomUUID());
    }
}
