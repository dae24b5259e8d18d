package net.uploadsizer.support.watch;

import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import net.uploadsizer.util.image.DerivedFileNames;

/**
 * Decides which paths under the watch root are source images.
 *
 * <p>Two layers: the include/ignore globs (matched case-insensitively against the path relative to the
 * root) and the fixed name rules that keep the pipeline from reacting to its own output.</p>
 */
public class CandidateFileFilter {

    private static final Path ANCHOR = Paths.get(".");
    private static final String DIRECTORY_SAMPLE = "entry";

    private final List<PathMatcher> includes;
    private final List<PathMatcher> ignores;

    public CandidateFileFilter(List<String> includeGlobs, List<String> ignoreGlobs) {
        FileSystem fileSystem = FileSystems.getDefault();
        this.includes = compile(fileSystem, includeGlobs);
        this.ignores = compile(fileSystem, ignoreGlobs);
    }

    /**
     * Name rules only: supported extension, not a {@code -WxH} variant, not a backup, not a temp write.
     */
    public boolean isCandidate(Path path) {
        if (path == null || path.getFileName() == null) {
            return false;
        }
        return DerivedFileNames.hasSupportedExtension(path)
            && !DerivedFileNames.isDerivedName(path)
            && !DerivedFileNames.isBackup(path)
            && !DerivedFileNames.isTemporary(path);
    }

    /**
     * Glob rules for a file, given its path relative to the watch root.
     */
    public boolean isIncluded(Path relativePath) {
        Path anchored = anchor(relativePath);
        if (matchesAny(ignores, anchored)) {
            return false;
        }
        return includes.isEmpty() || matchesAny(includes, anchored);
    }

    /**
     * Whether a directory, relative to the root, falls under an ignore glob and should not be watched.
     */
    public boolean isIgnoredDirectory(Path relativeDirectory) {
        if (relativeDirectory.toString().isEmpty()) {
            return false;
        }
        return matchesAny(ignores, anchor(relativeDirectory.resolve(DIRECTORY_SAMPLE)));
    }

    private static Path anchor(Path relativePath) {
        return ANCHOR.resolve(relativePath.toString().toLowerCase(Locale.ROOT));
    }

    private static boolean matchesAny(List<PathMatcher> matchers, Path path) {
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(path)) {
                return true;
            }
        }
        return false;
    }

    private static List<PathMatcher> compile(FileSystem fileSystem, List<String> globs) {
        List<PathMatcher> matchers = new ArrayList<>();
        if (globs == null) {
            return matchers;
        }
        for (String glob : globs) {
            if (glob != null && !glob.isBlank()) {
                matchers.add(fileSystem.getPathMatcher("glob:" + glob.trim().toLowerCase(Locale.ROOT)));
            }
        }
        return matchers;
    }
}
