package net.uploadsizer.support.watch;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import net.uploadsizer.model.pipeline.FileEvent;
import net.uploadsizer.model.pipeline.FileStat;
import net.uploadsizer.util.LoggingUtils;

/**
 * Recursive {@link WatchService} over the uploads root, feeding add/modify/delete events to the coalescer.
 *
 * <p>Directories created after start are registered as they appear, and files already inside them are
 * reported as additions. Ignored directories are never registered. Losing the root key stops the watcher
 * and marks the root inaccessible.</p>
 */
@Slf4j
public class UploadDirectoryWatcher {

    private static final long POLL_MILLIS = 500;

    private final Path root;
    private final CandidateFileFilter filter;
    private final EventCoalescer coalescer;
    private final Map<WatchKey, Path> keyToDir = new ConcurrentHashMap<>();

    private volatile WatchService watchService;
    private volatile Thread thread;
    private volatile boolean running;
    private volatile boolean rootAccessible = true;

    public UploadDirectoryWatcher(Path root, CandidateFileFilter filter, EventCoalescer coalescer) {
        this.root = root.toAbsolutePath().normalize();
        this.filter = filter;
        this.coalescer = coalescer;
    }

    /**
     * Creates the root if missing, registers the tree and starts the {@code upload-watch} thread.
     *
     * @throws IllegalStateException when the root cannot be created or watched
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        try {
            Files.createDirectories(root);
            watchService = root.getFileSystem().newWatchService();
            registerTree(root);
        } catch (IOException e) {
            closeQuietly();
            throw new IllegalStateException("Cannot watch upload directory " + root, e);
        }
        running = true;
        rootAccessible = true;
        thread = new Thread(this::loop, "upload-watch");
        thread.setDaemon(true);
        thread.start();
        log.info("Watching {} ({} directories)", root, keyToDir.size());
    }

    public synchronized void stop() {
        if (!running && thread == null) {
            return;
        }
        running = false;
        closeQuietly();
        Thread current = thread;
        thread = null;
        if (current != null && current != Thread.currentThread()) {
            try {
                current.join(TimeUnit.SECONDS.toMillis(2));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Stopped watching {}", root);
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isRootAccessible() {
        return rootAccessible;
    }

    public int watchedDirectoryCount() {
        return keyToDir.size();
    }

    public Path getRoot() {
        return root;
    }

    private void loop() {
        while (running) {
            WatchKey key;
            try {
                key = watchService.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ClosedWatchServiceException e) {
                break;
            }
            if (key == null) {
                continue;
            }
            Path dir = keyToDir.get(key);
            if (dir == null) {
                key.reset();
                continue;
            }
            for (WatchEvent<?> event : key.pollEvents()) {
                dispatch(dir, event);
            }
            if (!key.reset()) {
                keyToDir.remove(key);
                if (dir.equals(root)) {
                    rootAccessible = false;
                    running = false;
                    log.error("Watch root {} is no longer accessible; watcher stopped", root);
                } else {
                    log.debug("Stopped watching removed directory {}", dir);
                }
            }
        }
    }

    private void dispatch(Path dir, WatchEvent<?> event) {
        WatchEvent.Kind<?> kind = event.kind();
        if (kind == OVERFLOW) {
            log.warn("Filesystem event overflow under {}; some uploads may need to be re-saved to be processed", dir);
            return;
        }
        Path full = dir.resolve((Path) event.context());
        if (kind == ENTRY_DELETE) {
            coalescer.accept(FileEvent.deleted(full));
            return;
        }
        if (Files.isDirectory(full, LinkOption.NOFOLLOW_LINKS)) {
            if (kind == ENTRY_CREATE) {
                onDirectoryCreated(full);
            }
            return;
        }
        if (!filter.isIncluded(root.relativize(full))) {
            return;
        }
        try {
            FileStat stat = FileStat.of(full);
            coalescer.accept(kind == ENTRY_CREATE ? FileEvent.added(full, stat) : FileEvent.modified(full, stat));
        } catch (NoSuchFileException e) {
            log.debug("{} vanished before it could be stat'ed", full);
        } catch (IOException e) {
            LoggingUtils.warnBrief(log, full, "Cannot stat new file", e);
        }
    }

    private void onDirectoryCreated(Path directory) {
        try {
            registerTree(directory);
            try (var files = Files.walk(directory)) {
                files.filter(Files::isRegularFile)
                    .filter(file -> filter.isIncluded(root.relativize(file)))
                    .forEach(this::emitExisting);
            }
        } catch (IOException e) {
            LoggingUtils.warnBrief(log, directory, "Cannot watch new directory", e);
        }
    }

    private void emitExisting(Path file) {
        try {
            coalescer.accept(FileEvent.added(file, FileStat.of(file)));
        } catch (IOException e) {
            log.debug("{} vanished before it could be stat'ed", file);
        }
    }

    private void registerTree(Path start) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (!dir.equals(root) && filter.isIgnoredDirectory(root.relativize(dir))) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                WatchKey key = dir.register(watchService, ENTRY_CREATE, ENTRY_DELETE, ENTRY_MODIFY);
                keyToDir.put(key, dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void closeQuietly() {
        WatchService service = watchService;
        if (service == null) {
            return;
        }
        try {
            service.close();
        } catch (IOException e) {
            log.debug("Error closing watch service: {}", e.getMessage());
        }
        keyToDir.clear();
    }
}
