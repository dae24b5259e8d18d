package net.uploadsizer.model.pipeline;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Raw filesystem notification handed to the coalescer.
 *
 * @param kind event type
 * @param path absolute, normalized path
 * @param stat file stat for add and modify events; {@code null} for deletes
 */
public record FileEvent(FileEventKind kind, Path path, FileStat stat) {

    public FileEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(path, "path");
    }

    public static FileEvent added(Path path, FileStat stat) {
        return new FileEvent(FileEventKind.ADD, path, stat);
    }

    public static FileEvent modified(Path path, FileStat stat) {
        return new FileEvent(FileEventKind.MODIFY, path, stat);
    }

    public static FileEvent deleted(Path path) {
        return new FileEvent(FileEventKind.DELETE, path, null);
    }
}
