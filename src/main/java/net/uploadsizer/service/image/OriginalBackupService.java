package net.uploadsizer.service.image;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import lombok.extern.slf4j.Slf4j;
import net.uploadsizer.util.image.DerivedFileNames;
import org.springframework.stereotype.Component;

/**
 * Keeps an untouched copy of each source as {@code {file}.backup}, written once.
 */
@Slf4j
@Component
public class OriginalBackupService {

    /**
     * Copies the source to its backup path unless a backup already exists.
     *
     * @return {@code true} when a new backup was written
     */
    public boolean ensureBackup(Path source) throws IOException {
        Path backup = DerivedFileNames.backupPath(source);
        if (Files.exists(backup)) {
            return false;
        }
        Path temporary = DerivedFileNames.temporarySibling(backup);
        try {
            Files.copy(source, temporary, StandardCopyOption.COPY_ATTRIBUTES);
            Files.move(temporary, backup);
        } catch (FileAlreadyExistsException e) {
            log.debug("Backup for {} appeared concurrently; keeping the existing one", source);
            return false;
        } finally {
            Files.deleteIfExists(temporary);
        }
        log.debug("Backed up original {} to {}", source, backup.getFileName());
        return true;
    }
}
