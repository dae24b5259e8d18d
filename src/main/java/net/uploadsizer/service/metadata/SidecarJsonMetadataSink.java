package net.uploadsizer.service.metadata;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import net.uploadsizer.config.PipelineProperties;
import net.uploadsizer.model.image.ProcessingResult;
import net.uploadsizer.model.pipeline.RecordId;
import net.uploadsizer.util.LoggingUtils;
import net.uploadsizer.util.image.DerivedFileNames;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Writes attachment metadata as pretty-printed JSON next to, but outside of, the uploads tree:
 * {@code {metadataDir}/{relativePath}.json}.
 *
 * <p>The record id is the source path relative to the uploads root. A record resolves only while its
 * source file exists.</p>
 */
@Slf4j
@Component
public class SidecarJsonMetadataSink implements MetadataSink {

    private final Path root;
    private final Path metadataDirectory;
    private final AttachmentMetadataMapper mapper;
    private final ObjectMapper objectMapper;

    @Autowired
    public SidecarJsonMetadataSink(PipelineProperties properties, AttachmentMetadataMapper mapper, ObjectMapper objectMapper) {
        this(properties.rootPath(), properties.metadataPath(), mapper, objectMapper);
    }

    SidecarJsonMetadataSink(Path root, Path metadataDirectory, AttachmentMetadataMapper mapper, ObjectMapper objectMapper) {
        this.root = root.toAbsolutePath().normalize();
        this.metadataDirectory = metadataDirectory.toAbsolutePath().normalize();
        this.mapper = mapper;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<RecordId> resolveRecordId(String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            return Optional.empty();
        }
        Path source = root.resolve(relativePath).normalize();
        if (!source.startsWith(root) || !Files.isRegularFile(source)) {
            return Optional.empty();
        }
        return Optional.of(new RecordId(root.relativize(source).toString().replace('\\', '/')));
    }

    @Override
    public boolean store(RecordId recordId, ProcessingResult result) {
        Path target = metadataDirectory.resolve(recordId.value() + ".json").normalize();
        if (!target.startsWith(metadataDirectory)) {
            log.error("Refusing to write metadata for {} outside {}", recordId, metadataDirectory);
            return false;
        }
        Map<String, Object> metadata = mapper.toAttachmentMetadata(recordId.value(), result);
        Path temporary = DerivedFileNames.temporarySibling(target);
        try {
            Files.createDirectories(target.getParent());
            Files.write(temporary, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(metadata));
            Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Stored attachment metadata for {} ({} sizes)", recordId, result.variants().size());
            return true;
        } catch (IOException | JacksonException e) {
            LoggingUtils.error(log, e, "Failed to store attachment metadata for {}", recordId);
            return false;
        } finally {
            deleteQuietly(temporary);
        }
    }

    private static void deleteQuietly(Path temporary) {
        try {
            Files.deleteIfExists(temporary);
        } catch (IOException e) {
            log.debug("Could not remove temporary metadata file {}: {}", temporary, e.getMessage());
        }
    }
}
