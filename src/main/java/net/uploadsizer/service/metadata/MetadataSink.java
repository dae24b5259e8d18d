package net.uploadsizer.service.metadata;

import java.util.Optional;
import net.uploadsizer.model.image.ProcessingResult;
import net.uploadsizer.model.pipeline.RecordId;

/**
 * Destination for derivation results, keyed by the media record of the source file.
 */
public interface MetadataSink {

    /**
     * Looks up the record for a source path relative to the uploads root (forward slashes).
     */
    Optional<RecordId> resolveRecordId(String relativePath);

    /**
     * Stores the result against the record.
     *
     * @return {@code false} when the sink rejected the write
     */
    boolean store(RecordId recordId, ProcessingResult result);
}
