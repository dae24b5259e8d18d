package net.uploadsizer.service.metadata;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.uploadsizer.model.image.AuxiliaryFormat;
import net.uploadsizer.model.image.CaptureMetadata;
import net.uploadsizer.model.image.DerivedVariant;
import net.uploadsizer.model.image.ProcessingResult;
import net.uploadsizer.model.image.SourceImage;
import org.springframework.stereotype.Component;

/**
 * Maps a {@link ProcessingResult} onto the WordPress {@code _wp_attachment_metadata} structure.
 */
@Component
public class AttachmentMetadataMapper {

    public Map<String, Object> toAttachmentMetadata(String relativePath, ProcessingResult result) {
        SourceImage source = result.sourceImage();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("width", source.pixelWidth());
        metadata.put("height", source.pixelHeight());
        metadata.put("file", relativePath);
        metadata.put("filesize", source.byteSize());

        Map<String, Object> sizes = new LinkedHashMap<>();
        for (DerivedVariant variant : result.variants()) {
            sizes.put(variant.sizeName(), size(variant));
        }
        metadata.put("sizes", sizes);
        metadata.put("image_meta", imageMeta(result.captureMetadata()));
        return metadata;
    }

    private Map<String, Object> size(DerivedVariant variant) {
        Map<String, Object> size = new LinkedHashMap<>();
        size.put("file", variant.filePath().getFileName().toString());
        size.put("width", variant.pixelWidth());
        size.put("height", variant.pixelHeight());
        size.put("mime-type", variant.mimeType());
        size.put("filesize", variant.byteSize());
        if (!variant.auxiliaryFormats().isEmpty()) {
            Map<String, Object> sources = new LinkedHashMap<>();
            for (AuxiliaryFormat format : variant.auxiliaryFormats()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("file", format.filePath().getFileName().toString());
                entry.put("filesize", format.byteSize());
                sources.put(format.format(), List.of(entry));
            }
            size.put("sources", sources);
        }
        return size;
    }

    private Map<String, Object> imageMeta(CaptureMetadata capture) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("aperture", capture.aperture());
        meta.put("credit", capture.credit());
        meta.put("camera", capture.camera());
        meta.put("caption", capture.caption());
        meta.put("created_timestamp", capture.createdTimestamp());
        meta.put("copyright", capture.copyright());
        meta.put("focal_length", capture.focalLength());
        meta.put("iso", capture.iso());
        meta.put("shutter_speed", capture.shutterSpeed());
        meta.put("title", capture.title());
        meta.put("orientation", capture.orientation());
        meta.put("keywords", List.of());
        return meta;
    }
}
