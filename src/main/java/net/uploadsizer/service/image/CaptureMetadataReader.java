package net.uploadsizer.service.image;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import net.uploadsizer.model.image.CaptureMetadata;
import org.apache.commons.imaging.Imaging;
import org.apache.commons.imaging.common.ImageMetadata;
import org.apache.commons.imaging.formats.jpeg.JpegImageMetadata;
import org.apache.commons.imaging.formats.tiff.TiffField;
import org.apache.commons.imaging.formats.tiff.constants.ExifTagConstants;
import org.apache.commons.imaging.formats.tiff.constants.TiffTagConstants;
import org.apache.commons.imaging.formats.tiff.taginfos.TagInfo;
import org.springframework.stereotype.Component;

/**
 * Reads EXIF capture details with Apache Commons Imaging.
 *
 * <p>Only JPEG sources carry EXIF here. Anything unreadable falls back to the defaults, with the
 * file's creation time as the timestamp.</p>
 */
@Slf4j
@Component
public class CaptureMetadataReader {

    private static final DateTimeFormatter EXIF_DATE = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");

    public CaptureMetadata read(Path source, long createdEpochSeconds) {
        ImageMetadata metadata;
        try {
            metadata = Imaging.getMetadata(source.toFile());
        } catch (IOException | RuntimeException e) {
            log.debug("No readable metadata in {}: {}", source, e.getMessage());
            return CaptureMetadata.createdAt(createdEpochSeconds);
        }
        if (!(metadata instanceof JpegImageMetadata jpeg)) {
            return CaptureMetadata.createdAt(createdEpochSeconds);
        }

        String created = exifTimestamp(jpeg).map(String::valueOf).orElse(Long.toString(createdEpochSeconds));
        return new CaptureMetadata(
            decimal(jpeg, ExifTagConstants.EXIF_TAG_FNUMBER),
            text(jpeg, TiffTagConstants.TIFF_TAG_ARTIST),
            camera(jpeg),
            text(jpeg, TiffTagConstants.TIFF_TAG_IMAGE_DESCRIPTION),
            created,
            text(jpeg, TiffTagConstants.TIFF_TAG_COPYRIGHT),
            decimal(jpeg, ExifTagConstants.EXIF_TAG_FOCAL_LENGTH),
            integer(jpeg, ExifTagConstants.EXIF_TAG_ISO),
            decimal(jpeg, ExifTagConstants.EXIF_TAG_EXPOSURE_TIME),
            null,
            integer(jpeg, TiffTagConstants.TIFF_TAG_ORIENTATION)
        );
    }

    private String camera(JpegImageMetadata jpeg) {
        List<String> parts = new ArrayList<>(2);
        String make = text(jpeg, TiffTagConstants.TIFF_TAG_MAKE);
        String model = text(jpeg, TiffTagConstants.TIFF_TAG_MODEL);
        if (make != null) {
            parts.add(make);
        }
        if (model != null && (make == null || !model.startsWith(make))) {
            parts.add(model);
        }
        return parts.isEmpty() ? null : String.join(" ", parts);
    }

    private Optional<Long> exifTimestamp(JpegImageMetadata jpeg) {
        String raw = text(jpeg, ExifTagConstants.EXIF_TAG_DATE_TIME_ORIGINAL);
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDateTime.parse(raw, EXIF_DATE).toEpochSecond(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            log.debug("Unparseable EXIF DateTimeOriginal '{}'", raw);
            return Optional.empty();
        }
    }

    private TiffField field(JpegImageMetadata jpeg, TagInfo tag) {
        try {
            return jpeg.findExifValueWithExactMatch(tag);
        } catch (RuntimeException e) {
            log.trace("EXIF lookup for {} failed: {}", tag.name, e.getMessage());
            return null;
        }
    }

    private String text(JpegImageMetadata jpeg, TagInfo tag) {
        TiffField field = field(jpeg, tag);
        if (field == null) {
            return null;
        }
        try {
            String value = field.getStringValue();
            return value == null || value.isBlank() ? null : value.trim();
        } catch (Exception e) {
            log.trace("Unreadable {} value: {}", tag.name, e.getMessage());
            return null;
        }
    }

    private String decimal(JpegImageMetadata jpeg, TagInfo tag) {
        TiffField field = field(jpeg, tag);
        if (field == null) {
            return null;
        }
        try {
            double value = field.getDoubleValue();
            return value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value);
        } catch (Exception e) {
            log.trace("Unreadable {} value: {}", tag.name, e.getMessage());
            return null;
        }
    }

    private String integer(JpegImageMetadata jpeg, TagInfo tag) {
        TiffField field = field(jpeg, tag);
        if (field == null) {
            return null;
        }
        try {
            return Integer.toString(field.getIntValue());
        } catch (Exception e) {
            log.trace("Unreadable {} value: {}", tag.name, e.getMessage());
            return null;
        }
    }
}
