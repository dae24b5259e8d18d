package net.uploadsizer.service.image;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import net.uploadsizer.exception.ImageDecodeException;
import net.uploadsizer.exception.VariantDerivationException;
import net.uploadsizer.model.image.AuxiliaryFormat;
import net.uploadsizer.model.image.CaptureMetadata;
import net.uploadsizer.model.image.DecodeFailureReason;
import net.uploadsizer.model.image.DerivationOptions;
import net.uploadsizer.model.image.DerivedVariant;
import net.uploadsizer.model.image.ImageContainer;
import net.uploadsizer.model.image.PlannedVariant;
import net.uploadsizer.model.image.ProcessingResult;
import net.uploadsizer.model.image.SizeCatalog;
import net.uploadsizer.model.image.SourceImage;
import net.uploadsizer.model.image.VariantFailure;
import net.uploadsizer.util.LoggingUtils;
import net.uploadsizer.util.image.DerivedFileNames;
import net.uploadsizer.util.image.VariantPlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Derives every catalog size for one source image.
 *
 * Features:
 * - Decodes the source a single time and plans all sizes up front
 * - Backs up the untouched original once, after a successful decode and before any encode
 * - Writes each variant through a hidden temporary sibling, then moves it into place
 * - Adds WebP/AVIF siblings for every variant when enabled and a writer exists
 * - Encodes each distinct output file once, even when several sizes resolve to it
 * - Contains per-size failures so the remaining sizes still run
 */
@Service
public class DerivationEngine {

    private static final Logger logger = LoggerFactory.getLogger(DerivationEngine.class);

    private final ImageCodec codec;
    private final ImageResizer resizer;
    private final OriginalBackupService backupService;
    private final CaptureMetadataReader metadataReader;
    private final DerivationOptions options;
    private final List<String> auxiliaryFormats;

    public DerivationEngine(ImageCodec codec,
                            ImageResizer resizer,
                            OriginalBackupService backupService,
                            CaptureMetadataReader metadataReader,
                            DerivationOptions options) {
        this.codec = codec;
        this.resizer = resizer;
        this.backupService = backupService;
        this.metadataReader = metadataReader;
        this.options = options;
        this.auxiliaryFormats = resolveAuxiliaryFormats(codec, options);
    }

    /**
     * Derives all sizes of {@code catalog} for {@code source}.
     *
     * @throws ImageDecodeException when the source cannot be decoded; nothing is written in that case
     * @throws IOException when the source cannot be read or backed up
     */
    public ProcessingResult derive(Path source, SizeCatalog catalog) throws IOException {
        long startNanos = System.nanoTime();
        BasicFileAttributes attributes = Files.readAttributes(source, BasicFileAttributes.class);
        ImageContainer container = ImageContainer.fromPath(source)
            .orElseThrow(() -> new ImageDecodeException(source, DecodeFailureReason.NO_READER));

        BufferedImage decoded = codec.decode(source);
        if (options.backupOriginals()) {
            backupService.ensureBackup(source);
        }
        SourceImage sourceImage = new SourceImage(
            source,
            decoded.getWidth(),
            decoded.getHeight(),
            attributes.size(),
            attributes.creationTime().toInstant(),
            container
        );

        List<PlannedVariant> plan = VariantPlanner.plan(sourceImage.pixelWidth(), sourceImage.pixelHeight(), catalog);
        List<DerivedVariant> variants = new ArrayList<>(plan.size());
        List<VariantFailure> failures = new ArrayList<>();
        Map<Path, DerivedVariant> writtenByPath = new HashMap<>();

        for (PlannedVariant planned : plan) {
            Path target = DerivedFileNames.variantPath(source, planned.width(), planned.height());
            DerivedVariant existing = writtenByPath.get(target);
            if (existing != null) {
                logger.debug("Size '{}' resolves to {} already written for '{}'; reusing it",
                    planned.sizeName(), target.getFileName(), existing.sizeName());
                variants.add(existing.withSizeName(planned.sizeName()));
                continue;
            }
            try {
                DerivedVariant variant = deriveVariant(decoded, sourceImage, planned, target);
                writtenByPath.put(target, variant);
                variants.add(variant);
            } catch (VariantDerivationException e) {
                LoggingUtils.warnBrief(logger, source, "Size '" + planned.sizeName() + "' failed", e.getCause());
                failures.add(new VariantFailure(planned.sizeName(), LoggingUtils.describe(e.getCause())));
            }
        }

        CaptureMetadata captureMetadata = metadataReader.read(source, sourceImage.createdAt().getEpochSecond());
        long timingMs = (System.nanoTime() - startNanos) / 1_000_000L;
        logger.info("Derived {} of {} planned sizes for {} ({}x{}) in {} ms{}",
            variants.size(), plan.size(), source.getFileName(), sourceImage.pixelWidth(), sourceImage.pixelHeight(),
            timingMs, failures.isEmpty() ? "" : ", " + failures.size() + " failed");
        return new ProcessingResult(sourceImage, variants, failures, captureMetadata, timingMs);
    }

    private DerivedVariant deriveVariant(BufferedImage decoded,
                                         SourceImage sourceImage,
                                         PlannedVariant planned,
                                         Path target) {
        BufferedImage resized;
        long byteSize;
        try {
            resized = resizer.resize(decoded, planned);
            byteSize = writeAtomically(resized, sourceImage.container().getFormatName(), target);
        } catch (IOException | RuntimeException e) {
            throw new VariantDerivationException(planned.sizeName(), sourceImage.absolutePath(), e);
        }

        List<AuxiliaryFormat> extras = new ArrayList<>(auxiliaryFormats.size());
        for (String format : auxiliaryFormats) {
            if (format.equals(sourceImage.container().getFormatName())) {
                continue;
            }
            Path auxiliaryTarget = DerivedFileNames.variantPath(sourceImage.absolutePath(), planned.width(), planned.height(), format);
            try {
                long auxiliarySize = writeAtomically(resized, format, auxiliaryTarget);
                extras.add(new AuxiliaryFormat(format, auxiliaryTarget, auxiliarySize));
            } catch (IOException | RuntimeException e) {
                LoggingUtils.warnBrief(logger, auxiliaryTarget, "Skipping " + format + " sibling", e);
            }
        }

        return new DerivedVariant(
            planned.sizeName(),
            target,
            resized.getWidth(),
            resized.getHeight(),
            sourceImage.container().getMimeType(),
            byteSize,
            extras
        );
    }

    private long writeAtomically(BufferedImage image, String formatName, Path target) throws IOException {
        Path temporary = DerivedFileNames.temporarySibling(target);
        try {
            codec.encode(image, formatName, temporary, options);
            Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temporary);
        }
        return Files.size(target);
    }

    private static List<String> resolveAuxiliaryFormats(ImageCodec codec, DerivationOptions options) {
        List<String> formats = new ArrayList<>();
        for (String format : options.modernFormats()) {
            if (codec.canEncode(format)) {
                formats.add(format);
            } else {
                logger.warn("{} output is enabled but no ImageIO writer is installed; {} siblings will not be written",
                    format.toUpperCase(Locale.ROOT), format);
            }
        }
        return List.copyOf(formats);
    }
}
