package net.uploadsizer.service.image;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.Set;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.plugins.jpeg.JPEGImageWriteParam;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import net.uploadsizer.exception.ImageDecodeException;
import net.uploadsizer.model.image.DecodeFailureReason;
import net.uploadsizer.model.image.DerivationOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link ImageCodec} backed by the ImageIO plugin registry.
 *
 * Features:
 * - Decodes every format with a registered reader (JPEG, PNG, GIF, BMP, TIFF, and WebP through webp-imageio)
 * - JPEG output with explicit quality, optional progressive scan and optimized Huffman tables
 * - Flattens alpha onto RGB for containers that cannot store it
 * - Lossy modern formats (WebP, AVIF when a writer is installed) at the configured quality
 * - TIFF with LZW compression; PNG, GIF and BMP with the writer defaults
 */
@Component
public class ImageIoCodec implements ImageCodec {

    private static final Logger logger = LoggerFactory.getLogger(ImageIoCodec.class);
    private static final Set<String> OPAQUE_FORMATS = Set.of("jpeg", "jpg", "bmp");
    private static final Set<String> LOSSY_FORMATS = Set.of("webp", "avif");

    public ImageIoCodec() {
        ImageIO.scanForPlugins();
        ImageIO.setUseCache(false);
    }

    @Override
    public BufferedImage decode(Path source) throws IOException {
        BufferedImage image;
        try (ImageInputStream input = ImageIO.createImageInputStream(source.toFile())) {
            if (input == null) {
                throw new IOException("Cannot open image stream for " + source);
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                throw new ImageDecodeException(source, DecodeFailureReason.NO_READER);
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                image = reader.read(0);
            } catch (IOException | RuntimeException e) {
                throw new ImageDecodeException(source, DecodeFailureReason.CORRUPT, e);
            } finally {
                reader.dispose();
            }
        }
        if (image == null || image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new ImageDecodeException(source, DecodeFailureReason.EMPTY_IMAGE);
        }
        return image;
    }

    @Override
    public boolean isRecognized(Path source) throws IOException {
        try (ImageInputStream input = ImageIO.createImageInputStream(source.toFile())) {
            return input != null && ImageIO.getImageReaders(input).hasNext();
        }
    }

    @Override
    public boolean canEncode(String formatName) {
        return ImageIO.getImageWritersByFormatName(normalize(formatName)).hasNext();
    }

    @Override
    public void encode(BufferedImage image, String formatName, Path target, DerivationOptions options) throws IOException {
        String format = normalize(formatName);
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format);
        if (!writers.hasNext()) {
            throw new IOException("No ImageWriter available for format " + format);
        }
        ImageWriter writer = writers.next();
        BufferedImage prepared = OPAQUE_FORMATS.contains(format) ? flattenToRgb(image) : image;

        try (OutputStream out = Files.newOutputStream(target);
             ImageOutputStream imageOut = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(imageOut);
            ImageWriteParam param = writeParam(writer, format, options);
            writer.write(null, new IIOImage(prepared, null, null), param);
            imageOut.flush();
        } finally {
            writer.dispose();
        }
        logger.debug("Encoded {}x{} {} to {}", prepared.getWidth(), prepared.getHeight(), format, target);
    }

    private ImageWriteParam writeParam(ImageWriter writer, String format, DerivationOptions options) {
        ImageWriteParam param = writer.getDefaultWriteParam();
        if ("jpeg".equals(format)) {
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(options.jpegQuality() / 100.0f);
            if (options.progressive() && param.canWriteProgressive()) {
                param.setProgressiveMode(ImageWriteParam.MODE_DEFAULT);
            }
            if (options.optimize() && param instanceof JPEGImageWriteParam jpegParam) {
                jpegParam.setOptimizeHuffmanTables(true);
            }
            return param;
        }
        if ("tiff".equals(format)) {
            return tiffParam(param);
        }
        if (LOSSY_FORMATS.contains(format) && param.canWriteCompressed()) {
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            String[] compressionTypes = param.getCompressionTypes();
            if (!preferCompressionType(param, "Lossy") && compressionTypes != null && compressionTypes.length > 0) {
                param.setCompressionType(compressionTypes[0]);
            }
            param.setCompressionQuality(options.qualityFor(format) / 100.0f);
        }
        // PNG, GIF and BMP keep the writer defaults.
        return param;
    }

    /**
     * LZW (or Deflate) works for any bit depth; the JDK writer lists bilevel-only CCITT schemes first.
     */
    private static ImageWriteParam tiffParam(ImageWriteParam param) {
        if (param.canWriteCompressed()) {
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            if (!preferCompressionType(param, "LZW") && !preferCompressionType(param, "Deflate")) {
                param.setCompressionMode(ImageWriteParam.MODE_DEFAULT);
            }
        }
        return param;
    }

    private static boolean preferCompressionType(ImageWriteParam param, String type) {
        String[] compressionTypes = param.getCompressionTypes();
        if (compressionTypes == null) {
            return false;
        }
        for (String candidate : compressionTypes) {
            if (candidate.equalsIgnoreCase(type)) {
                param.setCompressionType(candidate);
                return true;
            }
        }
        return false;
    }

    /**
     * Draws the image onto an opaque RGB canvas; transparent areas become black as in a plain JPEG export.
     */
    static BufferedImage flattenToRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        g.drawImage(image, 0, 0, null);
        g.dispose();
        return rgb;
    }

    private static String normalize(String formatName) {
        String lower = formatName.toLowerCase(Locale.ROOT);
        return switch (lower) {
            case "jpg" -> "jpeg";
            case "tif" -> "tiff";
            default -> lower;
        };
    }
}
