package net.uploadsizer.service.image;

import java.awt.image.BufferedImage;
import java.io.IOException;
import net.coobird.thumbnailator.Thumbnails;
import net.coobird.thumbnailator.geometry.Positions;
import net.uploadsizer.model.image.PlannedVariant;
import org.springframework.stereotype.Component;

/**
 * Resamples a decoded source to a planned variant's dimensions with Thumbnailator.
 */
@Component
public class ImageResizer {

    /**
     * Crop variants are scaled to cover the box and center-cropped; fit variants are scaled to exactly the
     * planned dimensions, which already preserve the aspect ratio.
     */
    public BufferedImage resize(BufferedImage source, PlannedVariant variant) throws IOException {
        Thumbnails.Builder<BufferedImage> builder = Thumbnails.of(source);
        if (variant.crop()) {
            builder.size(variant.width(), variant.height()).crop(Positions.CENTER);
        } else {
            builder.forceSize(variant.width(), variant.height());
        }
        return builder.asBufferedImage();
    }
}
