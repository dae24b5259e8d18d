package net.uploadsizer.util.image;

import java.util.ArrayList;
import java.util.List;
import net.uploadsizer.model.image.PlannedVariant;
import net.uploadsizer.model.image.SizeCatalog;
import net.uploadsizer.model.image.SizeSpec;

/**
 * Computes output dimensions for every catalog size with WordPress sizing semantics.
 *
 * <p>Rules, applied per size in catalog order:</p>
 * <ul>
 *   <li>Fit sizes the source already fits inside are skipped (no upscaling, no same-size copies).
 *       A bound of 0 counts as unbounded.</li>
 *   <li>Crop sizes with both bounds set produce exactly those bounds.</li>
 *   <li>Width-only, height-only and two-bound fits keep the source aspect ratio.</li>
 *   <li>Dimensions round half-up and never drop below 1 px.</li>
 * </ul>
 *
 * <p>Pure: no I/O and no shared state.</p>
 */
public final class VariantPlanner {

    private VariantPlanner() {
    }

    public static List<PlannedVariant> plan(int sourceWidth, int sourceHeight, SizeCatalog catalog) {
        if (sourceWidth <= 0 || sourceHeight <= 0) {
            throw new IllegalArgumentException(
                "Source dimensions must be positive, got %dx%d".formatted(sourceWidth, sourceHeight));
        }
        List<PlannedVariant> planned = new ArrayList<>(catalog.size());
        for (SizeSpec spec : catalog.specs()) {
            PlannedVariant variant = planOne(sourceWidth, sourceHeight, spec);
            if (variant != null) {
                planned.add(variant);
            }
        }
        return planned;
    }

    /**
     * Plans a single size.
     *
     * @return the planned variant, or {@code null} when the size is skipped
     */
    public static PlannedVariant planOne(int sourceWidth, int sourceHeight, SizeSpec spec) {
        if (spec.cropsExactly()) {
            return new PlannedVariant(spec, spec.maxWidth(), spec.maxHeight(), true);
        }
        if (fitsWithin(sourceWidth, sourceHeight, spec)) {
            return null;
        }

        double aspect = (double) sourceWidth / sourceHeight;
        int width;
        int height;
        if (spec.heightUnbounded()) {
            width = Math.min(spec.maxWidth(), sourceWidth);
            height = (int) Math.round(width / aspect);
        } else if (spec.widthUnbounded()) {
            height = Math.min(spec.maxHeight(), sourceHeight);
            width = (int) Math.round(height * aspect);
        } else {
            double ratio = Math.min(1.0, Math.min(
                (double) spec.maxWidth() / sourceWidth,
                (double) spec.maxHeight() / sourceHeight));
            width = (int) Math.round(sourceWidth * ratio);
            height = (int) Math.round(sourceHeight * ratio);
        }
        return new PlannedVariant(spec, Math.max(1, width), Math.max(1, height), false);
    }

    private static boolean fitsWithin(int sourceWidth, int sourceHeight, SizeSpec spec) {
        boolean widthFits = spec.widthUnbounded() || sourceWidth <= spec.maxWidth();
        boolean heightFits = spec.heightUnbounded() || sourceHeight <= spec.maxHeight();
        return widthFits && heightFits;
    }
}
