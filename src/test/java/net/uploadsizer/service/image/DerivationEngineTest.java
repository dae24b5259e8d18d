package net.uploadsizer.service.image;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.stream.Stream;
import net.uploadsizer.exception.ImageDecodeException;
import net.uploadsizer.model.image.CatalogSource;
import net.uploadsizer.model.image.DerivationOptions;
import net.uploadsizer.model.image.DerivedVariant;
import net.uploadsizer.model.image.ProcessingResult;
import net.uploadsizer.model.image.SizeCatalog;
import net.uploadsizer.model.image.SizeSpec;
import net.uploadsizer.testsupport.TestImages;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class DerivationEngineTest {

    private static final DerivationOptions NO_MODERN_FORMATS = DerivationOptions.defaults().withModernFormats(false, false);

    @TempDir
    Path uploads;

    private static SizeCatalog catalog(SizeSpec... specs) {
        return SizeCatalog.of(List.of(specs), Instant.EPOCH, CatalogSource.PROVIDER);
    }

    private static DerivationEngine engine(ImageCodec codec, DerivationOptions options) {
        return new DerivationEngine(codec, new ImageResizer(), new OriginalBackupService(), new CaptureMetadataReader(), options);
    }

    @Test
    void should_WriteCropAndFitVariants_When_SourceIsLargeJpeg() throws Exception {
        Path source = TestImages.writeJpeg(uploads.resolve("name.jpg"), 4000, 3000);
        DerivationEngine engine = engine(new ImageIoCodec(), NO_MODERN_FORMATS);

        ProcessingResult result = engine.derive(source, catalog(
            SizeSpec.cropped("thumb", 150, 150),
            SizeSpec.fit("medium", 300, 300)));

        assertThat(result.variantFailures()).isEmpty();
        assertThat(result.variantsBySize().keySet()).containsExactly("thumb", "medium");
        DerivedVariant thumb = result.variantsBySize().get("thumb");
        DerivedVariant medium = result.variantsBySize().get("medium");
        assertThat(thumb.filePath()).isEqualTo(uploads.resolve("name-150x150.jpg"));
        assertThat(medium.filePath()).isEqualTo(uploads.resolve("name-300x225.jpg"));
        assertThat(TestImages.dimensions(thumb.filePath())).containsExactly(150, 150);
        assertThat(TestImages.dimensions(medium.filePath())).containsExactly(300, 225);
        assertThat(medium.mimeType()).isEqualTo("image/jpeg");
        assertThat(medium.byteSize()).isEqualTo(Files.size(medium.filePath()));
        assertThat(result.sourceImage().pixelWidth()).isEqualTo(4000);
        assertThat(result.sourceImage().pixelHeight()).isEqualTo(3000);
        assertThat(result.sourceImage().byteSize()).isEqualTo(Files.size(source));
    }

    @Test
    void should_ProduceNoVariants_When_SourceSmallerThanEveryFitSize() throws Exception {
        Path source = TestImages.writePng(uploads.resolve("small.png"), 100, 100);
        DerivationEngine engine = engine(new ImageIoCodec(), NO_MODERN_FORMATS);

        ProcessingResult result = engine.derive(source, catalog(SizeSpec.fit("medium", 300, 300)));

        assertThat(result.variants()).isEmpty();
        assertThat(result.variantFailures()).isEmpty();
        assertThat(derivedFiles()).isEmpty();
    }

    @Test
    void should_KeepOtherSizes_When_OneSizeFailsToEncode() throws Exception {
        Path source = TestImages.writeJpeg(uploads.resolve("name.jpg"), 4000, 3000);
        FakeCodec codec = new FakeCodec(target -> target.getFileName().toString().contains("-300x225."));
        DerivationEngine engine = engine(codec, NO_MODERN_FORMATS);

        ProcessingResult result = engine.derive(source, catalog(
            SizeSpec.cropped("thumb", 150, 150),
            SizeSpec.fit("medium", 300, 300)));

        assertThat(result.variants()).extracting(DerivedVariant::sizeName).containsExactly("thumb");
        assertThat(result.variantFailures()).hasSize(1);
        assertThat(result.variantFailures().get(0).sizeName()).isEqualTo("medium");
        assertThat(result.variantFailures().get(0).message()).contains("synthetic");
        assertThat(uploads.resolve("name-300x225.jpg")).doesNotExist();
        assertThat(derivedFiles()).noneMatch(path -> path.getFileName().toString().contains(".tmp-"));
    }

    @Test
    void should_EncodeOnce_When_TwoSizesResolveToSameDimensions() throws Exception {
        Path source = TestImages.writeJpeg(uploads.resolve("name.jpg"), 800, 600);
        FakeCodec codec = new FakeCodec(target -> false);
        DerivationEngine engine = engine(codec, NO_MODERN_FORMATS);

        ProcessingResult result = engine.derive(source, catalog(
            SizeSpec.fit("medium", 300, 300),
            SizeSpec.fit("medium_by_width", 300, 0)));

        assertThat(result.variants()).extracting(DerivedVariant::sizeName).containsExactly("medium", "medium_by_width");
        assertThat(result.variants()).extracting(DerivedVariant::filePath).containsOnly(uploads.resolve("name-300x225.jpg"));
        assertThat(codec.encodes.get("jpeg").get()).isEqualTo(1);
    }

    @Test
    void should_FailWholeDerivation_When_SourceCannotBeDecoded() throws Exception {
        Path source = uploads.resolve("broken.jpg");
        Files.write(source, new byte[] {1, 2, 3, 4, 5, 6, 7, 8, 9, 10});
        DerivationEngine engine = engine(new ImageIoCodec(), NO_MODERN_FORMATS.withBackupOriginals(false));

        assertThatThrownBy(() -> engine.derive(source, SizeCatalog.defaults(Instant.EPOCH)))
            .isInstanceOf(ImageDecodeException.class)
            .hasMessageContaining("broken.jpg");
        assertThat(derivedFiles()).isEmpty();
    }

    @Test
    void should_CompressPngVariants_When_SourceIsPng() throws Exception {
        Path source = TestImages.writePng(uploads.resolve("flat.png"), 2000, 1500);
        DerivationEngine engine = engine(new ImageIoCodec(), NO_MODERN_FORMATS);

        ProcessingResult result = engine.derive(source, catalog(SizeSpec.fit("large", 1024, 1024)));

        DerivedVariant large = result.variantsBySize().get("large");
        long rawArgbBytes = 1024L * 768L * 4L;
        assertThat(TestImages.dimensions(large.filePath())).containsExactly(1024, 768);
        assertThat(large.byteSize()).isLessThan(rawArgbBytes / 20);
    }

    @Nested
    class SourceFormats {

        @ParameterizedTest(name = "{0} source")
        @CsvSource({
            "jpg,  jpg,  image/jpeg",
            "png,  png,  image/png",
            "gif,  gif,  image/gif",
            "bmp,  bmp,  image/bmp",
            "tif,  tiff, image/tiff",
            "tiff, tiff, image/tiff",
            "webp, webp, image/webp"
        })
        void should_DeriveEverySize_When_SourceUsesSupportedContainer(String extension,
                                                                      String writerFormat,
                                                                      String mimeType) throws Exception {
            assumeTrue(TestImages.canWrite(writerFormat), "no ImageIO writer for " + writerFormat);
            Path source = TestImages.write(uploads.resolve("scan." + extension), 400, 300, writerFormat);
            DerivationEngine engine = engine(new ImageIoCodec(), NO_MODERN_FORMATS.withBackupOriginals(false));

            ProcessingResult result = engine.derive(source, catalog(
                SizeSpec.cropped("thumb", 150, 150),
                SizeSpec.fit("medium", 200, 200)));

            assertThat(result.variantFailures()).isEmpty();
            DerivedVariant thumb = result.variantsBySize().get("thumb");
            DerivedVariant medium = result.variantsBySize().get("medium");
            assertThat(thumb.filePath()).isEqualTo(uploads.resolve("scan-150x150." + extension));
            assertThat(medium.filePath()).isEqualTo(uploads.resolve("scan-200x150." + extension));
            assertThat(TestImages.dimensions(thumb.filePath())).containsExactly(150, 150);
            assertThat(TestImages.dimensions(medium.filePath())).containsExactly(200, 150);
            assertThat(medium.mimeType()).isEqualTo(mimeType);
            assertThat(medium.byteSize()).isPositive();
        }
    }

    @Nested
    class OriginalBackup {

        @Test
        void should_BackUpOriginalOnce_When_DerivingTwice() throws Exception {
            Path source = TestImages.writeJpeg(uploads.resolve("keep.jpg"), 400, 300);
            byte[] original = Files.readAllBytes(source);
            DerivationEngine engine = engine(new ImageIoCodec(), NO_MODERN_FORMATS);
            SizeCatalog sizes = catalog(SizeSpec.fit("medium", 300, 300));

            engine.derive(source, sizes);
            TestImages.writeJpeg(source, 500, 400);
            engine.derive(source, sizes);

            Path backup = uploads.resolve("keep.jpg.backup");
            assertThat(backup).exists();
            assertThat(Files.readAllBytes(backup)).isEqualTo(original);
        }

        @Test
        void should_LeaveNoBackup_When_SourceCannotBeDecoded() throws Exception {
            Path source = uploads.resolve("truncated.jpg");
            Files.write(source, new byte[] {1, 2, 3, 4, 5, 6, 7, 8, 9, 10});
            DerivationEngine engine = engine(new ImageIoCodec(), NO_MODERN_FORMATS);

            assertThatThrownBy(() -> engine.derive(source, catalog(SizeSpec.fit("medium", 300, 300))))
                .isInstanceOf(ImageDecodeException.class);

            assertThat(uploads.resolve("truncated.jpg.backup")).doesNotExist();
        }

        @Test
        void should_SkipBackup_When_Disabled() throws Exception {
            Path source = TestImages.writeJpeg(uploads.resolve("nobackup.jpg"), 400, 300);
            DerivationEngine engine = engine(new ImageIoCodec(), NO_MODERN_FORMATS.withBackupOriginals(false));

            engine.derive(source, catalog(SizeSpec.fit("medium", 300, 300)));

            assertThat(uploads.resolve("nobackup.jpg.backup")).doesNotExist();
        }
    }

    @Nested
    class ModernFormats {

        @Test
        void should_RecordWebpSibling_When_WriterAvailable() throws Exception {
            Path source = TestImages.writeJpeg(uploads.resolve("modern.jpg"), 800, 600);
            DerivationEngine engine = engine(new FakeCodec(target -> false), NO_MODERN_FORMATS.withModernFormats(true, false));

            ProcessingResult result = engine.derive(source, catalog(SizeSpec.fit("medium", 300, 300)));

            DerivedVariant medium = result.variantsBySize().get("medium");
            assertThat(medium.auxiliaryFormats()).hasSize(1);
            assertThat(medium.auxiliaryFormats().get(0).format()).isEqualTo("webp");
            assertThat(medium.auxiliaryFormats().get(0).filePath()).isEqualTo(uploads.resolve("modern-300x225.webp"));
            assertThat(medium.auxiliaryFormats().get(0).byteSize()).isPositive();
        }

        @Test
        void should_KeepVariant_When_WebpSiblingFails() throws Exception {
            Path source = TestImages.writeJpeg(uploads.resolve("modern.jpg"), 800, 600);
            FakeCodec codec = new FakeCodec(target -> target.getFileName().toString().contains(".webp"));
            DerivationEngine engine = engine(codec, NO_MODERN_FORMATS.withModernFormats(true, false));

            ProcessingResult result = engine.derive(source, catalog(SizeSpec.fit("medium", 300, 300)));

            assertThat(result.variantFailures()).isEmpty();
            assertThat(result.variantsBySize().get("medium").auxiliaryFormats()).isEmpty();
            assertThat(uploads.resolve("modern-300x225.jpg")).exists();
        }

        @Test
        void should_SkipAvif_When_NoWriterInstalled() throws Exception {
            Path source = TestImages.writeJpeg(uploads.resolve("modern.jpg"), 800, 600);
            DerivationEngine engine = engine(new FakeCodec(target -> false), NO_MODERN_FORMATS.withModernFormats(false, true));

            ProcessingResult result = engine.derive(source, catalog(SizeSpec.fit("medium", 300, 300)));

            assertThat(result.variantsBySize().get("medium").auxiliaryFormats()).isEmpty();
            assertThat(uploads.resolve("modern-300x225.avif")).doesNotExist();
        }
    }

    private List<Path> derivedFiles() throws IOException {
        try (Stream<Path> files = Files.list(uploads)) {
            return files.filter(path -> path.getFileName().toString().matches(".*-\\d+x\\d+\\..*")
                    || path.getFileName().toString().contains(".tmp-"))
                .toList();
        }
    }

    /**
     * Real ImageIO codec that pretends WebP is available (writing PNG bytes) and fails selected targets.
     */
    private static final class FakeCodec implements ImageCodec {

        private final ImageIoCodec delegate = new ImageIoCodec();
        private final Predicate<Path> failOn;
        private final Map<String, AtomicInteger> encodes = new ConcurrentHashMap<>();

        private FakeCodec(Predicate<Path> failOn) {
            this.failOn = failOn;
        }

        @Override
        public BufferedImage decode(Path source) throws IOException {
            return delegate.decode(source);
        }

        @Override
        public boolean isRecognized(Path source) throws IOException {
            return delegate.isRecognized(source);
        }

        @Override
        public boolean canEncode(String formatName) {
            return "webp".equals(formatName) || (!"avif".equals(formatName) && delegate.canEncode(formatName));
        }

        @Override
        public void encode(BufferedImage image, String formatName, Path target, DerivationOptions options) throws IOException {
            encodes.computeIfAbsent(formatName, key -> new AtomicInteger()).incrementAndGet();
            if (failOn.test(target)) {
                throw new IOException("synthetic encode failure");
            }
            delegate.encode(image, "webp".equals(formatName) ? "png" : formatName, target, options);
        }
    }
}
