package net.uploadsizer.application.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import net.uploadsizer.exception.ImageDecodeException;
import net.uploadsizer.model.image.CaptureMetadata;
import net.uploadsizer.model.image.DecodeFailureReason;
import net.uploadsizer.model.image.DerivedVariant;
import net.uploadsizer.model.image.ImageContainer;
import net.uploadsizer.model.image.ProcessingResult;
import net.uploadsizer.model.image.SizeCatalog;
import net.uploadsizer.model.image.SourceImage;
import net.uploadsizer.model.image.VariantFailure;
import net.uploadsizer.model.pipeline.FileOutcome;
import net.uploadsizer.model.pipeline.FileStat;
import net.uploadsizer.model.pipeline.FileState;
import net.uploadsizer.model.pipeline.ProcessingIntent;
import net.uploadsizer.model.pipeline.RecordId;
import net.uploadsizer.service.catalog.SizeCatalogService;
import net.uploadsizer.service.image.DerivationEngine;
import net.uploadsizer.service.image.ImageCodec;
import net.uploadsizer.service.metadata.MetadataSink;
import net.uploadsizer.service.stats.PipelineCounters;
import net.uploadsizer.support.concurrency.ConcurrencyLimiter;
import net.uploadsizer.support.watch.EventCoalescer;
import net.uploadsizer.testsupport.TestImages;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PipelineCoordinatorTest {

    @TempDir
    Path root;

    @Mock
    private DerivationEngine engine;

    @Mock
    private ImageCodec codec;

    @Mock
    private EventCoalescer coalescer;

    @Mock
    private SizeCatalogService catalogService;

    @Mock
    private MetadataSink metadataSink;

    private final SizeCatalog catalog = SizeCatalog.defaults(Instant.EPOCH);
    private PipelineCounters counters;
    private ConcurrencyLimiter limiter;
    private PipelineCoordinator coordinator;

    @BeforeEach
    void setUp() {
        counters = new PipelineCounters();
        limiter = new ConcurrencyLimiter(2);
        coordinator = new PipelineCoordinator(engine, codec, limiter, coalescer, catalogService, metadataSink, counters, root);
    }

    @AfterEach
    void tearDown() {
        limiter.shutdown(Duration.ofSeconds(2));
    }

    @Test
    void should_StoreMetadataAndCountProcessed_When_DerivationSucceeds() throws Exception {
        Path source = TestImages.writeJpeg(root.resolve("2024/05/photo.jpg"), 800, 600);
        ProcessingResult result = result(source, List.of());
        RecordId recordId = new RecordId("2024/05/photo.jpg");
        when(codec.isRecognized(source)).thenReturn(true);
        when(catalogService.current()).thenReturn(catalog);
        when(engine.derive(source, catalog)).thenReturn(result);
        when(metadataSink.resolveRecordId("2024/05/photo.jpg")).thenReturn(Optional.of(recordId));
        when(metadataSink.store(recordId, result)).thenReturn(true);
        ProcessingIntent intent = intent(source);

        FileOutcome outcome = coordinator.handle(intent).get(5, TimeUnit.SECONDS);

        assertThat(outcome.state()).isEqualTo(FileState.COMPLETED);
        assertThat(outcome.result()).isSameAs(result);
        assertThat(counters.processed()).isEqualTo(1);
        assertThat(counters.errored()).isZero();
        verify(metadataSink).store(recordId, result);
        verify(coalescer, times(1)).release(intent);
        assertThat(coordinator.outstandingCount()).isZero();
    }

    @Test
    void should_CountEachFailedSize_When_DerivationIsPartial() throws Exception {
        Path source = TestImages.writeJpeg(root.resolve("partial.jpg"), 800, 600);
        ProcessingResult result = result(source, List.of(new VariantFailure("large", "disk full")));
        when(codec.isRecognized(source)).thenReturn(true);
        when(catalogService.current()).thenReturn(catalog);
        when(engine.derive(source, catalog)).thenReturn(result);
        when(metadataSink.resolveRecordId("partial.jpg")).thenReturn(Optional.of(new RecordId("partial.jpg")));
        when(metadataSink.store(any(), eq(result))).thenReturn(true);

        FileOutcome outcome = coordinator.handle(intent(source)).get(5, TimeUnit.SECONDS);

        assertThat(outcome.state()).isEqualTo(FileState.COMPLETED);
        assertThat(counters.processed()).isEqualTo(1);
        assertThat(counters.errored()).isEqualTo(1);
    }

    @Test
    void should_FailWithoutStoring_When_SourceCannotBeDecoded() throws Exception {
        Path source = TestImages.writeJpeg(root.resolve("broken.jpg"), 10, 10);
        when(codec.isRecognized(source)).thenReturn(true);
        when(catalogService.current()).thenReturn(catalog);
        when(engine.derive(source, catalog)).thenThrow(new ImageDecodeException(source, DecodeFailureReason.CORRUPT));
        ProcessingIntent intent = intent(source);

        FileOutcome outcome = coordinator.handle(intent).get(5, TimeUnit.SECONDS);

        assertThat(outcome.state()).isEqualTo(FileState.FAILED);
        assertThat(counters.errored()).isEqualTo(1);
        assertThat(counters.processed()).isZero();
        verifyNoInteractions(metadataSink);
        verify(coalescer).release(intent);
    }

    @Test
    void should_FailAndRelease_When_DerivationThrowsError() throws Exception {
        Path source = TestImages.writeJpeg(root.resolve("huge.jpg"), 64, 64);
        when(codec.isRecognized(source)).thenReturn(true);
        when(catalogService.current()).thenReturn(catalog);
        when(engine.derive(source, catalog)).thenThrow(new OutOfMemoryError("synthetic heap exhaustion"));
        ProcessingIntent intent = intent(source);

        FileOutcome outcome = coordinator.handle(intent).get(5, TimeUnit.SECONDS);

        assertThat(outcome.state()).isEqualTo(FileState.FAILED);
        assertThat(outcome.reason()).contains("synthetic heap exhaustion");
        assertThat(counters.errored()).isEqualTo(1);
        assertThat(coordinator.outstandingCount()).isZero();
        assertThat(coordinator.awaitDrain(Duration.ofMillis(100))).isTrue();
        verify(coalescer).release(intent);
        verifyNoInteractions(metadataSink);
    }

    @Test
    void should_Skip_When_FileVanishedBeforeProcessing() throws Exception {
        Path source = root.resolve("gone.jpg");
        ProcessingIntent intent = new ProcessingIntent(source, new FileStat(100, Instant.EPOCH), 1L, Instant.now());

        FileOutcome outcome = coordinator.handle(intent).get(5, TimeUnit.SECONDS);

        assertThat(outcome.state()).isEqualTo(FileState.SKIPPED);
        assertThat(outcome.reason()).contains("no longer exists");
        assertThat(counters.skipped()).isEqualTo(1);
        verifyNoInteractions(engine, metadataSink);
        verify(coalescer).release(intent);
    }

    @Test
    void should_Skip_When_FileIsEmptyAtRecheck() throws Exception {
        Path source = Files.createFile(root.resolve("empty.jpg"));

        FileOutcome outcome = coordinator.handle(intent(source)).get(5, TimeUnit.SECONDS);

        assertThat(outcome.state()).isEqualTo(FileState.SKIPPED);
        assertThat(outcome.reason()).isEqualTo("file is empty");
        verifyNoInteractions(codec, engine);
    }

    @Test
    void should_Skip_When_ContentIsNotRecognized() throws Exception {
        Path source = root.resolve("notes.jpg");
        Files.writeString(source, "not an image");
        when(codec.isRecognized(source)).thenReturn(false);

        FileOutcome outcome = coordinator.handle(intent(source)).get(5, TimeUnit.SECONDS);

        assertThat(outcome.state()).isEqualTo(FileState.SKIPPED);
        verifyNoInteractions(engine);
    }

    @Test
    void should_Skip_When_FileDisappearsDuringDerivation() throws Exception {
        Path source = TestImages.writeJpeg(root.resolve("race.jpg"), 50, 50);
        when(codec.isRecognized(source)).thenReturn(true);
        when(catalogService.current()).thenReturn(catalog);
        when(engine.derive(source, catalog)).thenThrow(new NoSuchFileException(source.toString()));

        FileOutcome outcome = coordinator.handle(intent(source)).get(5, TimeUnit.SECONDS);

        assertThat(outcome.state()).isEqualTo(FileState.SKIPPED);
        assertThat(counters.skipped()).isEqualTo(1);
        assertThat(counters.errored()).isZero();
    }

    @Test
    void should_CompleteAndKeepFiles_When_NoMediaRecordExists() throws Exception {
        Path source = TestImages.writeJpeg(root.resolve("orphan.jpg"), 400, 300);
        ProcessingResult result = result(source, List.of());
        when(codec.isRecognized(source)).thenReturn(true);
        when(catalogService.current()).thenReturn(catalog);
        when(engine.derive(source, catalog)).thenReturn(result);
        when(metadataSink.resolveRecordId("orphan.jpg")).thenReturn(Optional.empty());

        FileOutcome outcome = coordinator.handle(intent(source)).get(5, TimeUnit.SECONDS);

        assertThat(outcome.state()).isEqualTo(FileState.COMPLETED);
        verify(metadataSink, never()).store(any(), any());
    }

    @Test
    void should_StillComplete_When_SinkRejectsWrite() throws Exception {
        Path source = TestImages.writeJpeg(root.resolve("rejected.jpg"), 400, 300);
        ProcessingResult result = result(source, List.of());
        RecordId recordId = new RecordId("rejected.jpg");
        when(codec.isRecognized(source)).thenReturn(true);
        when(catalogService.current()).thenReturn(catalog);
        when(engine.derive(source, catalog)).thenReturn(result);
        when(metadataSink.resolveRecordId("rejected.jpg")).thenReturn(Optional.of(recordId));
        when(metadataSink.store(recordId, result)).thenReturn(false);

        FileOutcome outcome = coordinator.handle(intent(source)).get(5, TimeUnit.SECONDS);

        assertThat(outcome.state()).isEqualTo(FileState.COMPLETED);
        assertThat(counters.processed()).isEqualTo(1);
    }

    @Test
    void should_ReleaseAndSkip_When_LimiterAlreadyShutDown() throws Exception {
        Path source = TestImages.writeJpeg(root.resolve("late.jpg"), 40, 40);
        limiter.shutdown(Duration.ZERO);
        ProcessingIntent intent = intent(source);

        FileOutcome outcome = coordinator.handle(intent).get(5, TimeUnit.SECONDS);

        assertThat(outcome.state()).isEqualTo(FileState.SKIPPED);
        assertThat(outcome.reason()).startsWith("not started");
        verify(coalescer).release(intent);
        verifyNoInteractions(engine);
    }

    @Test
    void should_ReportDrained_When_NothingOutstanding() {
        assertThat(coordinator.awaitDrain(Duration.ofMillis(10))).isTrue();
    }

    private static ProcessingIntent intent(Path source) throws Exception {
        return new ProcessingIntent(source, FileStat.of(source), 1L, Instant.now());
    }

    private static ProcessingResult result(Path source, List<VariantFailure> failures) {
        SourceImage image = new SourceImage(source, 800, 600, 1_000L, Instant.EPOCH, ImageContainer.JPEG);
        DerivedVariant thumbnail = new DerivedVariant("thumbnail", source.resolveSibling("x-150x150.jpg"),
            150, 150, "image/jpeg", 100L, List.of());
        return new ProcessingResult(image, List.of(thumbnail), failures, CaptureMetadata.createdAt(0L), 5L);
    }
}
