package net.uploadsizer.support.watch;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CandidateFileFilterTest {

    private final CandidateFileFilter filter = new CandidateFileFilter(
        List.of("**/*.{jpg,jpeg,png,gif,webp,bmp,tiff,tif}"),
        List.of("**/node_modules/**", "**/.git/**", "**/thumbs/**"));

    @ParameterizedTest
    @ValueSource(strings = {"photo.jpg", "photo.JPEG", "scan.tif", "anim.gif", "pic.webp"})
    void should_AcceptSource_When_NameIsPlainImage(String name) {
        assertThat(filter.isCandidate(Path.of("/uploads/2024", name))).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"photo-150x150.jpg", "photo.jpg.backup", "notes.txt", ".photo-1x1.jpg.tmp-abc", "photo-300x225.webp"})
    void should_RejectPath_When_NameIsOutputOrUnsupported(String name) {
        assertThat(filter.isCandidate(Path.of("/uploads", name))).isFalse();
    }

    @Test
    void should_IncludeFiles_When_AtRootOrNested() {
        assertThat(filter.isIncluded(Path.of("a.jpg"))).isTrue();
        assertThat(filter.isIncluded(Path.of("2024/05/A.JPG"))).isTrue();
        assertThat(filter.isIncluded(Path.of("2024/05/a.txt"))).isFalse();
    }

    @Test
    void should_ExcludeFiles_When_UnderIgnoredDirectory() {
        assertThat(filter.isIncluded(Path.of("node_modules/pkg/logo.png"))).isFalse();
        assertThat(filter.isIncluded(Path.of("2024/thumbs/a.jpg"))).isFalse();
        assertThat(filter.isIgnoredDirectory(Path.of(".git"))).isTrue();
        assertThat(filter.isIgnoredDirectory(Path.of("2024/thumbs"))).isTrue();
        assertThat(filter.isIgnoredDirectory(Path.of("2024"))).isFalse();
    }
}
