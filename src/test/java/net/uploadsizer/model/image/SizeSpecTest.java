package net.uploadsizer.model.image;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class SizeSpecTest {

    @Test
    void should_RejectSpec_When_BothBoundsAreZero() {
        assertThatThrownBy(() -> SizeSpec.fit("full", 0, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("full");
    }

    @Test
    void should_RejectSpec_When_BoundIsNegative() {
        assertThatThrownBy(() -> SizeSpec.fit("bad", -1, 10)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void should_CropExactlyOnlyWithBothBounds_When_CropFlagSet() {
        assertThat(SizeSpec.cropped("thumb", 150, 150).cropsExactly()).isTrue();
        assertThat(new SizeSpec("wide", 600, 0, true).cropsExactly()).isFalse();
    }

    @Test
    void should_ProvideThumbnailMediumLarge_When_UsingDefaultCatalog() {
        SizeCatalog defaults = SizeCatalog.defaults(Instant.EPOCH);

        assertThat(defaults.source()).isEqualTo(CatalogSource.DEFAULT);
        assertThat(defaults.sizes().keySet()).containsExactly("thumbnail", "medium", "large");
        assertThat(defaults.sizes().get("thumbnail").crop()).isTrue();
        assertThat(defaults.asLastKnownGood().source()).isEqualTo(CatalogSource.LAST_KNOWN_GOOD);
    }
}
