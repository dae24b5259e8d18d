package net.uploadsizer.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class UptimeFormatterTest {

    @Test
    void should_ShowDaysHoursMinutes_When_UptimeExceedsOneDay() {
        assertThat(UptimeFormatter.format(Duration.ofDays(2).plusHours(3).plusMinutes(4).plusSeconds(5)))
            .isEqualTo("2d 3h 4m");
    }

    @Test
    void should_ShowHoursMinutes_When_UptimeUnderOneDay() {
        assertThat(UptimeFormatter.format(Duration.ofHours(5).plusMinutes(7))).isEqualTo("5h 7m");
    }

    @Test
    void should_ShowMinutesSeconds_When_UptimeUnderOneHour() {
        assertThat(UptimeFormatter.format(Duration.ofMinutes(12).plusSeconds(9))).isEqualTo("12m 9s");
    }

    @Test
    void should_ShowSeconds_When_UptimeUnderOneMinute() {
        assertThat(UptimeFormatter.format(Duration.ofSeconds(42))).isEqualTo("42s");
        assertThat(UptimeFormatter.format(Duration.ofSeconds(-3))).isEqualTo("0s");
    }
}
