package net.uploadsizer.util;

import java.time.Duration;

/**
 * Formats uptime as {@code 2d 3h 4m}, {@code 3h 4m}, {@code 4m 5s} or {@code 5s}.
 */
public final class UptimeFormatter {

    private UptimeFormatter() {
    }

    public static String format(Duration uptime) {
        if (uptime == null || uptime.isNegative()) {
            return "0s";
        }
        long days = uptime.toDays();
        long hours = uptime.toHoursPart();
        long minutes = uptime.toMinutesPart();
        long seconds = uptime.toSecondsPart();

        if (days > 0) {
            return days + "d " + hours + "h " + minutes + "m";
        }
        if (hours > 0) {
            return hours + "h " + minutes + "m";
        }
        if (minutes > 0) {
            return minutes + "m " + seconds + "s";
        }
        return seconds + "s";
    }
}
