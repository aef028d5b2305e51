package com.labbackup.api.util;

import java.time.Duration;

/**
 * Display formatting for sizes and durations in API responses.
 */
public final class FormatUtils {

    private static final String[] BYTE_UNITS = {"B", "KB", "MB", "GB", "TB", "PB"};

    private FormatUtils() {
    }

    /**
     * Binary units with two decimals, e.g. "1.50 GB". Null and zero format as "0 B".
     */
    public static String formatBytes(Long bytes) {
        if (bytes == null || bytes <= 0) {
            return "0 B";
        }
        int unitIndex = 0;
        double size = bytes;
        while (size >= 1024 && unitIndex < BYTE_UNITS.length - 1) {
            size /= 1024;
            unitIndex++;
        }
        return String.format("%.2f %s", size, BYTE_UNITS[unitIndex]);
    }

    public static String formatBytes(long bytes) {
        return formatBytes(Long.valueOf(bytes));
    }

    /**
     * Coarse human duration for restore estimates: "45s", "12m 5s", "3h 20m".
     */
    public static String formatDuration(long seconds) {
        if (seconds <= 0) {
            return "0s";
        }
        Duration d = Duration.ofSeconds(seconds);
        if (d.toHours() > 0) {
            return d.toHours() + "h " + d.toMinutesPart() + "m";
        }
        if (d.toMinutes() > 0) {
            return d.toMinutes() + "m " + d.toSecondsPart() + "s";
        }
        return d.getSeconds() + "s";
    }
}
