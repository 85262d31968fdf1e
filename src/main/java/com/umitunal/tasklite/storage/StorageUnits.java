package com.umitunal.tasklite.storage;

import java.util.Locale;

/**
 * Byte-size formatting for log lines and diagnostics.
 */
public final class StorageUnits {
    private static final String[] UNITS = {"B", "KB", "MB", "GB"};

    private StorageUnits() {
    }

    /**
     * Format a byte count, e.g. {@code 1536 -> "1.5 KB"}.
     */
    public static String formatBytes(long bytes) {
        if (bytes <= 0) {
            return "0 B";
        }
        int unit = (int) Math.min(UNITS.length - 1, Math.floor(Math.log(bytes) / Math.log(1024)));
        double scaled = bytes / Math.pow(1024, unit);
        String number = String.format(Locale.ROOT, "%.2f", scaled)
                .replaceAll("0+$", "")
                .replaceAll("\\.$", "");
        return number + " " + UNITS[unit];
    }
}
