package com.newsbrief.pipeline.util;

import java.util.Locale;

public final class ByteSizes {

    private static final double MB = 1024.0 * 1024.0;

    private ByteSizes() {
    }

    public static double toMegabytes(long bytes) {
        return Math.round(bytes / MB * 100.0) / 100.0;
    }

    /**
     * 사람이 읽기 쉬운 크기 (예: 512 B, 12.5 KB, 3.20 MB)
     */
    public static String format(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }
        if (bytes < 1024 * 1024) {
            return String.format(Locale.ROOT, "%.1f KB", bytes / 1024.0);
        }
        return String.format(Locale.ROOT, "%.2f MB", bytes / MB);
    }
}
