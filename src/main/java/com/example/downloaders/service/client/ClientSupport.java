package com.example.downloaders.service.client;

import java.time.Instant;

/** Small conversions shared by the protocol adapters. */
final class ClientSupport {

    private ClientSupport() {}

    /** {@code fraction} in 0..1 as an integer percentage. */
    static int percentOfFraction(double fraction) {
        return clamp((int) Math.round(fraction * 100));
    }

    static int percent(long done, long total) {
        return total > 0 ? clamp((int) Math.round(done * 100.0 / total)) : 0;
    }

    static int clamp(int progress) {
        return Math.max(0, Math.min(100, progress));
    }

    /** Unix seconds, null when zero or negative. */
    static Instant epochSeconds(long seconds) {
        return seconds > 0 ? Instant.ofEpochSecond(seconds) : null;
    }

    static String firstNonBlank(String preferred, String fallback) {
        if (preferred != null && !preferred.isBlank()) {
            return preferred;
        }
        return fallback != null && !fallback.isBlank() ? fallback : null;
    }

    static String joinPath(String directory, String child) {
        if (directory.endsWith("/") || directory.endsWith("\\")) {
            return directory + child;
        }
        return directory + "/" + child;
    }
}
