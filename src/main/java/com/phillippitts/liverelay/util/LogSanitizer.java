package com.phillippitts.liverelay.util;

/** Utility for privacy-safe logging of user text and binary payloads. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }

    /**
     * Describes a payload by size only, e.g. {@code "2048B"}; never logs content.
     */
    public static String describe(byte[] payload) {
        return (payload == null ? 0 : payload.length) + "B";
    }
}
