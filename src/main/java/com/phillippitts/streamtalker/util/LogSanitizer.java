package com.phillippitts.streamtalker.util;

/** Utility for privacy-safe logging of chat text. */
public final class LogSanitizer {

    /** Default preview length used for chat text in log lines. */
    public static final int DEFAULT_PREVIEW = 40;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Truncated preview with line breaks flattened, so user text cannot forge extra log lines.
     */
    public static String preview(String s) {
        return truncate(s, DEFAULT_PREVIEW).replace('\n', ' ').replace('\r', ' ');
    }

    /** First twelve characters of a cache key. */
    public static String shortKey(String key) {
        return truncate(key, 12);
    }
}
