package com.phillippitts.labreasoning.util;

/** Utility for privacy-safe logging of model replies and clinical text previews. */
public final class LogSanitizer {

    /** Default preview length for model replies in log lines. */
    public static final int DEFAULT_PREVIEW = 120;

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
     * Single-line preview of a model reply: newlines collapsed, truncated to {@link #DEFAULT_PREVIEW}.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        return truncate(s.replaceAll("\\s+", " ").trim(), DEFAULT_PREVIEW);
    }
}
