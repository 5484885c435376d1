package com.phillippitts.jukebox.util;

/** Utility for short, single-line log previews of user supplied text. */
public final class LogSanitizer {

    /** Default preview length for announcement texts. */
    public static final int DEFAULT_PREVIEW = 50;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview: line breaks collapsed to spaces, truncated to {@link #DEFAULT_PREVIEW}
     * with a trailing ellipsis when shortened.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String flat = s.replaceAll("[\\r\\n]+", " ");
        return flat.length() <= DEFAULT_PREVIEW ? flat : truncate(flat, DEFAULT_PREVIEW) + "...";
    }
}
