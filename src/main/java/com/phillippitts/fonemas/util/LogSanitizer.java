package com.phillippitts.fonemas.util;

/** Keeps user text short and on one line before it reaches a log file. */
public final class LogSanitizer {

    /** Default preview length for input text in log lines. */
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
     * Truncates to {@link #DEFAULT_PREVIEW} characters and flattens line breaks, so a
     * multi-line input cannot forge extra log lines.
     */
    public static String preview(String s) {
        String truncated = truncate(s, DEFAULT_PREVIEW);
        String flattened = truncated.replace('\r', ' ').replace('\n', ' ');
        return s != null && s.length() > DEFAULT_PREVIEW ? flattened + "..." : flattened;
    }
}
