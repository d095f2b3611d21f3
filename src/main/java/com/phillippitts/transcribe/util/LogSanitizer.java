package com.phillippitts.transcribe.util;

/** Utility for privacy-safe logging of client-supplied strings. */
public final class LogSanitizer {

    private static final int MAX_FILENAME_CHARS = 128;

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
     * Makes a client-supplied filename safe for a single log line: control characters
     * (including CR/LF) become '_' and the result is truncated.
     */
    public static String filename(String name) {
        String truncated = truncate(name, MAX_FILENAME_CHARS);
        StringBuilder sb = new StringBuilder(truncated.length());
        for (int i = 0; i < truncated.length(); i++) {
            char c = truncated.charAt(i);
            sb.append(Character.isISOControl(c) ? '_' : c);
        }
        return sb.toString();
    }
}
