package com.phillippitts.spoofstream.util;

/** Utility for log-safe previews of client-supplied text. */
public final class LogSanitizer {

    private static final int DEFAULT_MAX = 64;

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
     * Makes a client-supplied value safe for a single log line: control characters
     * (including CR/LF) are replaced and the result is truncated.
     */
    public static String clean(String s) {
        if (s == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(Math.min(s.length(), DEFAULT_MAX));
        for (int i = 0; i < s.length() && i < DEFAULT_MAX; i++) {
            char c = s.charAt(i);
            sb.append(Character.isISOControl(c) ? '_' : c);
        }
        return s.length() > DEFAULT_MAX ? sb + "..." : sb.toString();
    }
}
