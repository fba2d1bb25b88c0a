package com.phillippitts.sermonflow.util;

import java.nio.file.Path;

/** Utility for privacy-safe logging of user supplied strings. */
public final class LogSanitizer {

    private static final int MAX_LOGGED = 80;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters and strip control characters; returns "" for
     * null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String clean = s.replaceAll("\\p{Cntrl}", " ");
        return clean.length() <= max ? clean : clean.substring(0, max);
    }

    /** Title or speaker name, shortened for logs. */
    public static String text(String s) {
        return truncate(s, MAX_LOGGED);
    }

    /** File name only; directories may contain the user's name. */
    public static String fileName(Path path) {
        if (path == null || path.getFileName() == null) {
            return "";
        }
        return truncate(path.getFileName().toString(), MAX_LOGGED);
    }
}
