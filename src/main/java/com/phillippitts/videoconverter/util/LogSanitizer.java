package com.phillippitts.videoconverter.util;

/** Utility for bounding process output before it reaches logs or status messages. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Keep at most max trailing characters, trimmed; returns "" for null.
     *
     * <p>Encoders print the fatal diagnostic last, so the tail is the useful part of stderr.
     */
    public static String tail(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String cut = s.length() <= max ? s : s.substring(s.length() - max);
        return cut.strip();
    }
}
