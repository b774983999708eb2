package com.phillippitts.speechstream.util;

/** Utility for privacy-safe logging of transcript previews and client-supplied ids. */
public final class LogSanitizer {

    private static final int MAX_ID_LENGTH = 64;

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
     * Makes a client-supplied identifier safe for a single log line: control characters become
     * '_' and the result is capped at 64 characters.
     */
    public static String safeId(String id) {
        if (id == null) {
            return "";
        }
        String capped = truncate(id, MAX_ID_LENGTH);
        StringBuilder sb = new StringBuilder(capped.length());
        for (int i = 0; i < capped.length(); i++) {
            char c = capped.charAt(i);
            sb.append(Character.isISOControl(c) ? '_' : c);
        }
        return sb.toString();
    }
}
