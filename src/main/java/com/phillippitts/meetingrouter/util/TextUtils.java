package com.phillippitts.meetingrouter.util;

import java.util.Locale;

/** String helpers shared by routing, formatting and privacy-safe logging. */
public final class TextUtils {

    private TextUtils() {}

    /**
     * Lower-cases and trims for case-insensitive matching; returns "" for null.
     */
    public static String normalize(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT).trim();
    }

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String preview(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    public static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /**
     * Returns the first argument that is neither null nor blank, or {@code null}.
     */
    public static String firstNonBlank(String... values) {
        for (String value : values) {
            if (!isBlank(value)) {
                return value;
            }
        }
        return null;
    }
}
