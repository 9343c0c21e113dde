package com.phillippitts.callbridge.util;

/** Utility for privacy-safe logging of caller numbers and frame previews. */
public final class LogSanitizer {

    private static final int VISIBLE_DIGITS = 4;

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
     * Masks all but the last four characters of a phone number.
     * Values of four characters or fewer, and {@code "unknown"}, are returned unchanged.
     */
    public static String maskPhone(String phone) {
        if (phone == null) {
            return "";
        }
        if (phone.length() <= VISIBLE_DIGITS || "unknown".equals(phone)) {
            return phone;
        }
        int hidden = phone.length() - VISIBLE_DIGITS;
        return "*".repeat(hidden) + phone.substring(hidden);
    }
}
