package com.airlinesim.booking.util;

import java.util.Locale;

public final class StringUtils {

    private StringUtils() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Trims and upper-cases flight numbers, seat numbers and codes. Null stays null.
     */
    public static String normalizeCode(String code) {
        if (code == null) {
            return null;
        }
        return code.trim().toUpperCase(Locale.ROOT);
    }

    public static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
