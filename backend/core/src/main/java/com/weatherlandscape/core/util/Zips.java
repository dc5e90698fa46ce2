package com.weatherlandscape.core.util;

import java.util.regex.Pattern;

public final class Zips {
    private static final Pattern FIVE_DIGITS = Pattern.compile("\\d{5}");

    private Zips() {
    }

    public static boolean isValid(String zip) {
        return zip != null && FIVE_DIGITS.matcher(zip).matches();
    }

    public static String normalize(String zip) {
        String normalized = zip == null ? "" : zip.trim();
        if (!isValid(normalized)) {
            throw new IllegalArgumentException("ZIP must be exactly 5 digits: '" + normalized + "'");
        }
        return normalized;
    }
}
