package com.govmatrix.extract.util;

import java.util.Locale;

public final class AddressUtils {

    private AddressUtils() {}

    public static String normalize(String address) {
        if (address == null) {
            return null;
        }
        String trimmed = address.trim();
        return trimmed.isEmpty() ? null : trimmed.toLowerCase(Locale.ROOT);
    }

    public static String shorten(String address) {
        if (address == null || address.isBlank()) {
            return "";
        }
        return address.length() <= 10 ? address : address.substring(0, 10) + "...";
    }

    public static String slugForFiles(String slug) {
        if (slug == null || slug.isBlank()) {
            return "unknown";
        }
        return slug.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9._-]+", "_");
    }
}
