package com.hometown.happiness.util;

import java.util.Locale;

public class TeamNameNormalizer {
    public static String normalize(String name) {
        if (name == null) return null;
        return name.trim()
                .replaceAll("\\s+", " ")
                .toLowerCase(Locale.ROOT);
    }

    /**
     * Id-safe form of a display name: normalized, spaces to hyphens, dots dropped, slashes to hyphens.
     * "St. Louis" -> "st-louis", "Toronto Maple Leafs" -> "toronto-maple-leafs".
     */
    public static String slugify(String name) {
        String n = normalize(name);
        if (n == null) return "";
        return n.replace(" ", "-")
                .replace(".", "")
                .replace("/", "-");
    }

    /** City slug, suffixed with the lowercase state code when one is known ("new-york-ny"). */
    public static String citySlug(String city, String state) {
        String base = slugify(city);
        if (state != null && !state.isBlank()) {
            return base + "-" + state.trim().toLowerCase(Locale.ROOT);
        }
        return base;
    }
}
