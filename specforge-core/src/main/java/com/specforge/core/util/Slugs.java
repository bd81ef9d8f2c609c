package com.specforge.core.util;

import java.util.Locale;

/**
 * Identifier slug helpers.
 */
public final class Slugs {

    private Slugs() {
        // Utility class
    }

    /**
     * Converts free text to a lower-case, hyphen-separated slug.
     *
     * <p>Example: {@code "Example Name"} becomes {@code "example-name"}.
     *
     * @param text text to slugify
     * @return slug, empty when the text has no alphanumeric characters
     */
    public static String slugify(String text) {
        if (text == null) {
            return "";
        }
        return text.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9]+", "-")
            .replaceAll("^-+|-+$", "");
    }

    /**
     * Normalizes a markdown heading into a section key.
     *
     * <p>Lower-cases, replaces {@code &} with {@code and}, collapses every run of other
     * characters to {@code _} and trims leading and trailing underscores.
     *
     * @param heading heading text
     * @return normalized key
     */
    public static String sectionKey(String heading) {
        if (heading == null) {
            return "";
        }
        return heading.toLowerCase(Locale.ROOT)
            .replace("&", "and")
            .replaceAll("[^a-z0-9]+", "_")
            .replaceAll("^_+|_+$", "");
    }
}
