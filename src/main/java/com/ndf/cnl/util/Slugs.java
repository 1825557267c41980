package com.ndf.cnl.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes human-readable labels into id fragments.
 *
 * <p>
 * {@code "Hydrogen ion"} becomes {@code "hydrogen_ion"}; every run of
 * characters that is neither a letter nor a digit collapses to a single
 * underscore and leading or trailing underscores are dropped.
 */
public final class Slugs {
    /** Placeholder for an empty slot in a composite id. */
    public static final String EMPTY = "-";

    private static final Pattern SEPARATORS = Pattern.compile("[^\\p{L}\\p{N}]+");

    private Slugs() {
        // Utility class
    }

    /** Returns the slug of {@code label}, or an empty string for null/blank input. */
    public static String slug(String label) {
        if (label == null)
            return "";
        String s = SEPARATORS.matcher(label.trim().toLowerCase(Locale.ROOT)).replaceAll("_");
        int start = 0, end = s.length();
        while (start < end && s.charAt(start) == '_')
            start++;
        while (end > start && s.charAt(end - 1) == '_')
            end--;
        return s.substring(start, end);
    }

    /** Like {@link #slug(String)} but yields {@link #EMPTY} instead of an empty string. */
    public static String slot(String label) {
        String s = slug(label);
        return s.isEmpty() ? EMPTY : s;
    }

    /** Trims {@code s} and maps blank strings to null. */
    public static String blankToNull(String s) {
        if (s == null)
            return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
