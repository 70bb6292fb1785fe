package com.dailyresearch.pipeline.util;

import org.jsoup.Jsoup;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Utilities for cleaning, normalizing and comparing item titles.
 *
 * <p>Sanitization is conservative: it drops markup, trims whitespace, normalizes
 * non-breaking spaces, and removes only obvious leading/trailing separator
 * garbage such as standalone dashes ("-", "–", "—"), pipes, or colons.
 * Normalization (for dedup) additionally lower-cases the result.
 */
public final class TitleUtils {
    /** Titles this short or shorter are too generic to dedup on. */
    public static final int MIN_DEDUP_TITLE_LENGTH = 10;

    private TitleUtils() {}

    /**
     * Returns a cleaned version of the given title string for display.
     *
     * <p>Rules applied in order:
     * <ol>
     *   <li>Strip HTML tags and decode entities, if any are present</li>
     *   <li>Convert non-breaking spaces to regular spaces</li>
     *   <li>Collapse repeated whitespace</li>
     *   <li>Trim leading/trailing whitespace</li>
     *   <li>Strip leading/trailing separator garbage (dashes, pipes, colons, bullets)</li>
     * </ol>
     *
     * <p>If the result becomes empty, returns a trimmed original as a fallback.
     */
    public static String sanitizeTitle(String input) {
        if (input == null) return null;
        String s = input.indexOf('<') >= 0 || input.indexOf('&') >= 0 ? plainText(input) : input;
        s = s.replace(' ', ' ');
        s = s.replaceAll("\\s+", " ").trim();

        // Two passes catch mixed sequences like "— |".
        for (int i = 0; i < 2; i++) {
            s = s.replaceAll("^(?:[\\s]*[\\-–—|:;·•]+[\\s]*)+", "");
            s = s.replaceAll("(?:[\\s]*[\\-–—|:;·•]+[\\s]*)+$", "");
        }
        s = s.trim();
        return s.isEmpty() ? input.trim() : s;
    }

    /** Text content of an HTML fragment: tags dropped, entities decoded. */
    public static String plainText(String html) {
        if (html == null) return "";
        return Jsoup.parseBodyFragment(html).text();
    }

    /** Dedup form of a title: lower-cased with whitespace collapsed. Never null. */
    public static String normalize(String title) {
        if (title == null) return "";
        return title.replace(' ', ' ')
                .replaceAll("\\s+", " ")
                .trim()
                .toLowerCase(Locale.ROOT);
    }

    public static int wordCount(String normalized) {
        return words(normalized).size();
    }

    /**
     * Share of words two normalized titles have in common, relative to the
     * longer of the two (0.0 - 1.0).
     */
    public static double wordOverlap(String a, String b) {
        Set<String> wa = words(a);
        Set<String> wb = words(b);
        if (wa.isEmpty() || wb.isEmpty()) return 0.0;
        Set<String> common = new LinkedHashSet<>(wa);
        common.retainAll(wb);
        return (double) common.size() / Math.max(wa.size(), wb.size());
    }

    private static Set<String> words(String s) {
        if (s == null || s.isBlank()) return Set.of();
        return new LinkedHashSet<>(Arrays.asList(s.trim().split("\\s+")));
    }

    /** Kebab-case file name slug, at most 60 characters; "untitled" when nothing is left. */
    public static String slugify(String title) {
        if (title == null) return "untitled";
        String slug = title.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9\\s-]", "")
                .replaceAll("[\\s_]+", "-")
                .replaceAll("-+", "-")
                .replaceAll("^-|-$", "");
        if (slug.length() > 60) {
            slug = slug.substring(0, 60).replaceAll("-$", "");
        }
        return slug.isEmpty() ? "untitled" : slug;
    }

    public static String truncate(String s, int max) {
        if (s == null) return "";
        return s.length() > max ? s.substring(0, max) + "..." : s;
    }
}
