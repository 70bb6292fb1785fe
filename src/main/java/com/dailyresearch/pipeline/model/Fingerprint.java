package com.dailyresearch.pipeline.model;

import com.dailyresearch.pipeline.util.TitleUtils;
import com.dailyresearch.pipeline.util.UrlUtils;

import java.util.Objects;

/**
 * Dedup key derived from an item's URL and title.
 *
 * <p>Either half may be empty: a bare heading from a note has no URL, and a
 * title of {@value TitleUtils#MIN_DEDUP_TITLE_LENGTH} characters or fewer is
 * too generic to dedup on, so its title key is left blank.
 */
public final class Fingerprint {
    private final String normalizedUrl;
    private final String normalizedTitle;

    private Fingerprint(String normalizedUrl, String normalizedTitle) {
        this.normalizedUrl = normalizedUrl;
        this.normalizedTitle = normalizedTitle;
    }

    public static Fingerprint of(String url, String title) {
        String t = TitleUtils.normalize(title);
        if (t.length() <= TitleUtils.MIN_DEDUP_TITLE_LENGTH) {
            t = "";
        }
        return new Fingerprint(UrlUtils.normalize(url), t);
    }

    public String getNormalizedUrl() { return normalizedUrl; }
    public String getNormalizedTitle() { return normalizedTitle; }

    public boolean hasUrl() { return !normalizedUrl.isEmpty(); }
    public boolean hasTitle() { return !normalizedTitle.isEmpty(); }

    /** Promotion ledger key: the URL when there is one, the title otherwise. */
    public String key() {
        return hasUrl() ? normalizedUrl : normalizedTitle;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Fingerprint)) return false;
        Fingerprint that = (Fingerprint) o;
        return normalizedUrl.equals(that.normalizedUrl) && normalizedTitle.equals(that.normalizedTitle);
    }

    @Override
    public int hashCode() {
        return Objects.hash(normalizedUrl, normalizedTitle);
    }

    @Override
    public String toString() {
        return normalizedUrl + "|" + normalizedTitle;
    }
}
