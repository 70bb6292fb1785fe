package com.dailyresearch.pipeline.model;

import com.dailyresearch.pipeline.util.TitleUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Mutable set of seen fingerprints with the duplicate test used everywhere:
 * a candidate is seen when its URL matches a seen URL, or its title matches
 * (exactly, or by word overlap at or above the similarity threshold) a seen title.
 *
 * <p>Remembers the first origin recorded for each key.
 */
public class FingerprintSet {
    private final double titleSimilarityThreshold;
    private final Map<String, String> urls = new LinkedHashMap<>();
    private final Map<String, String> titles = new LinkedHashMap<>();

    public FingerprintSet(double titleSimilarityThreshold) {
        this.titleSimilarityThreshold = titleSimilarityThreshold;
    }

    public void add(Fingerprint fp, String origin) {
        if (fp.hasUrl()) urls.putIfAbsent(fp.getNormalizedUrl(), origin);
        if (fp.hasTitle()) titles.putIfAbsent(fp.getNormalizedTitle(), origin);
    }

    public boolean matches(Fingerprint fp) {
        return originOf(fp) != null;
    }

    /** Origin of the entry the candidate collides with, or null when unseen. */
    public String originOf(Fingerprint fp) {
        if (fp.hasUrl()) {
            String o = urls.get(fp.getNormalizedUrl());
            if (o != null) return o;
        }
        if (!fp.hasTitle()) return null;
        String exact = titles.get(fp.getNormalizedTitle());
        if (exact != null) return exact;
        if (TitleUtils.wordCount(fp.getNormalizedTitle()) < 3) return null;
        for (Map.Entry<String, String> e : titles.entrySet()) {
            if (TitleUtils.wordOverlap(fp.getNormalizedTitle(), e.getKey()) >= titleSimilarityThreshold) {
                return e.getValue();
            }
        }
        return null;
    }

    public Set<String> urls() {
        return Collections.unmodifiableSet(urls.keySet());
    }

    public Set<String> titles() {
        return Collections.unmodifiableSet(titles.keySet());
    }

    public Map<String, String> urlOrigins() {
        return Collections.unmodifiableMap(urls);
    }

    public Map<String, String> titleOrigins() {
        return Collections.unmodifiableMap(titles);
    }

    public double getTitleSimilarityThreshold() {
        return titleSimilarityThreshold;
    }
}
