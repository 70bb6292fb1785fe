package com.dailyresearch.pipeline.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Platform an item was discovered on. Each source names the engagement metric
 * the engagement floor is checked against (web items have none).
 */
public enum Source {
    REDDIT("reddit", "score"),
    X("x", "likes"),
    WEB("web", null);

    private final String slug;
    private final String primaryMetric;

    Source(String slug, String primaryMetric) {
        this.slug = slug;
        this.primaryMetric = primaryMetric;
    }

    @JsonValue
    public String getSlug() { return slug; }

    /** Engagement metric key used for the floor and engagement points, or null. */
    public String getPrimaryMetric() { return primaryMetric; }

    public static Source fromSlug(String slug) {
        if (slug == null) return WEB;
        for (Source s : values()) {
            if (s.slug.equalsIgnoreCase(slug.trim())) return s;
        }
        return WEB;
    }
}
