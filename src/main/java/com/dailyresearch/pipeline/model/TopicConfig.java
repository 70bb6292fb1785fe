package com.dailyresearch.pipeline.model;

import java.util.List;

/** A configured research topic track. Immutable. */
public final class TopicConfig {
    private final String slug;
    private final String displayName;
    private final double weight;
    private final List<String> searchQueries;

    public TopicConfig(String slug, String displayName, double weight, List<String> searchQueries) {
        this.slug = slug;
        this.displayName = displayName == null || displayName.isBlank() ? slug : displayName;
        this.weight = weight;
        this.searchQueries = searchQueries == null ? List.of() : List.copyOf(searchQueries);
    }

    public String getSlug() { return slug; }
    public String getDisplayName() { return displayName; }
    public double getWeight() { return weight; }
    public List<String> getSearchQueries() { return searchQueries; }

    /** Queries to issue; falls back to the display name when none are configured. */
    public List<String> effectiveQueries() {
        return searchQueries.isEmpty() ? List.of(displayName) : searchQueries;
    }

    @Override
    public String toString() {
        return slug + "(x" + weight + ")";
    }
}
