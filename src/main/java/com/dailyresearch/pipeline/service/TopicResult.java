package com.dailyresearch.pipeline.service;

import com.dailyresearch.pipeline.model.ContentItem;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Output of one track (a topic, or the must-follow track) before cross-topic
 * dedup: surviving items in rank order plus what was dropped on the way.
 */
public final class TopicResult {
    public static final String MUST_FOLLOW = "must-follow";

    private final String slug;
    private final String displayName;
    private final List<ContentItem> items;
    private final int fetched;
    private final int fetchCalls;
    private final Map<String, Integer> spamReasons;
    private final int floorDropped;
    private final List<String> fetchErrors;
    private final boolean failed;

    public TopicResult(String slug, String displayName, List<ContentItem> items, int fetched, int fetchCalls,
                       Map<String, Integer> spamReasons, int floorDropped, List<String> fetchErrors, boolean failed) {
        this.slug = slug;
        this.displayName = displayName;
        this.items = List.copyOf(items);
        this.fetched = fetched;
        this.fetchCalls = fetchCalls;
        this.spamReasons = Collections.unmodifiableMap(new TreeMap<>(spamReasons));
        this.floorDropped = floorDropped;
        this.fetchErrors = List.copyOf(fetchErrors);
        this.failed = failed;
    }

    public static TopicResult failed(String slug, String displayName, String error) {
        return new TopicResult(slug, displayName, List.of(), 0, 0, Map.of(), 0, List.of(error), true);
    }

    public String getSlug() { return slug; }
    public String getDisplayName() { return displayName; }
    public List<ContentItem> getItems() { return items; }
    public int getFetched() { return fetched; }
    public int getFetchCalls() { return fetchCalls; }
    public Map<String, Integer> getSpamReasons() { return spamReasons; }
    public int getFloorDropped() { return floorDropped; }
    public List<String> getFetchErrors() { return fetchErrors; }
    /** Every fetch call of the track failed (or the track itself blew up). */
    public boolean isFailed() { return failed; }

    public int getSpamDropped() {
        return spamReasons.values().stream().mapToInt(Integer::intValue).sum();
    }

    public boolean isMustFollow() {
        return MUST_FOLLOW.equals(slug);
    }
}
