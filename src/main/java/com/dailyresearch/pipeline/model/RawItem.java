package com.dailyresearch.pipeline.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Record returned by a fetch collaborator before any pipeline stage runs.
 *
 * <p>Metrics the platform did not report are simply missing from
 * {@link #getEngagement()}; fetchers must never put a zero in for them.
 */
public class RawItem {
    private Source source;
    private String url;
    private String title;
    private String author;
    /** Subreddit or similar grouping, if the platform has one. */
    private String community;
    private Instant publishedAt;
    private Map<String, Integer> engagement = new LinkedHashMap<>();
    private String text;

    public RawItem() {}

    public RawItem(Source source, String url, String title) {
        this.source = source;
        this.url = url;
        this.title = title;
    }

    public Source getSource() { return source; }
    public void setSource(Source source) { this.source = source; }
    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public String getAuthor() { return author; }
    public void setAuthor(String author) { this.author = author; }
    public String getCommunity() { return community; }
    public void setCommunity(String community) { this.community = community; }
    public Instant getPublishedAt() { return publishedAt; }
    public void setPublishedAt(Instant publishedAt) { this.publishedAt = publishedAt; }
    public Map<String, Integer> getEngagement() { return Collections.unmodifiableMap(engagement); }
    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public void setEngagement(Map<String, Integer> engagement) {
        this.engagement = new LinkedHashMap<>();
        if (engagement != null) {
            engagement.forEach(this::putMetric);
        }
    }

    /** Records a metric; a null value is treated as "not reported" and ignored. */
    public RawItem putMetric(String name, Integer value) {
        if (name != null && value != null) {
            engagement.put(name, value);
        }
        return this;
    }
}
