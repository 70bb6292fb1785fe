package com.dailyresearch.pipeline.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/** Written once per {@code #keep} → {@code #kept} transition. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PromotionRecord {
    /** {@link Fingerprint#key()} of the promoted item. */
    private String fingerprint;
    private String topicSlug;
    private Instant promotedAt;
    private String title;
    private String url;
    private String libraryPath;
    private String sourceNote;

    public PromotionRecord() {}

    public PromotionRecord(String fingerprint, String topicSlug, Instant promotedAt) {
        this.fingerprint = fingerprint;
        this.topicSlug = topicSlug;
        this.promotedAt = promotedAt;
    }

    public String getFingerprint() { return fingerprint; }
    public void setFingerprint(String fingerprint) { this.fingerprint = fingerprint; }
    public String getTopicSlug() { return topicSlug; }
    public void setTopicSlug(String topicSlug) { this.topicSlug = topicSlug; }
    public Instant getPromotedAt() { return promotedAt; }
    public void setPromotedAt(Instant promotedAt) { this.promotedAt = promotedAt; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public String getLibraryPath() { return libraryPath; }
    public void setLibraryPath(String libraryPath) { this.libraryPath = libraryPath; }
    public String getSourceNote() { return sourceNote; }
    public void setSourceNote(String sourceNote) { this.sourceNote = sourceNote; }
}
